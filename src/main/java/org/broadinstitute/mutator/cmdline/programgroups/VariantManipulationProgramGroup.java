package org.broadinstitute.mutator.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that rewrite the calls of GVCF files
 */
public class VariantManipulationProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Variant Manipulation"; }

    @Override
    public String getDescription() { return "Tools that overlay and rewrite variant calls in GVCF files"; }
}
