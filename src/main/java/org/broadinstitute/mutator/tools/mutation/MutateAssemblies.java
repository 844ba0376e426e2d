package org.broadinstitute.mutator.tools.mutation;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.mutator.cmdline.CommandLineProgram;
import org.broadinstitute.mutator.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.mutator.cmdline.programgroups.VariantManipulationProgramGroup;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Introduces the variants of a non-founder GVCF into a founder GVCF.
 *
 * <p>The founder GVCF must hold a single sample and cover its contigs without overlapping records. Calls of the
 * non-founder GVCF are applied in file order: SNPs replace founder SNPs, and SNPs or insertions falling inside a
 * founder reference block split it. Overlapping indels and other unsupported overlaps are skipped and counted.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   mutator MutateAssemblies \
 *     --founder-gvcf founder.g.vcf.gz \
 *     --non-founder-gvcf donor.g.vcf.gz \
 *     --output-dir mutated/
 * </pre>
 * The output is written to {@code mutated/<founder sample>_mutated.g.vcf}.
 */
@CommandLineProgramProperties(
        summary = "Overlays the variants of a non-founder GVCF onto a single-sample founder GVCF and writes the " +
                "result as <sample>_mutated.g.vcf in the output directory",
        oneLineSummary = "Introduce non-founder variants into a founder GVCF",
        programGroup = VariantManipulationProgramGroup.class
)
public final class MutateAssemblies extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.FOUNDER_GVCF_LONG_NAME,
            shortName = StandardArgumentDefinitions.FOUNDER_GVCF_SHORT_NAME,
            doc = "Founder GVCF to mutate (.g.vcf or .g.vcf.gz)")
    public File founderGvcf;

    @Argument(fullName = StandardArgumentDefinitions.NON_FOUNDER_GVCF_LONG_NAME,
            shortName = StandardArgumentDefinitions.NON_FOUNDER_GVCF_SHORT_NAME,
            doc = "Non-founder GVCF to pull variants from (.g.vcf or .g.vcf.gz)")
    public File nonFounderGvcf;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_DIR_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_DIR_SHORT_NAME,
            doc = "Directory the mutated GVCF is written to; created if missing")
    public File outputDir;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (outputDir.exists() && !outputDir.isDirectory()) {
            errors.add("--" + StandardArgumentDefinitions.OUTPUT_DIR_LONG_NAME + " " + outputDir + " is not a directory");
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected Object doWork() {
        final OverlayResult result = new VariantOverlayEngine().overlay(founderGvcf.toPath(), nonFounderGvcf.toPath());
        final Path output = new MutatedGVCFWriter().write(outputDir.toPath(), result.getSampleName(), result.getVariants());
        logger.info("Mutated GVCF written to " + output);
        return output;
    }
}
