package org.broadinstitute.mutator.utils.variant;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * This class contains any constants (primarily INFO keys and symbolic alleles) in the GVCF files read and written
 * by the mutator. Note that VCF-standard constants are in VCFConstants, in htsjdk.  Keys in header lines should
 * have matching entries in MutatorVCFHeaderLines
 */
public final class MutatorVCFConstants {

    private MutatorVCFConstants() {}

    // Symbolic alleles
    public static final String NON_REF_SYMBOLIC_ALLELE_NAME = "NON_REF";
    public static final String NON_REF_SYMBOLIC_ALLELE = "<" + NON_REF_SYMBOLIC_ALLELE_NAME + ">";

    // Separates the alternates of a multi-allelic site when they are held as one string
    public static final String ALT_ALLELE_SEPARATOR = ",";

    //INFO keys for assembly coordinates, carried through opaquely
    public static final String ASM_CHROMOSOME_KEY =     "ASM_Chr";
    public static final String ASM_START_KEY =          "ASM_Start";
    public static final String ASM_END_KEY =            "ASM_End";
    public static final String ASM_STRAND_KEY =         "ASM_Strand";

    public static final List<String> ASSEMBLY_ANNOTATION_KEYS = Collections.unmodifiableList(
            Arrays.asList(ASM_CHROMOSOME_KEY, ASM_START_KEY, ASM_END_KEY, ASM_STRAND_KEY));

    // Output naming
    public static final String MUTATED_SAMPLE_SUFFIX = "_mutated";
    public static final String GVCF_EXTENSION = ".g.vcf";
}
