package org.broadinstitute.mutator.cmdline;

/**
 * A set of String constants in which the name of the argument (for the command line) is stored.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String FOUNDER_GVCF_LONG_NAME = "founder-gvcf";
    public static final String NON_FOUNDER_GVCF_LONG_NAME = "non-founder-gvcf";
    public static final String OUTPUT_DIR_LONG_NAME = "output-dir";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";

    public static final String FOUNDER_GVCF_SHORT_NAME = "F";
    public static final String NON_FOUNDER_GVCF_SHORT_NAME = "D";
    public static final String OUTPUT_DIR_SHORT_NAME = "O";

    /**
     * The option specifying a main configuration file.
     */
    public static final String MUTATOR_CONFIG_FILE_OPTION = "mutator-config-file";
}
