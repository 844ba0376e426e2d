package org.broadinstitute.mutator.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.broadinstitute.mutator.utils.variant.MutatorVCFConstants;

/**
 * Configuration file for mutator options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation:
 *        1)   "file:${" + MutatorConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:MutatorConfig.properties",
 *        3)   "classpath:org/broadinstitute/mutator/utils/config/MutatorConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + MutatorConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                  // Variable for file loading
        "file:MutatorConfig.properties",                                                 // Default path
        "classpath:org/broadinstitute/mutator/utils/config/MutatorConfig.properties"    // Class path
})
public interface MutatorConfig extends Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link MutatorConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "MutatorConfig.pathToMutatorConfig";

    // ----------------------------------------------------------
    // Output Options:
    // ----------------------------------------------------------

    /** Appended to the sample name to form the output file name. */
    @Key("mutator.output.suffix")
    @DefaultValue(MutatorVCFConstants.MUTATED_SAMPLE_SUFFIX)
    String outputSuffix();

    @Key("mutator.output.extension")
    @DefaultValue(MutatorVCFConstants.GVCF_EXTENSION)
    String outputExtension();

    @Key("mutator.output.create_md5")
    @DefaultValue("false")
    boolean createOutputMd5();

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @Key("mutator.stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean stacktraceOnUserException();
}
