package org.broadinstitute.mutator.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.mutator.exceptions.UserException;
import org.broadinstitute.mutator.utils.LoggingUtils;
import org.broadinstitute.mutator.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities to resolve the
 * path variables of {@link Config.Sources} annotations before a configuration is created.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    /**
     * Checks each of the given {@code filenameProperties} for if they are defined in system or environment
     * properties.  If they are not, sets them in the {@link org.aeonbits.owner.ConfigFactory} to an empty file
     * so that the source is skipped rather than resolved as a literal path.
     */
    private void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        for (final String property : filenameProperties) {
            if ( System.getenv().containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + " - will search for config here.");
            }
            else if ( System.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties (probably from the command-line): " + property + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     */
    @VisibleForTesting
    static List<String> getSourcesAnnotationPathVariables(final Class<? extends Config> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();

        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which will ensure that
     * path variables specified in {@link org.aeonbits.owner.Config.Sources} annotations are resolved prior
     * to creation.
     */
    public synchronized <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * @return the (cached) {@link MutatorConfig} for this JVM.
     */
    public MutatorConfig getMutatorConfig() {
        return getOrCreate(MutatorConfig.class);
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                // Option was provided, but no file was specified.
                throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and initialize the
     * {@link MutatorConfig} from it. Must run before any tool asks for its configuration.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        final String configFileName = getConfigFilenameFromArgs(argList, configFileOption);
        if ( configFileName != null ) {
            org.aeonbits.owner.ConfigFactory.setProperty(MutatorConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName);
            ConfigCache.remove(MutatorConfig.class);
        }
        logConfigFields(getMutatorConfig(), Log.LogLevel.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Accessible} config at the given {@link Log.LogLevel}
     */
    public static void logConfigFields(final Accessible config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final String propertyName : config.propertyNames() ) {
            logger.log(level, "\t" + propertyName + " = " + config.getProperty(propertyName));
        }
    }
}
