package org.broadinstitute.mutator.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities.
 *
 * Tools use the htsjdk Log.LogLevel enum as the type for VERBOSITY command line arguments, since each log4j
 * level is a static object rather than an enum constant and so cannot be parsed by the argument parser.
 * The htsjdk enum is therefore the currency here, converted to log4j levels as necessary.
 */
public final class LoggingUtils {

    // Map between the logging level used throughout the toolkit (the htsjdk Log.LogLevel enum),
    // and the log4j log Level values.
    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     * @param htsjdkLevel htsjdk {@link Log.LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code htsjdkLevel}.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return loggingLevelNamespaceMap.get(htsjdkLevel);
    }

    /**
     * Propagate the verbosity level to htsjdk and log4j
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "verbosity");

        // Call the htsjdk API to establish the logging level used by htsjdk itself
        Log.setGlobalLogLevel(verbosity);

        setLog4JLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(final Log.LogLevel verbosity) {
        // Propagate the requested logging level to the logger config that governs our classes.
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final String contextClassName = LoggingUtils.class.getName();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(contextClassName);

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
