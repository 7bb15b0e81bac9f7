package org.broadinstitute.msa.utils;

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
 * Tools use the htsjdk {@link Log.LogLevel} enum as the type for VERBOSITY command line arguments, since each log4j
 * level is a static object rather than an enum constant. This class converts between the two and pushes the
 * requested level to both htsjdk and log4j.
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    /**
     * Converts an htsjdk log level to a log4j log level.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return loggingLevelNamespaceMap.get(htsjdkLevel);
    }

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Propagate the verbosity level to htsjdk and log4j.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "the verbosity cannot be null");
        Log.setGlobalLogLevel(verbosity);

        // propagate the requested level to the root logger of our logging configuration
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LoggingUtils.class.getName());
        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
