package org.broadinstitute.hmmseg.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;

import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;

/**
 * Applies the {@code --verbosity} of a tool to every logging framework in the process.
 *
 * <p>
 *     Verbosity is typed as the htsjdk {@link Log.LogLevel}, which the argument parser can handle, and translated
 *     to log4j and java.util.logging levels here.
 * </p>
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> LOG4J_LEVELS = EnumHashBiMap.create(Log.LogLevel.class);
    private static final BiMap<Log.LogLevel, java.util.logging.Level> JUL_LEVELS = EnumHashBiMap.create(Log.LogLevel.class);
    static {
        LOG4J_LEVELS.put(Log.LogLevel.ERROR, Level.ERROR);
        LOG4J_LEVELS.put(Log.LogLevel.WARNING, Level.WARN);
        LOG4J_LEVELS.put(Log.LogLevel.INFO, Level.INFO);
        LOG4J_LEVELS.put(Log.LogLevel.DEBUG, Level.DEBUG);

        JUL_LEVELS.put(Log.LogLevel.ERROR, java.util.logging.Level.SEVERE);
        JUL_LEVELS.put(Log.LogLevel.WARNING, java.util.logging.Level.WARNING);
        JUL_LEVELS.put(Log.LogLevel.INFO, java.util.logging.Level.INFO);
        JUL_LEVELS.put(Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);
    }

    private LoggingUtils() { }

    static Log.LogLevel levelFromLog4jLevel(final Level log4jLevel) {
        return LOG4J_LEVELS.inverse().get(log4jLevel);
    }

    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return LOG4J_LEVELS.get(htsjdkLevel);
    }

    /**
     * Sets {@code verbosity} on htsjdk, on the log4j configuration and on the java.util.logging console.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "the verbosity cannot be null");
        Log.setGlobalLogLevel(verbosity);
        setLog4jLevel(verbosity);
        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4jLevel(final Log.LogLevel verbosity) {
        final LoggerContext context = (LoggerContext) LogManager.getContext(false);
        // Our loggers have no configuration of their own, so this is the root configuration.
        final LoggerConfig config = context.getConfiguration().getLoggerConfig(LoggingUtils.class.getName());
        config.setLevel(levelToLog4jLevel(verbosity));
        context.updateLoggers();
    }

    private static void setJavaUtilLoggingLevel(final Log.LogLevel verbosity) {
        final java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
        final Handler console = Arrays.stream(root.getHandlers())
                .filter(handler -> handler instanceof ConsoleHandler)
                .findFirst()
                .orElseGet(() -> {
                    final Handler handler = new ConsoleHandler();
                    root.addHandler(handler);
                    return handler;
                });
        console.setLevel(JUL_LEVELS.get(verbosity));
    }
}
