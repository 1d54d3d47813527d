package org.broadinstitute.hmmseg.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.*;
import org.broadinstitute.hmmseg.utils.LoggingUtils;
import org.broadinstitute.hmmseg.utils.Utils;
import org.broadinstitute.hmmseg.utils.config.ConfigFactory;
import org.broadinstitute.hmmseg.utils.runtime.RuntimeUtils;

import java.text.DecimalFormat;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Collections;

/**
 * Base class of the hmmseg tools.
 *
 * <p>
 *     A tool declares its options as {@link Argument} fields, names itself with {@link CommandLineProgramProperties}
 *     and implements {@link #doWork()}. {@link #instanceMain(String[])} parses the arguments, runs
 *     {@link #customCommandLineValidation()}, applies the verbosity and then calls {@link #onStartup()},
 *     {@link #doWork()} and {@link #onShutdown()} in that order. Exceptions thrown by the tool are left to the caller.
 * </p>
 */
public abstract class CommandLineProgram {

    // Named after the concrete tool.
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @ArgumentCollection(doc = "Arguments handled by the parser itself (help, version, argument files)")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
            doc = "Logging verbosity", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME,
            doc = "Suppress the startup banner and the elapsed time summary", common = true, optional = true)
    public Boolean QUIET = false;

    // Read by Main before the tool is built; declared here so that it is accepted and documented.
    @Argument(fullName = StandardArgumentDefinitions.HMMSEG_CONFIG_FILE_OPTION,
            doc = "Properties file overriding the hmmseg configuration", common = true, optional = true)
    public String HMMSEG_CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    private String commandLine;

    /**
     * Called once the arguments are valid, before {@link #doWork()}.
     */
    protected void onStartup() {}

    /**
     * Runs the tool.
     *
     * @return the tool result, handed back to {@link org.broadinstitute.hmmseg.Main}
     */
    protected abstract Object doWork();

    /**
     * Called after {@link #doWork()}, also when {@link #onStartup()} or {@link #doWork()} failed.
     */
    protected void onShutdown() {}

    /**
     * Extra checks of the parsed arguments.
     *
     * @return {@code null} if the arguments are valid, otherwise one message per problem
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} and runs the tool.
     *
     * @return the tool result, or 0 if only help or version output was requested
     * @throws CommandLineException if the arguments are invalid
     */
    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 0;
        }
        return instanceMainPostParseArgs();
    }

    public Object instanceMainPostParseArgs() {
        LoggingUtils.setLoggingLevel(VERBOSITY);
        final ZonedDateTime start = ZonedDateTime.now();
        if (!QUIET) {
            printStartupMessage(start);
        }
        try {
            return runTool();
        } finally {
            if (!QUIET) {
                printElapsedTime(start);
            }
        }
    }

    /**
     * Runs the startup, work and shutdown hooks without parsing or banner output.
     */
    public final Object runTool() {
        try {
            logger.debug("Starting " + getClass().getSimpleName());
            onStartup();
            return doWork();
        } finally {
            logger.debug("Stopping " + getClass().getSimpleName());
            onShutdown();
        }
    }

    /**
     * @return false if the parser only printed help or version output
     * @throws CommandLineException if parsing or {@link #customCommandLineValidation()} fails
     */
    protected final boolean parseArgs(final String[] argv) {
        final boolean shouldRun = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!shouldRun) {
            return false;
        }
        final String[] problems = customCommandLineValidation();
        if (problems != null) {
            throw new CommandLineException("Invalid arguments: " + String.join(", ", problems));
        }
        return true;
    }

    protected void printStartupMessage(final ZonedDateTime start) {
        final String rule = Utils.dupChar('-', 60);
        logger.info(rule);
        logger.info(String.format("%s v%s", RuntimeUtils.getToolkitName(getClass()), getVersion()));
        logger.info(String.format("Java %s on %s %s", System.getProperty("java.runtime.version"),
                System.getProperty("os.name"), System.getProperty("os.arch")));
        logger.info("Started at " + Utils.getDateTimeForDisplay(start));
        logger.info(rule);
        logger.info("Command line: " + commandLine);
        ConfigFactory.logConfigFields(ConfigFactory.getInstance().getHmmSegConfig(), Log.LogLevel.DEBUG);
    }

    private void printElapsedTime(final ZonedDateTime start) {
        final ZonedDateTime end = ZonedDateTime.now();
        final double minutes = Duration.between(start, end).toMillis() / 60000d;
        System.err.println("[" + Utils.getDateTimeForDisplay(end) + "] " + getClass().getName()
                + " done. Elapsed time: " + new DecimalFormat("#,##0.00").format(minutes) + " minutes.");
    }

    public String getVersion() {
        return RuntimeUtils.getVersion(getClass());
    }

    /**
     * @return the command line as parsed, or {@code null} before parsing
     */
    public final String getCommandLine() {
        return commandLine;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
