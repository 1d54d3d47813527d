package org.broadinstitute.hmmseg;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.hmmseg.cmdline.CommandLineProgram;
import org.broadinstitute.hmmseg.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.tools.FindMarkedSegments;
import org.broadinstitute.hmmseg.utils.Utils;
import org.broadinstitute.hmmseg.utils.config.ConfigFactory;
import org.broadinstitute.hmmseg.utils.runtime.RuntimeUtils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Command line entry point of hmmseg.
 *
 * <p>
 *     The first argument names the tool to run, among {@link #getClassList()}; the remaining arguments are handed to
 *     it. Without a tool name, or with {@code -h}, the available tools are listed. Subclasses may replace the tool list,
 *     the command name and the handling of results and failures.
 * </p>
 */
public class Main {

    static {
        // Number formatting must not depend on the platform locale.
        Utils.forceJVMLocaleToUSEnglish();
    }

    private static final String RESET = "\u001B[0m";
    private static final String BOLD_RED = "\u001B[1m\u001B[31m";
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    /**
     * Exit value for a {@link CommandLineException}.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value for a {@link UserException}.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * Exit value for any other exception.
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "hmmseg_stacktrace_on_user_exception";

    // Suggestions for a mistyped tool name.
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    /**
     * Runs the tool named by {@code args} and exits the JVM with the status matching the outcome.
     * Nothing else in hmmseg calls {@link System#exit}.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args, getClassList(), getCommandLineName());
            handleResult(runCommandLineProgram(program, args));
            System.exit(0);
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e) {
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e) {
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Runs the tool named by {@code args} without exiting, for tests.
     *
     * @return the tool result, or {@code null} if only the tool list was printed
     */
    public Object instanceMain(final String[] args) {
        return instanceMain(args, getClassList(), getCommandLineName());
    }

    public Object instanceMain(final String[] args, final List<Class<? extends CommandLineProgram>> classList, final String commandLineName) {
        return runCommandLineProgram(setupConfigAndExtractProgram(args, classList, commandLineName), args);
    }

    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(FindMarkedSegments.class);
    }

    protected String getCommandLineName() {
        return "hmmseg";
    }

    /**
     * Loads the configuration named by {@code --hmmseg-config-file}, which tools read while they are built.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.HMMSEG_CONFIG_FILE_OPTION);
    }

    protected CommandLineProgram setupConfigAndExtractProgram(final String[] args,
                                                              final List<Class<? extends CommandLineProgram>> classList,
                                                              final String commandLineName) {
        parseArgsForConfigSetup(args);
        return extractCommandLineProgram(args, classList, commandLineName);
    }

    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (program == null) {
            return null;
        }
        return program.instanceMain(Arrays.copyOfRange(rawArgs, 1, rawArgs.length));
    }

    /**
     * Tools write their own output, so results are ignored by default.
     */
    protected void handleResult(final Object result) {}

    /**
     * Prints the message of a {@link UserException} or {@link CommandLineException}, with its stack trace only when
     * {@value #STACK_TRACE_ON_USER_EXCEPTION_PROPERTY} is set.
     */
    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");
        if (printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, final String prefix) {
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        final String rule = Utils.dupChar('*', 71);
        ps.println(rule);
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println(rule);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    public static CommandLineProgramProperties getProgramProperty(final Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    /**
     * @return a new instance of the tool named by {@code args[0]}, or {@code null} after printing the tool list
     * @throws UserException if no tool has that name
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args,
                                                         final List<Class<? extends CommandLineProgram>> classList,
                                                         final String commandLineName) {
        final Map<String, Class<? extends CommandLineProgram>> toolsByName = indexTools(classList);
        final Set<Class<?>> tools = new LinkedHashSet<>(toolsByName.values());

        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, tools, commandLineName);
            return null;
        }
        final Class<? extends CommandLineProgram> tool = toolsByName.get(args[0]);
        if (tool == null) {
            printUsage(System.err, tools, commandLineName);
            throw new UserException(getSuggestedAlternateCommand(tools, args[0]));
        }
        return newInstance(tool);
    }

    private static Map<String, Class<? extends CommandLineProgram>> indexTools(final List<Class<? extends CommandLineProgram>> classList) {
        final Map<String, Class<? extends CommandLineProgram>> toolsByName = new LinkedHashMap<>();
        final List<String> notAnnotated = new ArrayList<>();
        for (final Class<? extends CommandLineProgram> clazz : classList) {
            if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
                continue;
            }
            if (getProgramProperty(clazz) == null) {
                notAnnotated.add(clazz.getSimpleName());
            } else if (toolsByName.put(clazz.getSimpleName(), clazz) != null) {
                throw new RuntimeException("Two tools are named " + clazz.getSimpleName());
            }
        }
        if (!notAnnotated.isEmpty()) {
            throw new RuntimeException("The following classes are missing the required CommandLineProgramProperties annotation: "
                    + String.join(", ", notAnnotated));
        }
        return toolsByName;
    }

    private static <T> T newInstance(final Class<T> clazz) {
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException("Could not instantiate " + clazz.getName(), e);
        }
    }

    private static void printUsage(final PrintStream destination, final Set<Class<?>> tools, final String commandLineName) {
        final Map<CommandLineProgramGroup, List<Class<?>>> toolsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groups = new HashMap<>();
        for (final Class<?> tool : tools) {
            final CommandLineProgramProperties properties = getProgramProperty(tool);
            if (!properties.omitFromCommandLine()) {
                final CommandLineProgramGroup group = groups.computeIfAbsent(properties.programGroup(), groupClass -> newInstance(groupClass));
                toolsByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(tool);
            }
        }

        final String rule = Utils.dupChar('-', 86);
        final StringBuilder usage = new StringBuilder();
        usage.append(String.format("%sUSAGE: %s %s<program name>%s [-h]%s%n%n", BOLD_RED, commandLineName, GREEN, BOLD_RED, RESET));
        usage.append(String.format("%sAvailable Programs:%s%n", BOLD_RED, RESET));
        toolsByGroup.forEach((group, groupTools) -> {
            usage.append(rule).append(System.lineSeparator());
            usage.append(String.format("%s%-48s %-45s%s%n", RED, group.getName() + ":", group.getDescription(), RESET));
            final List<Class<?>> sorted = groupTools.stream()
                    .sorted(Comparator.comparing(RuntimeUtils::toolDisplayName))
                    .collect(Collectors.toList());
            for (final Class<?> tool : sorted) {
                usage.append(String.format("%s    %-45s%s%s%s%n", GREEN, RuntimeUtils.toolDisplayName(tool),
                        CYAN, getProgramProperty(tool).oneLineSummary(), RESET));
            }
            usage.append(System.lineSeparator());
        });
        usage.append(rule);
        destination.println(usage);
    }

    /**
     * Builds the error message for an unknown tool name, with the closest tool names when some are close enough.
     * A tool whose name starts with {@code command}, or contains it when it is long enough, counts as an exact match.
     */
    public String getSuggestedAlternateCommand(final Set<Class<?>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new LinkedHashMap<>();
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final boolean partialMatch = name.startsWith(command)
                    || (command.length() >= MINIMUM_SUBSTRING_LENGTH && name.contains(command));
            distances.put(clazz, partialMatch ? 0 : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4));
        }
        final int bestDistance = distances.values().stream().min(Integer::compare).orElse(Integer.MAX_VALUE);
        final List<String> closest = distances.entrySet().stream()
                .filter(e -> e.getValue() == bestDistance)
                .map(e -> e.getKey().getSimpleName())
                .collect(Collectors.toList());

        final StringBuilder message = new StringBuilder(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", closest.size() < 2 ? "this" : "one of these"));
            message.append(System.lineSeparator());
            closest.forEach(name -> message.append("        ").append(name));
        }
        return message.toString();
    }
}
