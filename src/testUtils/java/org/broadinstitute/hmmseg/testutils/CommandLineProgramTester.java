package org.broadinstitute.hmmseg.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.hmmseg.Main;
import org.broadinstitute.hmmseg.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a tool through {@link Main} in tests. Unless the arguments set a verbosity, the tool only logs errors.
 */
public interface CommandLineProgramTester {

    String getTestedToolName();

    /**
     * @return {@code toolName} followed by {@code args}, with {@code --verbosity ERROR} appended if no verbosity is given
     */
    default String[] makeCommandLineArgs(final List<String> args, final String toolName) {
        final List<String> commandLine = new ArrayList<>();
        commandLine.add(toolName);
        commandLine.addAll(args);
        final boolean hasVerbosity = args.stream().anyMatch(arg ->
                arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME)
                        || arg.equalsIgnoreCase("-" + StandardArgumentDefinitions.VERBOSITY_NAME));
        if (!hasVerbosity) {
            commandLine.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
            commandLine.add(Log.LogLevel.ERROR.name());
        }
        return commandLine.toArray(new String[0]);
    }

    default String[] makeCommandLineArgs(final List<String> args) {
        return makeCommandLineArgs(args, getTestedToolName());
    }

    default Object runCommandLine(final List<String> args, final String toolName) {
        return new Main().instanceMain(makeCommandLineArgs(args, toolName));
    }

    default Object runCommandLine(final List<String> args) {
        return runCommandLine(args, getTestedToolName());
    }

    default Object runCommandLine(final String[] args) {
        return runCommandLine(Arrays.asList(args));
    }

    default Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }
}
