package org.broadinstitute.hmmseg.testutils;

import org.broadinstitute.hmmseg.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.hmmseg.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the argument list of a tool run in tests, one {@code --name value} pair at a time.
 */
public final class ArgumentsBuilder {

    private final List<String> args = new ArrayList<>();

    /**
     * Adds {@code --argumentName argumentValue}; the value stays a single argument even if it contains spaces.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        args.add("--" + Utils.nonNull(argumentName));
        args.add(Utils.nonNull(argumentValue));
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file) {
        return add(argumentName, Utils.nonNull(file).getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final boolean value) {
        return add(argumentName, String.valueOf(value));
    }

    public ArgumentsBuilder addInput(final File input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addModel(final File model) {
        return add(StandardArgumentDefinitions.MODEL_LONG_NAME, model);
    }

    public List<String> getArgsList() {
        return args;
    }

    @Override
    public String toString() {
        return String.join(" ", args);
    }
}
