package org.broadinstitute.hmmseg.utils.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.utils.NaturalLogUtils;
import org.broadinstitute.hmmseg.utils.Utils;
import org.broadinstitute.hmmseg.utils.hmm.TableHiddenMarkovModel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a {@link TableHiddenMarkovModel} over single-character symbols and string state labels from a
 * tab-separated text file of linear-scale probabilities.
 *
 * <p>
 *     The format is line oriented; blank lines and lines starting with {@value #COMMENT_PREFIX} are ignored:
 * </p>
 * <pre>
 *     STATES      A+  C+  G+  T+  A-  C-  G-  T-
 *     ALPHABET    A   C   G   T
 *     INITIAL     state   probability
 *     TRANSITION  from    to      probability
 *     EMISSION    state   symbol  probability
 * </pre>
 * <p>
 *     {@code STATES} and {@code ALPHABET} must come first, once each. The state order is the tie-break order of
 *     the decoder. Every initial, transition and emission entry must be present; a probability of 0 stands for an
 *     impossible event.
 * </p>
 */
public final class HiddenMarkovModelFileReader {

    private static final Logger logger = LogManager.getLogger(HiddenMarkovModelFileReader.class);

    public static final String COMMENT_PREFIX = "#";

    public static final String STATES_KEYWORD = "STATES";
    public static final String ALPHABET_KEYWORD = "ALPHABET";
    public static final String INITIAL_KEYWORD = "INITIAL";
    public static final String TRANSITION_KEYWORD = "TRANSITION";
    public static final String EMISSION_KEYWORD = "EMISSION";

    private HiddenMarkovModelFileReader() {}

    /**
     * Reads a model from a file.
     *
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     * @throws UserException.MalformedFile if the content is not a valid model.
     */
    public static TableHiddenMarkovModel<Character, String> read(final Path path) {
        Utils.nonNull(path, "the model path cannot be null");
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (final IOException ex) {
            throw new UserException.CouldNotReadInputFile(path, ex);
        }
    }

    /**
     * Reads a model bundled as a class-path resource.
     */
    public static TableHiddenMarkovModel<Character, String> read(final Resource resource) {
        Utils.nonNull(resource, "the model resource cannot be null");
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getResourceContentsAsStream(), StandardCharsets.UTF_8))) {
            return read(reader, resource.toString());
        } catch (final IOException ex) {
            throw new UserException.CouldNotReadInputFile(resource.toString(), "error reading the model resource", ex);
        }
    }

    /**
     * Reads a model from a character stream.
     *
     * @param reader the model text; not closed by this method.
     * @param source name of the model source, used in error messages.
     * @throws IOException if the reader fails.
     * @throws UserException.MalformedFile if the content is not a valid model.
     */
    public static TableHiddenMarkovModel<Character, String> read(final Reader reader, final String source) throws IOException {
        Utils.nonNull(reader, "the reader cannot be null");
        Utils.nonNull(source, "the source cannot be null");
        final BufferedReader bufferedReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        List<String> states = null;
        List<Character> alphabet = null;
        TableHiddenMarkovModel.Builder<Character, String> builder = null;
        int lineNumber = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            final String[] fields = StringUtils.split(trimmed);
            final String keyword = fields[0];
            try {
                switch (keyword) {
                    case STATES_KEYWORD:
                        checkNotYetDefined(states, source, lineNumber, STATES_KEYWORD);
                        checkFieldCount(fields, 2, Integer.MAX_VALUE, source, lineNumber);
                        states = Arrays.asList(Arrays.copyOfRange(fields, 1, fields.length));
                        break;
                    case ALPHABET_KEYWORD:
                        checkNotYetDefined(alphabet, source, lineNumber, ALPHABET_KEYWORD);
                        checkFieldCount(fields, 1, Integer.MAX_VALUE, source, lineNumber);
                        alphabet = new ArrayList<>(fields.length - 1);
                        for (int i = 1; i < fields.length; i++) {
                            alphabet.add(parseSymbol(fields[i], source, lineNumber));
                        }
                        break;
                    case INITIAL_KEYWORD:
                        checkFieldCount(fields, 3, 3, source, lineNumber);
                        builder = builder(builder, states, alphabet, source, lineNumber);
                        builder.setLogInitialProbability(fields[1], parseLogProbability(fields[2], source, lineNumber));
                        break;
                    case TRANSITION_KEYWORD:
                        checkFieldCount(fields, 4, 4, source, lineNumber);
                        builder = builder(builder, states, alphabet, source, lineNumber);
                        builder.setLogTransitionProbability(fields[1], fields[2], parseLogProbability(fields[3], source, lineNumber));
                        break;
                    case EMISSION_KEYWORD:
                        checkFieldCount(fields, 4, 4, source, lineNumber);
                        builder = builder(builder, states, alphabet, source, lineNumber);
                        builder.setLogEmissionProbability(fields[1], parseSymbol(fields[2], source, lineNumber),
                                parseLogProbability(fields[3], source, lineNumber));
                        break;
                    default:
                        throw new UserException.MalformedFile(source, lineNumber, "unknown keyword '" + keyword + "'");
                }
            } catch (final HmmSegException.InvalidModel ex) {
                throw new UserException.MalformedFile(source, "line " + lineNumber + ": " + ex.getMessage(), ex);
            }
        }

        final TableHiddenMarkovModel<Character, String> result;
        try {
            result = builder(builder, states, alphabet, source, lineNumber).build();
        } catch (final HmmSegException.InvalidModel ex) {
            throw new UserException.MalformedFile(source, ex.getMessage(), ex);
        }
        logger.debug(String.format("Read a model with %d states and %d symbols from %s", states.size(), alphabet.size(), source));
        return result;
    }

    private static TableHiddenMarkovModel.Builder<Character, String> builder(final TableHiddenMarkovModel.Builder<Character, String> builder,
                                                                             final List<String> states, final List<Character> alphabet,
                                                                             final String source, final int lineNumber) {
        if (builder != null) {
            return builder;
        } else if (states == null) {
            throw new UserException.MalformedFile(source, lineNumber, "the " + STATES_KEYWORD + " line is missing or comes too late");
        } else if (alphabet == null) {
            throw new UserException.MalformedFile(source, lineNumber, "the " + ALPHABET_KEYWORD + " line is missing or comes too late");
        } else {
            return new TableHiddenMarkovModel.Builder<>(states, alphabet);
        }
    }

    private static void checkNotYetDefined(final Object previous, final String source, final int lineNumber, final String keyword) {
        if (previous != null) {
            throw new UserException.MalformedFile(source, lineNumber, "repeated " + keyword + " line");
        }
    }

    private static void checkFieldCount(final String[] fields, final int min, final int max, final String source, final int lineNumber) {
        if (fields.length < min || fields.length > max) {
            throw new UserException.MalformedFile(source, lineNumber,
                    String.format("wrong number of fields (%d) for a %s line", fields.length, fields[0]));
        }
    }

    private static Character parseSymbol(final String field, final String source, final int lineNumber) {
        if (field.length() != 1) {
            throw new UserException.MalformedFile(source, lineNumber, "symbols must be single characters: '" + field + "'");
        }
        return field.charAt(0);
    }

    private static double parseLogProbability(final String field, final String source, final int lineNumber) {
        final double probability;
        try {
            probability = Double.parseDouble(field);
        } catch (final NumberFormatException ex) {
            throw new UserException.MalformedFile(source, lineNumber, "not a number: '" + field + "'");
        }
        if (Double.isNaN(probability) || probability < 0 || probability > 1) {
            throw new UserException.MalformedFile(source, lineNumber, "a probability must be between 0 and 1: " + field);
        }
        return NaturalLogUtils.fromProbability(probability);
    }
}
