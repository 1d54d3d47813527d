package org.broadinstitute.hmmseg.tools;

import com.google.common.annotations.VisibleForTesting;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.hmmseg.cmdline.CommandLineProgram;
import org.broadinstitute.hmmseg.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.hmmseg.cmdline.programgroups.SequenceSegmentationProgramGroup;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.utils.Utils;
import org.broadinstitute.hmmseg.utils.config.ConfigFactory;
import org.broadinstitute.hmmseg.utils.hmm.*;
import org.broadinstitute.hmmseg.utils.io.HiddenMarkovModelFileReader;
import org.broadinstitute.hmmseg.utils.io.ObservationSequenceReader;
import org.broadinstitute.hmmseg.utils.io.Resource;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decodes the most likely hidden-state path of a symbol sequence with the Viterbi algorithm and reports the maximal
 * runs of positions decoded into "marked" states, for example CpG islands in a DNA sequence.
 *
 * <p>
 *     The model is read from a tab-separated model file (see {@link HiddenMarkovModelFileReader}). Without one, the
 *     tool uses a bundled 8-state CpG island model whose "+" states (A+, C+, G+, T+) are island states.
 * </p>
 *
 * <p>
 *     The output has one line per segment with its 0-based first and last sequence positions,
 *     e.g. {@code [14, 27]}, or the line {@value #NO_SEGMENTS_MESSAGE} if there is none.
 * </p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   hmmseg FindMarkedSegments \
 *     -I sequence.fasta \
 *     -O islands.txt
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Decodes the most likely hidden-state path of a symbol sequence and reports the segments " +
                "of consecutive positions in marked states (CpG islands by default)",
        oneLineSummary = "Finds segments of marked hidden states in a symbol sequence",
        programGroup = SequenceSegmentationProgramGroup.class
)
public final class FindMarkedSegments extends CommandLineProgram {

    public static final String MARKED_STATE_PATTERN_LONG_NAME = "marked-state-pattern";
    public static final String UPPER_CASE_LONG_NAME = "upper-case";

    public static final String DEFAULT_MARKED_STATE_PATTERN = ".*\\+";

    public static final String NO_SEGMENTS_MESSAGE = "no marked segments detected";

    @VisibleForTesting
    static final Resource DEFAULT_MODEL_RESOURCE = new Resource("cpg_island_model.tsv", FindMarkedSegments.class);

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Input sequence file (plain text or FASTA-like)")
    public File inputFile;

    @Argument(fullName = StandardArgumentDefinitions.MODEL_LONG_NAME,
            shortName = StandardArgumentDefinitions.MODEL_SHORT_NAME,
            doc = "Hidden Markov model file; the bundled CpG island model is used if absent",
            optional = true)
    public File modelFile = null;

    @Argument(fullName = MARKED_STATE_PATTERN_LONG_NAME,
            doc = "Regular expression that the whole label of a marked state matches",
            optional = true)
    public String markedStatePattern = DEFAULT_MARKED_STATE_PATTERN;

    @Argument(fullName = UPPER_CASE_LONG_NAME,
            doc = "Upper-case the input sequence before discarding symbols not in the model alphabet",
            optional = true)
    public boolean upperCase = false;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output segment file; the standard output if absent",
            optional = true)
    public File outputFile = null;

    private Pattern markedState;

    private TableHiddenMarkovModel<Character, String> model;

    @Override
    protected String[] customCommandLineValidation() {
        try {
            markedState = Pattern.compile(markedStatePattern);
        } catch (final PatternSyntaxException ex) {
            return new String[] {"invalid --" + MARKED_STATE_PATTERN_LONG_NAME + " '" + markedStatePattern + "': " + ex.getDescription()};
        }
        return null;
    }

    @Override
    protected void onStartup() {
        model = modelFile == null ? HiddenMarkovModelFileReader.read(DEFAULT_MODEL_RESOURCE)
                : HiddenMarkovModelFileReader.read(modelFile.toPath());
        if (model.hiddenStates().stream().noneMatch(this::isMarked)) {
            Utils.warnUser(logger, String.format("No state of the model matches the marked state pattern '%s'", markedStatePattern));
        }
    }

    @Override
    protected Object doWork() {
        final List<Character> sequence = new ObservationSequenceReader(model.alphabet(), upperCase).read(inputFile.toPath());
        if (sequence.isEmpty()) {
            logger.warn("The input contains no symbol of the model alphabet: " + inputFile);
        }
        logger.info(String.format("Decoding a sequence of %d symbols with a %d-state model", sequence.size(), model.hiddenStates().size()));

        final int progressLogInterval = ConfigFactory.getInstance().getHmmSegConfig().viterbi_progress_log_interval();
        final ViterbiResult<String> result = ViterbiAlgorithm.apply(sequence, model, progressLogInterval);
        final List<PathSegment> segments = MarkedSegmentExtractor.extractMarkedSegments(result.getPath(), this::isMarked);

        logger.info(String.format("Best path log probability: %f", result.getLogProbability()));
        logger.info(String.format("Found %d marked segments covering %d positions", segments.size(),
                MarkedSegmentExtractor.coveredPositions(segments)));

        writeSegments(segments);
        return segments;
    }

    private boolean isMarked(final String state) {
        return markedState.matcher(state).matches();
    }

    private void writeSegments(final List<PathSegment> segments) {
        if (outputFile == null) {
            final PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            printSegments(writer, segments);
            writer.flush();
        } else {
            try (final PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8))) {
                printSegments(writer, segments);
                if (writer.checkError()) {
                    throw new UserException.CouldNotCreateOutputFile(outputFile.toPath(), "an error occurred while writing");
                }
            } catch (final IOException ex) {
                throw new UserException.CouldNotCreateOutputFile(outputFile.toPath(), "it could not be opened", ex);
            }
        }
    }

    @VisibleForTesting
    static void printSegments(final PrintWriter writer, final List<PathSegment> segments) {
        if (segments.isEmpty()) {
            writer.println(NO_SEGMENTS_MESSAGE);
        } else {
            for (final PathSegment segment : segments) {
                writer.println(segment);
            }
        }
    }
}
