package org.broadinstitute.hmmseg.utils.hmm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.utils.NaturalLogUtils;
import org.broadinstitute.hmmseg.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * Implements the Viterbi Algorithm.
 *
 * <p>
 *     The best-path log probabilities are computed iteratively into an explicit state-by-position
 *     {@link ViterbiTable}, so that the decoded path can be traced back through the stored predecessor indexes
 *     and any per-state, per-position value can be queried afterwards.
 * </p>
 * <p>
 *     Amongst equally likely predecessors (or final states) the one that comes first in
 *     {@link HiddenMarkovModel#hiddenStates()} wins, including when all of them are impossible.
 * </p>
 */
public final class ViterbiAlgorithm {

    private static final Logger logger = LogManager.getLogger(ViterbiAlgorithm.class);

    /**
     * Progress log interval of tables created without an explicit one.
     */
    public static final int DEFAULT_PROGRESS_LOG_INTERVAL = 100_000;

    private ViterbiAlgorithm() {}

    /**
     * Calculates the most likely the hidden state sequence that explains the observed data.
     *
     * @param data the observed data.
     * @param model the HMM model.
     * @param <D> observed data type.
     * @param <S> hidden state data-type.
     * @return never {@code null}, with a path as long as {@code data} that only contains states as returned by
     *    <code>model.{@link HiddenMarkovModel#hiddenStates() hiddenStates()}</code>. An empty {@code data} yields
     *    an empty path with log probability 0.
     * @throws IllegalArgumentException if {@code data} or {@code model} is {@code null}.
     * @throws HmmSegException.InvalidModel if the model cannot provide a valid log probability the decoder needs.
     */
    public static <D, S> ViterbiResult<S> apply(final List<D> data, final HiddenMarkovModel<D, S> model) {
        return apply(data, model, DEFAULT_PROGRESS_LOG_INTERVAL);
    }

    /**
     * Same as {@link #apply(List, HiddenMarkovModel)} with a progress message logged at DEBUG every
     * {@code progressLogInterval} positions; 0 or less for none.
     */
    public static <D, S> ViterbiResult<S> apply(final List<D> data, final HiddenMarkovModel<D, S> model,
                                                final int progressLogInterval) {
        final ViterbiTable<D, S> table = newTable(data, model, progressLogInterval);
        final double bestLogProbability = computeBestLogProbability(table, table.length()).getAsDouble();
        final List<S> path = reconstructPath(table, table.length());
        logger.debug(String.format("Decoded a sequence of length %d with best log probability %f", table.length(), bestLogProbability));
        return new ViterbiResult<>(path, bestLogProbability);
    }

    /**
     * Creates an empty (only position 0 filled) table to decode the given data with the given model.
     *
     * @throws IllegalArgumentException if {@code data} or {@code model} is {@code null}.
     * @throws HmmSegException.InvalidModel if the model has no hidden states, repeated states or {@code null} states.
     */
    public static <D, S> ViterbiTable<D, S> newTable(final List<D> data, final HiddenMarkovModel<D, S> model) {
        return newTable(data, model, DEFAULT_PROGRESS_LOG_INTERVAL);
    }

    /**
     * @param progressLogInterval positions between two progress messages of the fill; 0 or less for none.
     */
    public static <D, S> ViterbiTable<D, S> newTable(final List<D> data, final HiddenMarkovModel<D, S> model,
                                                     final int progressLogInterval) {
        Utils.nonNull(data, "the data cannot be null");
        Utils.nonNull(model, "the model cannot be null");
        return new ViterbiTable<>(data, model, progressLogInterval);
    }

    /**
     * Fills the table up to a position, if not done already, and returns the best log probability amongst all
     * states at that position.
     *
     * @param table the table to fill.
     * @param position the target position; 0 is the virtual begin position.
     * @return empty if {@code position} is beyond the sequence length; otherwise a value between
     *    {@link Double#NEGATIVE_INFINITY} and 0 inclusive (exactly 0 for position 0).
     * @throws HmmSegException.IndexOutOfRange if {@code position} is negative.
     * @throws HmmSegException.InvalidModel if the model cannot provide a valid log probability the decoder needs.
     */
    public static <D, S> OptionalDouble computeBestLogProbability(final ViterbiTable<D, S> table, final int position) {
        Utils.nonNull(table, "the table cannot be null");
        if (position < 0) {
            throw new HmmSegException.IndexOutOfRange(position, table.length());
        } else if (position > table.length()) {
            return OptionalDouble.empty();
        }
        fill(table, position);
        return OptionalDouble.of(table.logProbabilities[bestStateIndex(table, position)][position]);
    }

    /**
     * Traces back the best path that ends at a position of a filled table.
     *
     * @param table the table.
     * @param length the length of the path; the last position it covers.
     * @return never {@code null}, a modifiable list with exactly {@code length} states.
     * @throws HmmSegException.IndexOutOfRange if {@code length} is negative or beyond the sequence length.
     * @throws HmmSegException.DecoderNotRun if the table has not been filled up to {@code length}.
     */
    public static <D, S> List<S> reconstructPath(final ViterbiTable<D, S> table, final int length) {
        Utils.nonNull(table, "the table cannot be null");
        table.checkFilled(length);

        // Fill out the array backwards.
        @SuppressWarnings("unchecked")
        final S[] result = (S[]) new Object[length];
        int stateIndex = bestStateIndex(table, length);
        for (int position = length; position > 0; --position) {
            result[position - 1] = table.states().get(stateIndex);
            stateIndex = table.backPointers[stateIndex][position];
        }
        if (stateIndex != ViterbiTable.BEGIN && length > 0) {
            throw new HmmSegException.ShouldNeverReachHereException("the trace-back did not end in the begin state");
        }

        final List<S> path = new ArrayList<>(length);
        for (final S state : result) {
            path.add(state);
        }
        return path;
    }

    private static <D, S> int bestStateIndex(final ViterbiTable<D, S> table, final int position) {
        final double[][] logProbabilities = table.logProbabilities;
        int bestStateIndex = 0;
        for (int stateIndex = 1; stateIndex < logProbabilities.length; stateIndex++) {
            if (logProbabilities[stateIndex][position] > logProbabilities[bestStateIndex][position]) {
                bestStateIndex = stateIndex;
            }
        }
        return bestStateIndex;
    }

    private static <D, S> void fill(final ViterbiTable<D, S> table, final int position) {
        if (position <= table.getFilledPosition()) {
            return;
        }
        final List<S> states = table.states();
        final int numStates = states.size();
        final double[][] logProbabilities = table.logProbabilities;
        final int[][] backPointers = table.backPointers;
        final int progressInterval = table.getProgressLogInterval();

        for (int thisPosition = table.getFilledPosition() + 1; thisPosition <= position; thisPosition++) {
            final int previousPosition = thisPosition - 1;
            final double[] logEmissions = logEmissionProbabilities(table, table.data().get(previousPosition));
            if (thisPosition == 1) {
                final double[] logInitials = logInitialProbabilities(table);
                for (int thisStateIndex = 0; thisStateIndex < numStates; thisStateIndex++) {
                    logProbabilities[thisStateIndex][1] = logEmissions[thisStateIndex] + logInitials[thisStateIndex];
                    backPointers[thisStateIndex][1] = ViterbiTable.BEGIN;
                }
            } else {
                final double[][] logTransitions = logTransitionProbabilities(table);
                for (int thisStateIndex = 0; thisStateIndex < numStates; thisStateIndex++) {
                    // Initialize best-previous-state search setting the best so far to 0th indexed state:
                    int bestPreviousStateIndex = 0;
                    double bestPreviousStateLogProb = logTransitions[0][thisStateIndex]
                            + logProbabilities[0][previousPosition];
                    // Then we check on the 1th state, the 2nd state and so forth:
                    for (int previousStateIndex = 1; previousStateIndex < numStates; previousStateIndex++) {
                        final double candidatePreviousStateLogProb = logTransitions[previousStateIndex][thisStateIndex]
                                + logProbabilities[previousStateIndex][previousPosition];
                        if (candidatePreviousStateLogProb > bestPreviousStateLogProb) {
                            bestPreviousStateLogProb = candidatePreviousStateLogProb;
                            bestPreviousStateIndex = previousStateIndex;
                        }
                    }
                    logProbabilities[thisStateIndex][thisPosition] = logEmissions[thisStateIndex] + bestPreviousStateLogProb;
                    backPointers[thisStateIndex][thisPosition] = bestPreviousStateIndex;
                }
            }
            table.setFilledPosition(thisPosition);
            if (progressInterval > 0 && thisPosition % progressInterval == 0) {
                logger.debug(String.format("Viterbi table filled up to position %d of %d", thisPosition, table.length()));
            }
        }
    }

    private static <D, S> double[] logInitialProbabilities(final ViterbiTable<D, S> table) {
        if (table.logInitialProbabilities == null) {
            final List<S> states = table.states();
            final double[] result = new double[states.size()];
            for (int i = 0; i < result.length; i++) {
                final S state = states.get(i);
                result[i] = checkedLogProbability(() -> table.model().logInitialProbability(state),
                        () -> "initial probability of state " + state);
            }
            table.logInitialProbabilities = result;
        }
        return table.logInitialProbabilities;
    }

    private static <D, S> double[][] logTransitionProbabilities(final ViterbiTable<D, S> table) {
        if (table.logTransitionProbabilities == null) {
            final List<S> states = table.states();
            final double[][] result = new double[states.size()][states.size()];
            for (int i = 0; i < result.length; i++) {
                final S from = states.get(i);
                for (int j = 0; j < result.length; j++) {
                    final S to = states.get(j);
                    result[i][j] = checkedLogProbability(() -> table.model().logTransitionProbability(from, to),
                            () -> "transition probability from " + from + " to " + to);
                }
            }
            table.logTransitionProbabilities = result;
        }
        return table.logTransitionProbabilities;
    }

    private static <D, S> double[] logEmissionProbabilities(final ViterbiTable<D, S> table, final D datum) {
        final double[] cached = table.logEmissionProbabilitiesBySymbol.get(datum);
        if (cached != null) {
            return cached;
        }
        final List<S> states = table.states();
        final double[] result = new double[states.size()];
        for (int i = 0; i < result.length; i++) {
            final S state = states.get(i);
            result[i] = checkedLogProbability(() -> table.model().logEmissionProbability(datum, state),
                    () -> "emission probability of " + datum + " in state " + state);
        }
        table.logEmissionProbabilitiesBySymbol.put(datum, result);
        return result;
    }

    /**
     * Queries the model and makes sure the answer is a usable log probability.
     */
    private static double checkedLogProbability(final Supplier<Double> query, final Supplier<String> what) {
        final double result;
        try {
            result = query.get();
        } catch (final IllegalArgumentException ex) {
            throw new HmmSegException.InvalidModel("the model has no " + what.get(), ex);
        }
        if (!NaturalLogUtils.isValidLogProbability(result)) {
            throw new HmmSegException.InvalidModel(String.format("the %s is not a valid log probability: %s", what.get(), result));
        }
        return result;
    }
}
