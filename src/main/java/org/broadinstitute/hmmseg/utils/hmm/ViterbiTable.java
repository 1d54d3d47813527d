package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.utils.NaturalLogUtils;
import org.broadinstitute.hmmseg.utils.Utils;

import java.util.*;

/**
 * Dynamic programming table of the Viterbi algorithm: for every hidden state and every position from 0 to
 * the sequence length it holds the log probability of the best path that ends in that state at that position,
 * and the index of the state that precedes it on that path.
 *
 * <p>
 *     Position 0 is the virtual begin position; its column is the base case (log probability
 *     {@link NaturalLogUtils#CERTAIN} and predecessor {@link #BEGIN}) and is filled on construction. Positions
 *     1 to {@link #length()} correspond to the observed data elements 0 to {@code length() - 1}.
 * </p>
 * <p>
 *     The table is filled column by column, in increasing position order, by
 *     {@link ViterbiAlgorithm#computeBestLogProbability}. Columns are never recomputed once filled.
 * </p>
 *
 * @param <D> the observed data type.
 * @param <S> the hidden state type.
 */
public final class ViterbiTable<D, S> {

    /**
     * Predecessor index of the columns 0 and 1, which are preceded by the virtual begin state.
     */
    public static final int BEGIN = -1;

    private final HiddenMarkovModel<D, S> model;

    private final List<D> data;

    private final List<S> states;

    private final Map<S, Integer> stateIndexes;

    // [state][position]
    final double[][] logProbabilities;

    // [state][position]
    final int[][] backPointers;

    private final int progressLogInterval;

    private int filledPosition;

    // Model look-ups, fetched the first time the fill needs them.
    double[] logInitialProbabilities;
    double[][] logTransitionProbabilities;
    final Map<D, double[]> logEmissionProbabilitiesBySymbol = new HashMap<>();

    ViterbiTable(final List<D> data, final HiddenMarkovModel<D, S> model, final int progressLogInterval) {
        this.progressLogInterval = progressLogInterval;
        this.model = Utils.nonNull(model, "the model cannot be null");
        this.data = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(data, "the data cannot be null")));
        this.states = Collections.unmodifiableList(checkStates(model.hiddenStates()));
        this.stateIndexes = new HashMap<>(states.size() * 2);
        for (int i = 0; i < states.size(); i++) {
            stateIndexes.put(states.get(i), i);
        }
        final int numStates = states.size();
        logProbabilities = new double[numStates][this.data.size() + 1];
        backPointers = new int[numStates][this.data.size() + 1];
        for (int i = 0; i < numStates; i++) {
            logProbabilities[i][0] = NaturalLogUtils.CERTAIN;
            backPointers[i][0] = BEGIN;
        }
        filledPosition = 0;
    }

    private static <S> List<S> checkStates(final List<S> states) {
        if (states == null || states.isEmpty()) {
            throw new HmmSegException.InvalidModel("the model must have at least one hidden state");
        }
        final List<S> result = new ArrayList<>(states);
        final Set<S> seen = new HashSet<>(result.size() * 2);
        for (final S state : result) {
            if (state == null) {
                throw new HmmSegException.InvalidModel("the hidden state list contains a null");
            } else if (!seen.add(state)) {
                throw new HmmSegException.InvalidModel("repeated hidden state: " + state);
            }
        }
        return result;
    }

    /**
     * @return the number of observed data elements; the last position of the table.
     */
    public int length() {
        return data.size();
    }

    /**
     * @return the last position whose column has been computed; 0 for a table that has not been filled.
     */
    public int getFilledPosition() {
        return filledPosition;
    }

    void setFilledPosition(final int position) {
        filledPosition = position;
    }

    /**
     * @return positions between two progress messages while the table is filled; 0 or less if none are logged.
     */
    public int getProgressLogInterval() {
        return progressLogInterval;
    }

    /**
     * @return the hidden states in tie-break order, as returned by the model when the table was created.
     */
    public List<S> states() {
        return states;
    }

    public List<D> data() {
        return data;
    }

    public HiddenMarkovModel<D, S> model() {
        return model;
    }

    /**
     * Returns the log probability of the best path ending in a state at a position.
     *
     * @param state the query state.
     * @param position the query position, between 0 and {@link #length()}.
     * @return a value between {@link Double#NEGATIVE_INFINITY} and 0 inclusive.
     * @throws IllegalArgumentException if {@code state} is not one of the table states.
     * @throws HmmSegException.IndexOutOfRange if {@code position} is negative or beyond {@link #length()}.
     * @throws HmmSegException.DecoderNotRun if the table has not been filled up to {@code position}.
     */
    public double getLogProbability(final S state, final int position) {
        return getLogProbability(stateIndex(state), position);
    }

    public double getLogProbability(final int stateIndex, final int position) {
        Utils.validIndex(stateIndex, states.size());
        checkFilled(position);
        return logProbabilities[stateIndex][position];
    }

    /**
     * Returns the index of the predecessor of a state on the best path that ends in that state at a position.
     *
     * @return {@link #BEGIN} for positions 0 and 1.
     */
    public int getBackPointer(final int stateIndex, final int position) {
        Utils.validIndex(stateIndex, states.size());
        checkFilled(position);
        return backPointers[stateIndex][position];
    }

    /**
     * Returns the predecessor of a state on the best path that ends in that state at a position.
     *
     * @return empty if the predecessor is the virtual begin state.
     */
    public Optional<S> getPredecessor(final S state, final int position) {
        final int backPointer = getBackPointer(stateIndex(state), position);
        return backPointer == BEGIN ? Optional.empty() : Optional.of(states.get(backPointer));
    }

    private int stateIndex(final S state) {
        final Integer result = stateIndexes.get(Utils.nonNull(state, "the state cannot be null"));
        if (result == null) {
            throw new IllegalArgumentException("unknown state: " + state);
        }
        return result;
    }

    /**
     * Checks that a position is within the table and that its column has been computed.
     */
    void checkFilled(final int position) {
        if (position < 0 || position > data.size()) {
            throw new HmmSegException.IndexOutOfRange(position, data.size());
        } else if (position > filledPosition) {
            throw new HmmSegException.DecoderNotRun(position, filledPosition);
        }
    }
}
