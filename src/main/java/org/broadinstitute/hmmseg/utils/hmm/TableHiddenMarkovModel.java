package org.broadinstitute.hmmseg.utils.hmm;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.utils.NaturalLogUtils;
import org.broadinstitute.hmmseg.utils.Utils;

import java.util.*;
import java.util.function.Supplier;

/**
 * {@link HiddenMarkovModel} backed by complete, explicit log-probability tables over a finite state list and a finite
 * alphabet.
 *
 * <p>
 *     Instances are immutable and built with a {@link Builder}: every initial, transition and emission
 *     entry must be set before {@link Builder#build()}; an absent entry is an error, never an implicit 0.
 *     Use {@link NaturalLogUtils#IMPOSSIBLE} explicitly for impossible events.
 * </p>
 *
 * @param <D> the observed symbol type.
 * @param <S> the hidden state type.
 */
public final class TableHiddenMarkovModel<D, S> implements HiddenMarkovModel<D, S> {

    private static final Logger logger = LogManager.getLogger(TableHiddenMarkovModel.class);

    /**
     * Maximum absolute difference from 1 tolerated for probability rows before a warning is logged.
     */
    public static final double NORMALIZATION_TOLERANCE = 1e-2;

    private final List<S> states;

    private final List<D> alphabet;

    private final Map<S, Integer> stateIndexes;

    private final Map<D, Integer> symbolIndexes;

    private final double[] logInitialProbabilities;

    // [from][to]
    private final double[][] logTransitionProbabilities;

    // [state][symbol]
    private final double[][] logEmissionProbabilities;

    private TableHiddenMarkovModel(final Builder<D, S> builder) {
        states = Collections.unmodifiableList(new ArrayList<>(builder.states));
        alphabet = Collections.unmodifiableList(new ArrayList<>(builder.alphabet));
        stateIndexes = builder.stateIndexes;
        symbolIndexes = builder.symbolIndexes;
        logInitialProbabilities = new double[states.size()];
        logTransitionProbabilities = new double[states.size()][states.size()];
        logEmissionProbabilities = new double[states.size()][alphabet.size()];
        for (int i = 0; i < states.size(); i++) {
            logInitialProbabilities[i] = builder.logInitialProbabilities[i];
            for (int j = 0; j < states.size(); j++) {
                logTransitionProbabilities[i][j] = builder.logTransitionProbabilities[i][j];
            }
            for (int j = 0; j < alphabet.size(); j++) {
                logEmissionProbabilities[i][j] = builder.logEmissionProbabilities[i][j];
            }
        }
    }

    @Override
    public List<S> hiddenStates() {
        return states;
    }

    /**
     * Returns the symbols this model can emit, in declaration order.
     * @return never {@code null}, unmodifiable.
     */
    public List<D> alphabet() {
        return alphabet;
    }

    @Override
    public double logInitialProbability(final S state) {
        return logInitialProbabilities[stateIndex(state)];
    }

    @Override
    public double logTransitionProbability(final S currentState, final S nextState) {
        return logTransitionProbabilities[stateIndex(currentState)][stateIndex(nextState)];
    }

    @Override
    public double logEmissionProbability(final D data, final S state) {
        final int stateIndex = stateIndex(state);
        final Integer symbolIndex = symbolIndexes.get(data);
        if (symbolIndex == null) {
            throw new HmmSegException.InvalidModel(String.format("there is no emission probability for symbol '%s' in state '%s'", data, state));
        }
        return logEmissionProbabilities[stateIndex][symbolIndex];
    }

    private int stateIndex(final S state) {
        final Integer result = stateIndexes.get(Utils.nonNull(state, "the state cannot be null"));
        if (result == null) {
            throw new IllegalArgumentException("unknown state: " + state);
        }
        return result;
    }

    /**
     * Builder for {@link TableHiddenMarkovModel}.
     *
     * @param <D> the observed symbol type.
     * @param <S> the hidden state type.
     */
    public static final class Builder<D, S> {

        private final List<S> states;
        private final List<D> alphabet;
        private final Map<S, Integer> stateIndexes;
        private final Map<D, Integer> symbolIndexes;

        // null elements are entries not set yet.
        private final Double[] logInitialProbabilities;
        private final Double[][] logTransitionProbabilities;
        private final Double[][] logEmissionProbabilities;

        /**
         * Creates a builder for a model over the given states and alphabet.
         *
         * @param states ordered hidden states; the order is the decoder tie-break order.
         * @param alphabet the symbols the model can emit.
         * @throws HmmSegException.InvalidModel if {@code states} is empty, or either list has repeated or
         *    {@code null} elements.
         */
        public Builder(final List<S> states, final List<D> alphabet) {
            Utils.nonNull(states, "the state list cannot be null");
            Utils.nonNull(alphabet, "the alphabet cannot be null");
            if (states.isEmpty()) {
                throw new HmmSegException.InvalidModel("the model must have at least one hidden state");
            }
            try {
                Utils.containsNoNull(states, "the state list cannot contain nulls");
                Utils.containsNoNull(alphabet, "the alphabet cannot contain nulls");
                Utils.checkForDuplicatesAndReturnSet(states, "Repeated hidden state.");
                Utils.checkForDuplicatesAndReturnSet(alphabet, "Repeated symbol.");
            } catch (final IllegalArgumentException ex) {
                throw new HmmSegException.InvalidModel(ex.getMessage(), ex);
            }
            this.states = new ArrayList<>(states);
            this.alphabet = new ArrayList<>(alphabet);
            this.stateIndexes = indexMap(states);
            this.symbolIndexes = indexMap(alphabet);
            this.logInitialProbabilities = new Double[states.size()];
            this.logTransitionProbabilities = new Double[states.size()][states.size()];
            this.logEmissionProbabilities = new Double[states.size()][alphabet.size()];
        }

        private static <T> Map<T, Integer> indexMap(final List<T> elements) {
            final Map<T, Integer> result = new HashMap<>(elements.size() * 2);
            for (int i = 0; i < elements.size(); i++) {
                result.put(elements.get(i), i);
            }
            return result;
        }

        public Builder<D, S> setLogInitialProbability(final S state, final double logProbability) {
            logInitialProbabilities[stateIndex(state)] = checkLogProbability(logProbability,
                    () -> "initial probability of " + state);
            return this;
        }

        public Builder<D, S> setLogTransitionProbability(final S from, final S to, final double logProbability) {
            logTransitionProbabilities[stateIndex(from)][stateIndex(to)] = checkLogProbability(logProbability,
                    () -> "transition probability from " + from + " to " + to);
            return this;
        }

        public Builder<D, S> setLogEmissionProbability(final S state, final D symbol, final double logProbability) {
            final Integer symbolIndex = symbolIndexes.get(symbol);
            if (symbolIndex == null) {
                throw new HmmSegException.InvalidModel("symbol not in the alphabet: " + symbol);
            }
            logEmissionProbabilities[stateIndex(state)][symbolIndex] = checkLogProbability(logProbability,
                    () -> "emission probability of " + symbol + " in " + state);
            return this;
        }

        private int stateIndex(final S state) {
            final Integer result = stateIndexes.get(state);
            if (result == null) {
                throw new HmmSegException.InvalidModel("unknown state: " + state);
            }
            return result;
        }

        private static double checkLogProbability(final double value, final Supplier<String> what) {
            if (!NaturalLogUtils.isValidLogProbability(value)) {
                throw new HmmSegException.InvalidModel(String.format("the %s is not a valid log probability: %s", what.get(), value));
            }
            return value;
        }

        /**
         * Composes the model.
         *
         * @return never {@code null}.
         * @throws HmmSegException.InvalidModel if any initial, transition or emission entry has not been set.
         */
        public TableHiddenMarkovModel<D, S> build() {
            for (int i = 0; i < states.size(); i++) {
                final S state = states.get(i);
                if (logInitialProbabilities[i] == null) {
                    throw new HmmSegException.InvalidModel("missing initial probability for state " + state);
                }
                for (int j = 0; j < states.size(); j++) {
                    if (logTransitionProbabilities[i][j] == null) {
                        throw new HmmSegException.InvalidModel("missing transition probability from " + state + " to " + states.get(j));
                    }
                }
                for (int j = 0; j < alphabet.size(); j++) {
                    if (logEmissionProbabilities[i][j] == null) {
                        throw new HmmSegException.InvalidModel("missing emission probability of " + alphabet.get(j) + " in " + state);
                    }
                }
            }
            warnIfNotNormalized("initial probabilities", logInitialProbabilities);
            for (int i = 0; i < states.size(); i++) {
                warnIfNotNormalized("transition probabilities from " + states.get(i), logTransitionProbabilities[i]);
                if (!alphabet.isEmpty()) {
                    warnIfNotNormalized("emission probabilities of " + states.get(i), logEmissionProbabilities[i]);
                }
            }
            return new TableHiddenMarkovModel<>(this);
        }

        private static void warnIfNotNormalized(final String what, final Double[] logProbabilities) {
            final double[] values = Arrays.stream(logProbabilities).mapToDouble(Double::doubleValue).toArray();
            final double sum = NaturalLogUtils.toProbability(NaturalLogUtils.logSumExp(values));
            if (Math.abs(sum - 1.0) > NORMALIZATION_TOLERANCE) {
                logger.warn(String.format("The %s add up to %.4f rather than 1", what, sum));
            }
        }
    }
}
