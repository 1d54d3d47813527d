package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.utils.NaturalLogUtils;
import org.broadinstitute.hmmseg.utils.Utils;

import java.util.List;

/**
 * A hidden Markov model over an ordered list of hidden states that emits one observation per position.
 *
 * <p>
 * The process starts in a virtual <em>begin</em> state, moves into the state of the first position with the initial
 * probabilities and then from state to state with the transition probabilities; each state emits the observation
 * of its position with the emission probabilities.
 * All probabilities are natural logs (see {@link NaturalLogUtils}); {@link Double#NEGATIVE_INFINITY} is an
 * impossible event. No value may be positive or NaN.
 * </p>
 *
 * @param <D> observation type.
 * @param <S> hidden state type.
 */
public interface HiddenMarkovModel<D, S> {

    /**
     * The hidden states, in a fixed order.
     * <p>
     *     Every call returns the same non-empty list without repeats. The decoder breaks ties between equally
     *     likely states in favor of the one listed first.
     * </p>
     */
    List<S> hiddenStates();

    /**
     * Log probability that the first position is in {@code state}.
     *
     * @throws IllegalArgumentException if {@code state} is not one of {@link #hiddenStates()}.
     */
    double logInitialProbability(final S state);

    /**
     * Log probability that a position in {@code currentState} is followed by one in {@code nextState}.
     *
     * @throws IllegalArgumentException if either state is not one of {@link #hiddenStates()}.
     */
    double logTransitionProbability(final S currentState, final S nextState);

    /**
     * Log probability that {@code state} emits {@code data}.
     *
     * @throws IllegalArgumentException if {@code state} is not one of {@link #hiddenStates()}.
     * @throws org.broadinstitute.hmmseg.exceptions.HmmSegException.InvalidModel if the model has no emission
     *      probability for {@code data}.
     */
    double logEmissionProbability(final D data, final S state);

    /**
     * Joint log probability of {@code data} and the hidden state sequence {@code path}:
     *
     *     \log(\pi_{s_1}) + \log(e_{s_1}(d_1)) + \sum_{t=2}^{T} [ \log(T_{s_{t-1}, s_t}) + \log(e_{s_t}(d_t)) ]
     *
     * @return 0 for an empty sequence.
     * @throws IllegalArgumentException if {@code path} and {@code data} differ in length.
     */
    default double logProbability(final List<D> data, final List<S> path) {
        Utils.nonNull(data, "the data cannot be null");
        Utils.nonNull(path, "the state path cannot be null");
        Utils.validateArg(data.size() == path.size(), "the data and path must have the same length");
        double result = NaturalLogUtils.CERTAIN;
        for (int i = 0; i < data.size(); i++) {
            final double logArrival = i == 0 ? logInitialProbability(path.get(0))
                    : logTransitionProbability(path.get(i - 1), path.get(i));
            result = NaturalLogUtils.product(result,
                    NaturalLogUtils.product(logArrival, logEmissionProbability(data.get(i), path.get(i))));
        }
        return result;
    }
}
