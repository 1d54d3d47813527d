package org.broadinstitute.hmmseg.utils;

import org.apache.commons.math3.util.FastMath;

/**
 * Natural-log probability arithmetic.
 *
 * <p>
 *     Probabilities are carried around as plain {@code double}s holding {@code ln(p)}. Under this convention
 *     {@link #IMPOSSIBLE} ({@link Double#NEGATIVE_INFINITY}) stands for probability 0, {@link #CERTAIN} (0.0) for
 *     probability 1, and the product of two probabilities is the sum of their logs. Negative infinity is absorbing
 *     under {@link #product} and compares lower than any finite value, which is plain IEEE 754 behaviour.
 * </p>
 */
public final class NaturalLogUtils {

    /**
     * Log of probability 0.
     */
    public static final double IMPOSSIBLE = Double.NEGATIVE_INFINITY;

    /**
     * Log of probability 1.
     */
    public static final double CERTAIN = 0.0;

    private NaturalLogUtils() { }

    /**
     * Converts a linear-scale probability into its natural log.
     *
     * @param probability the probability, between 0 and 1 inclusive.
     * @return {@link #IMPOSSIBLE} for 0, otherwise {@code ln(probability)}.
     * @throws IllegalArgumentException if {@code probability} is NaN or outside [0, 1].
     */
    public static double fromProbability(final double probability) {
        Utils.validateArg(!Double.isNaN(probability) && probability >= 0 && probability <= 1,
                () -> "a probability must be between 0 and 1 but got " + probability);
        return probability == 0 ? IMPOSSIBLE : FastMath.log(probability);
    }

    /**
     * Converts a log-probability back into linear scale.
     */
    public static double toProbability(final double logProbability) {
        return FastMath.exp(logProbability);
    }

    /**
     * Log of the product of two probabilities given as logs.
     */
    public static double product(final double logA, final double logB) {
        return logA + logB;
    }

    public static boolean isImpossible(final double logProbability) {
        return logProbability == IMPOSSIBLE;
    }

    /**
     * Checks whether a value is a legal log-probability: not NaN and not greater than 0.
     * {@link #IMPOSSIBLE} is legal.
     */
    public static boolean isValidLogProbability(final double logProbability) {
        return !Double.isNaN(logProbability) && logProbability <= CERTAIN;
    }

    /**
     * Computes $\log(\sum_i e^{a_i})$ trying to avoid underflow issues by using the log-sum-exp trick.
     *
     * <p>
     * This trick consists of shifting all the log values by the maximum so that exponent values are
     * much larger (close to 1) before they are summed. Then the result is shifted back down by
     * the same amount in order to obtain the correct value.
     * </p>
     * @return any double value; {@link #IMPOSSIBLE} if every input is impossible or there is no input.
     */
    public static double logSumExp(final double... logValues) {
        Utils.nonNull(logValues);
        if (logValues.length == 0) {
            return IMPOSSIBLE;
        }
        int maxElementIndex = 0;
        for (int i = 1; i < logValues.length; i++) {
            if (logValues[i] > logValues[maxElementIndex]) {
                maxElementIndex = i;
            }
        }
        final double maxValue = logValues[maxElementIndex];
        if (maxValue == IMPOSSIBLE) {
            return maxValue;
        }
        double sum = 1.0;
        for (int i = 0; i < logValues.length; i++) {
            final double curVal = logValues[i];
            if (i == maxElementIndex || curVal == IMPOSSIBLE) {
                continue;
            }
            sum += FastMath.exp(curVal - maxValue);
        }
        if ( Double.isNaN(sum) || sum == Double.POSITIVE_INFINITY ) {
            throw new IllegalArgumentException("logValues must be non-infinite and non-NAN");
        }
        return maxValue + (sum != 1.0 ? FastMath.log(sum) : 0.0);
    }
}
