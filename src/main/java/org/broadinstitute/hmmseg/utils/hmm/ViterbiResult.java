package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link ViterbiAlgorithm#apply}: the decoded hidden-state path and its joint log probability
 * with the observed data.
 *
 * @param <S> the hidden state type.
 */
public final class ViterbiResult<S> {

    private final List<S> path;

    private final double logProbability;

    public ViterbiResult(final List<S> path, final double logProbability) {
        this.path = Collections.unmodifiableList(Utils.nonNull(path, "the path cannot be null"));
        this.logProbability = logProbability;
    }

    /**
     * @return never {@code null}, unmodifiable, one state per observed data element.
     */
    public List<S> getPath() {
        return path;
    }

    public double getLogProbability() {
        return logProbability;
    }

    @Override
    public String toString() {
        return "ViterbiResult{" +
                "length=" + path.size() +
                ", logProbability=" + logProbability +
                '}';
    }
}
