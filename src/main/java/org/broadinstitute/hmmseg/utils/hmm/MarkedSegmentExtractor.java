package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.function.Predicate;

/**
 * Condenses a decoded hidden-state path into the maximal runs of consecutive positions whose state is marked.
 */
public final class MarkedSegmentExtractor {

    private MarkedSegmentExtractor() {}

    /**
     * Returns the maximal segments of consecutive marked states in a path.
     * <p>
     *     A segment starts at index {@code i} when {@code path[i]} is marked and {@code i} is 0 or
     *     {@code path[i - 1]} is unmarked; it ends at the first index {@code j >= i} such that
     *     {@code path[j + 1]} is unmarked or {@code j} is the last index.
     * </p>
     *
     * @param path the decoded hidden-state path.
     * @param isMarked tells which states are marked.
     * @param <S> the hidden state type.
     * @return never {@code null}, a modifiable list of non-overlapping segments in increasing order that jointly
     *    cover exactly the marked positions; empty if there is none.
     * @throws IllegalArgumentException if {@code path} or {@code isMarked} is {@code null}.
     */
    public static <S> List<PathSegment> extractMarkedSegments(final List<S> path, final Predicate<? super S> isMarked) {
        Utils.nonNull(path, "the path cannot be null");
        Utils.nonNull(isMarked, "the marked state predicate cannot be null");

        if (path.isEmpty()) {
            return new ArrayList<>(0);
        }

        final List<PathSegment> result = new ArrayList<>();

        int currentStartIndex = -1; // start index of the marked run being traversed; -1 when outside one.
        final ListIterator<S> pathIterator = path.listIterator();
        while (pathIterator.hasNext()) {
            final int index = pathIterator.nextIndex();
            final boolean marked = isMarked.test(pathIterator.next());
            if (marked && currentStartIndex < 0) {
                currentStartIndex = index;
            } else if (!marked && currentStartIndex >= 0) {
                result.add(new PathSegment(currentStartIndex, index - 1));
                currentStartIndex = -1;
            }
        }
        if (currentStartIndex >= 0) {
            result.add(new PathSegment(currentStartIndex, path.size() - 1));
        }
        return result;
    }

    /**
     * Convenience version of {@link #extractMarkedSegments(List, Predicate)} that marks the states of a collection.
     */
    public static <S> List<PathSegment> extractMarkedSegments(final List<S> path, final Collection<? super S> markedStates) {
        Utils.nonNull(markedStates, "the marked state collection cannot be null");
        return extractMarkedSegments(path, markedStates::contains);
    }

    /**
     * @return the number of path positions covered by the given segments.
     */
    public static int coveredPositions(final List<PathSegment> segments) {
        Utils.nonNull(segments, "the segment list cannot be null");
        int result = 0;
        for (final PathSegment segment : segments) {
            result += segment.size();
        }
        return result;
    }
}
