package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.utils.Utils;

/**
 * Closed interval {@code [start, end]} of 0-based indexes into a decoded path.
 */
public final class PathSegment {

    private final int start;

    private final int end;

    /**
     * @param start first index of the segment (inclusive).
     * @param end last index of the segment (inclusive).
     * @throws IllegalArgumentException if {@code start} is negative or greater than {@code end}.
     */
    public PathSegment(final int start, final int end) {
        Utils.validateArg(start >= 0, () -> "the start cannot be negative: " + start);
        Utils.validateArg(start <= end, () -> "the start cannot be greater than the end: " + start + " > " + end);
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * @return the number of path indexes covered; always 1 or more.
     */
    public int size() {
        return end - start + 1;
    }

    public boolean contains(final int index) {
        return index >= start && index <= end;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final PathSegment that = (PathSegment) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
