package org.broadinstitute.hmmseg.exceptions;

/**
 * An error the user cannot fix from the command line: a broken model implementation, a decoder query made out of
 * order, or an internal inconsistency.
 */
public class HmmSegException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public HmmSegException(final String msg) {
        super(msg);
    }

    public HmmSegException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * A state the code rules out was reached anyway.
     */
    public static class ShouldNeverReachHereException extends HmmSegException {
        private static final long serialVersionUID = 0L;

        public ShouldNeverReachHereException(final String s) {
            super(s);
        }
    }

    /**
     * The hidden Markov model cannot be used for decoding: it has no states, repeated states, or lacks
     * (or has an illegal value for) a log-probability that the decoder needs.
     */
    public static class InvalidModel extends HmmSegException {
        private static final long serialVersionUID = 0L;

        public InvalidModel(final String message) {
            super("Invalid hidden Markov model: " + message);
        }

        public InvalidModel(final String message, final Throwable throwable) {
            super("Invalid hidden Markov model: " + message, throwable);
        }
    }

    /**
     * A probability or path query refers to a position past the end of the decoded sequence.
     */
    public static class IndexOutOfRange extends HmmSegException {
        private static final long serialVersionUID = 0L;

        public IndexOutOfRange(final int position, final int length) {
            super(String.format("Position %d is out of range for a sequence of length %d", position, length));
        }
    }

    /**
     * The Viterbi table has not been filled as far as a query or a path reconstruction requires.
     */
    public static class DecoderNotRun extends HmmSegException {
        private static final long serialVersionUID = 0L;

        public DecoderNotRun(final int requestedPosition, final int filledPosition) {
            super(String.format("The decoder has not been run up to position %d; the table is only filled up to position %d",
                    requestedPosition, filledPosition));
        }
    }
}
