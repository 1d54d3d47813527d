package org.broadinstitute.hmmseg.exceptions;

import java.nio.file.Path;

/**
 * An error the user can fix: a missing or unreadable input, an unwritable output, a malformed model file or a bad
 * option value. {@link org.broadinstitute.hmmseg.Main} reports these without a stack trace.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        return t.getMessage() == null ? t.getClass().getName() : t.getMessage();
    }

    private static String describe(final Path path) {
        return path.toAbsolutePath().toUri().toString();
    }

    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final Exception e) {
            this(describe(file), getMessage(e), e);
        }

        public CouldNotReadInputFile(final String source, final String message, final Throwable cause) {
            super(String.format("Couldn't read %s: %s", source, message), cause);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message) {
            super(String.format("Couldn't write %s because %s", describe(file), message));
        }

        public CouldNotCreateOutputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't write %s because %s (%s)", describe(file), message, getMessage(e)), e);
        }
    }

    /**
     * A model or sequence file that does not follow its format.
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final String source, final String message) {
            super(String.format("Malformed file %s: %s", source, message));
        }

        public MalformedFile(final String source, final String message, final Throwable cause) {
            super(String.format("Malformed file %s: %s", source, message), cause);
        }

        public MalformedFile(final String source, final int lineNumber, final String message) {
            super(String.format("Malformed file %s at line %d: %s", source, lineNumber, message));
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }
    }
}
