package org.broadinstitute.hmmseg.utils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.*;
import java.util.function.Supplier;

/**
 * Argument checks and small helpers shared across hmmseg.
 *
 * <p>The argument checks throw {@link IllegalArgumentException}.</p>
 */
public final class Utils {

    private static final Logger logger = LogManager.getLogger(Utils.class);

    private static final DateTimeFormatter DISPLAY_DATE_TIME = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.LONG);

    private static final int WARNING_BORDER_WIDTH = 80;

    /**
     * When this boolean system property is true, {@link #warnUser(Logger, String)} throws instead of logging.
     */
    public static final String STRICT_WARNINGS_PROPERTY = "hmmseg.strictWarnings";

    private Utils() { }

    public static void warnUser(final String msg) {
        warnUser(logger, msg);
    }

    /**
     * Logs {@code msg} as a framed warning.
     *
     * @throws IllegalStateException if {@value #STRICT_WARNINGS_PROPERTY} is set
     */
    public static void warnUser(final Logger logger, final String msg) {
        if (Boolean.getBoolean(STRICT_WARNINGS_PROPERTY)) {
            throw new IllegalStateException(msg);
        }
        warnUserLines(msg).forEach(logger::warn);
    }

    public static List<String> warnUserLines(final String msg) {
        final String border = dupChar('*', WARNING_BORDER_WIDTH);
        return Arrays.asList(border, "", "Warning: " + msg, "", border);
    }

    /**
     * @return {@code c} repeated {@code nCopies} times
     */
    public static String dupChar(final char c, final int nCopies) {
        final char[] chars = new char[nCopies];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * @return {@code object}
     * @throws IllegalArgumentException with {@code message} if {@code object} is null
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * @throws IllegalArgumentException with {@code message} if {@code collection} is null or holds a null
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        // contains(null) throws on some sets
        if (collection.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * @return the elements of {@code c} in iteration order
     * @throws IllegalArgumentException naming the first repeated element
     */
    public static <E> Set<E> checkForDuplicatesAndReturnSet(final Collection<E> c, final String message) {
        final Set<E> set = new LinkedHashSet<>();
        for (final E element : c) {
            if (!set.add(element)) {
                throw new IllegalArgumentException(message + "  Value " + element + " appears more than once.");
            }
        }
        return set;
    }

    /**
     * @return {@code index}
     * @throws IllegalArgumentException unless {@code 0 <= index < length}
     */
    public static int validIndex(final int index, final int length) {
        if (index < 0 || index >= length) {
            throw new IllegalArgumentException(String.format("index %d is not within [0, %d)", index, length));
        }
        return index;
    }

    public static void validateArg(final boolean condition, final String msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg.get());
        }
    }

    public static String getDateTimeForDisplay(final ZonedDateTime dateTime) {
        return dateTime.format(DISPLAY_DATE_TIME);
    }

    /**
     * Makes number formatting independent of the platform locale.
     */
    public static void forceJVMLocaleToUSEnglish() {
        Locale.setDefault(Locale.US);
    }
}
