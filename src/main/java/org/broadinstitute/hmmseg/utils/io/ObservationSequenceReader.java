package org.broadinstitute.hmmseg.utils.io;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.utils.Utils;
import org.broadinstitute.hmmseg.utils.config.ConfigFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads an observation sequence of single-character symbols from a plain or FASTA-like text file.
 *
 * <p>
 *     Lines that start with the configured comment prefix
 *     ({@link org.broadinstitute.hmmseg.utils.config.HmmSegConfig#sequence_line_comment_prefix()}) are skipped.
 *     Every other character that is not in the alphabet, including white space and line breaks, is dropped. The
 *     comparison is case sensitive unless the reader upper-cases the input first.
 * </p>
 */
public final class ObservationSequenceReader {

    private static final Logger logger = LogManager.getLogger(ObservationSequenceReader.class);

    private final Set<Character> alphabet;

    private final boolean upperCase;

    private final String commentPrefix;

    /**
     * @param alphabet the symbols to keep.
     * @param upperCase whether to upper-case the input before filtering.
     */
    public ObservationSequenceReader(final Collection<Character> alphabet, final boolean upperCase) {
        this(alphabet, upperCase, ConfigFactory.getInstance().getHmmSegConfig().sequence_line_comment_prefix());
    }

    /**
     * @param commentPrefix lines starting with this are skipped; {@code null} or empty to keep every line.
     */
    public ObservationSequenceReader(final Collection<Character> alphabet, final boolean upperCase, final String commentPrefix) {
        Utils.nonNull(alphabet, "the alphabet cannot be null");
        Utils.containsNoNull(alphabet, "the alphabet cannot contain nulls");
        this.alphabet = new HashSet<>(alphabet);
        this.upperCase = upperCase;
        this.commentPrefix = commentPrefix;
    }

    /**
     * Reads the sequence in a file.
     *
     * <p>The file is decoded as ISO-8859-1 so any byte is readable; bytes outside the alphabet are dropped.</p>
     *
     * @return never {@code null}, possibly empty.
     * @throws UserException.CouldNotReadInputFile if the file cannot be read.
     */
    public List<Character> read(final Path path) {
        Utils.nonNull(path, "the input path cannot be null");
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            final List<Character> result = read(reader);
            logger.debug(String.format("Read %d symbols from %s", result.size(), path));
            return result;
        } catch (final IOException ex) {
            throw new UserException.CouldNotReadInputFile(path, ex);
        }
    }

    /**
     * Reads the sequence from a character stream, which is not closed.
     *
     * @return never {@code null}, possibly empty.
     * @throws IOException if the reader fails.
     */
    public List<Character> read(final Reader reader) throws IOException {
        Utils.nonNull(reader, "the reader cannot be null");
        final BufferedReader bufferedReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        final List<Character> result = new ArrayList<>();
        int droppedCount = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            if (StringUtils.isNotEmpty(commentPrefix) && line.startsWith(commentPrefix)) {
                continue;
            }
            final String text = upperCase ? StringUtils.upperCase(line, Locale.ROOT) : line;
            for (int i = 0; i < text.length(); i++) {
                final char symbol = text.charAt(i);
                if (alphabet.contains(symbol)) {
                    result.add(symbol);
                } else if (!Character.isWhitespace(symbol)) {
                    droppedCount++;
                }
            }
        }
        if (droppedCount > 0) {
            logger.debug(String.format("Dropped %d characters that are not in the alphabet", droppedCount));
        }
        return result;
    }
}
