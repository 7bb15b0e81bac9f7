package org.broadinstitute.msa.codecs.stockholm;

import htsjdk.tribble.readers.LineReader;
import org.broadinstitute.msa.utils.Utils;
import org.broadinstitute.msa.utils.io.PathLineReader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Recognizes Stockholm input by its first line.
 */
public final class StockholmSniffer {

    /**
     * The first line of a Stockholm file must start with this exact text.
     */
    public static final String SIGNATURE = "# STOCKHOLM 1.0";

    private StockholmSniffer() {}

    /**
     * Reads exactly one line from {@code reader} and checks it for the signature.
     * <p>
     * The reader is left positioned after that line; callers that go on to read the alignment must rewind it.
     * </p>
     *
     * @return {@code true} iff the first line starts with {@link #SIGNATURE}; {@code false} for empty input.
     * @throws IOException if reading fails.
     */
    public static boolean isStockholm(final LineReader reader) throws IOException {
        Utils.nonNull(reader, "the reader cannot be null");
        return startsWithSignature(reader.readLine());
    }

    /**
     * @param firstLine first line of the input without its terminator, {@code null} if the input is empty.
     */
    public static boolean startsWithSignature(final String firstLine) {
        return firstLine != null && firstLine.startsWith(SIGNATURE);
    }

    /**
     * Checks whether a file looks like a Stockholm alignment. Any failure to read it counts as "no".
     */
    public static boolean canDecode(final Path path) {
        if (path == null) {
            return false;
        }
        try (final PathLineReader reader = new PathLineReader(path)) {
            return isStockholm(reader);
        } catch (final Exception e) {  // contract of canDecode is to trap every exception
            return false;
        }
    }
}
