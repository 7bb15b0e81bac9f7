package org.broadinstitute.msa.utils.io;

import htsjdk.tribble.readers.LineReader;

import java.io.IOException;

/**
 * A {@link LineReader} that can go back to the beginning of its input.
 * <p>
 * Lines are returned without their terminator. Readers that need more than one pass over the same text
 * (for example the Stockholm reader) call {@link #rewind()} between passes.
 * </p>
 */
public interface RewindableLineReader extends LineReader {

    /**
     * Repositions the reader so that the next {@link #readLine()} returns the first line of the input again.
     * @throws IOException if the underlying input cannot be reopened.
     */
    void rewind() throws IOException;

    /**
     * @return the 1-based number of the line last returned by {@link #readLine()}, or 0 if none has been read since
     * construction or the last {@link #rewind()}.
     */
    int getLineNumber();

    /**
     * @return a name for this input to use in messages, or {@code null} if the input is anonymous.
     */
    default String getSourceName() {
        return null;
    }
}
