package org.broadinstitute.msa.utils.io;

import org.broadinstitute.msa.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

/**
 * Rewindable line reader over in-memory text.
 */
public final class StringLineReader implements RewindableLineReader {

    private final String text;

    private final String sourceName;

    private BufferedReader in;

    private int lineNumber;

    public StringLineReader(final String text) {
        this(text, null);
    }

    public StringLineReader(final String text, final String sourceName) {
        this.text = Utils.nonNull(text, "the text cannot be null");
        this.sourceName = sourceName;
        this.in = new BufferedReader(new StringReader(text));
    }

    @Override
    public String readLine() throws IOException {
        final String line = in.readLine();
        if (line != null) {
            lineNumber++;
        }
        return line;
    }

    @Override
    public void rewind() {
        in = new BufferedReader(new StringReader(text));
        lineNumber = 0;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String getSourceName() {
        return sourceName;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
