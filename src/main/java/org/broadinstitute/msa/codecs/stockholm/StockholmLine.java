package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.utils.Utils;

/**
 * A single physical line of a Stockholm input together with where it came from and how it was classified.
 */
public final class StockholmLine {

    private final String source;

    private final int lineNumber;

    private final String text;

    private final StockholmLineType type;

    /**
     * @param source name of the input used in error messages, {@code null} if anonymous.
     * @param lineNumber 1-based line number within the input.
     * @param text line content without its terminator.
     */
    public StockholmLine(final String source, final int lineNumber, final String text) {
        Utils.validateArg(lineNumber > 0, () -> "line numbers are 1-based but got " + lineNumber);
        this.source = source;
        this.lineNumber = lineNumber;
        this.text = Utils.nonNull(text, "the line text cannot be null");
        this.type = StockholmLineType.classify(text);
    }

    /**
     * @return the input name, or {@code null} if the input is anonymous.
     */
    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getText() {
        return text;
    }

    public StockholmLineType getType() {
        return type;
    }

    @Override
    public String toString() {
        return String.format("%s:%d [%s] %s", source == null ? "-" : source, lineNumber, type, text);
    }
}
