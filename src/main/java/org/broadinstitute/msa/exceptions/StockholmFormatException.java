package org.broadinstitute.msa.exceptions;

import org.broadinstitute.msa.codecs.stockholm.StockholmLine;

/**
 * <p/>
 * Class StockholmFormatException.
 * <p/>
 * Structural violations found while reading a Stockholm alignment. Each subtype names one rule; the message carries
 * the input name, the offending line number and the line content.
 */
public class StockholmFormatException extends UserException {
    private static final long serialVersionUID = 0L;

    protected StockholmFormatException(final String source, final String message) {
        super(source == null ?
                String.format("Stockholm format error: %s", message) :
                String.format("Stockholm format error in '%s': %s", source, message));
    }

    protected StockholmFormatException(final StockholmLine line, final String message) {
        this(line.getSource(), String.format("%s at line %d: \"%s\"", message, line.getLineNumber(), line.getText()));
    }

    public static final class DuplicateSequenceLabel extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public DuplicateSequenceLabel(final StockholmLine line, final String label) {
            super(line, String.format("Found multiple data lines under same name '%s'", label));
        }
    }

    public static final class UndeclaredSequenceReference extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public UndeclaredSequenceReference(final StockholmLine line, final String label) {
            super(line, String.format("Markup line references nonexistent data '%s'", label));
        }
    }

    public static final class DuplicateColumnFeature extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public DuplicateColumnFeature(final StockholmLine line, final String feature) {
            super(line, String.format("Found duplicate GC label '%s'", feature));
        }
    }

    public static final class DuplicateSequenceColumnFeature extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public DuplicateSequenceColumnFeature(final StockholmLine line, final String feature, final String label) {
            super(line, String.format("Found duplicate GR label '%s' associated with data label '%s'", feature, label));
        }
    }

    public static final class MalformedMarkupLine extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public MalformedMarkupLine(final StockholmLine line, final int expectedFields) {
            super(line, String.format("%s markup line needs at least %d fields", line.getType().getMarker(), expectedFields));
        }
    }

    public static final class MalformedDataLine extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public MalformedDataLine(final StockholmLine line) {
            super(line, "Data line needs a sequence name followed by sequence characters");
        }
    }

    public static final class EmptyAlignment extends StockholmFormatException {
        private static final long serialVersionUID = 0L;

        public EmptyAlignment(final String source) {
            super(source, "No data present in file");
        }
    }
}
