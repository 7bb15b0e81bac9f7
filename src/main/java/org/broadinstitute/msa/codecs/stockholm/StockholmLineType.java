package org.broadinstitute.msa.codecs.stockholm;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.msa.utils.Utils;

/**
 * Kinds of physical lines found in a Stockholm alignment.
 * <p>
 * Classification only looks at the line prefix. A data line is any line that is not blank, does not start with
 * {@code #} and does not start with the {@code //} record terminator. Comment lines, including the
 * {@code # STOCKHOLM 1.0} header, are ignorable.
 * </p>
 */
public enum StockholmLineType {

    /** A sequence name followed by its aligned characters. */
    DATA(null),

    /** Alignment-wide feature: {@code #=GF <feature> <free text>}. */
    GF("#=GF"),

    /** Per-sequence feature: {@code #=GS <seqname> <feature> <free text>}. */
    GS("#=GS"),

    /** Per-sequence per-column feature: {@code #=GR <seqname> <feature> <one char per column>}. */
    GR("#=GR"),

    /** Per-column feature: {@code #=GC <feature> <one char per column>}. */
    GC("#=GC"),

    /** The {@code //} end of record line. */
    TERMINATOR(null),

    /** Blank lines and comments without a recognized markup prefix. */
    IGNORABLE(null);

    public static final String COMMENT_PREFIX = "#";

    public static final String TERMINATOR_PREFIX = "//";

    private static final StockholmLineType[] MARKUP_TYPES = {GF, GS, GR, GC};

    private final String marker;

    StockholmLineType(final String marker) {
        this.marker = marker;
    }

    /**
     * @return the line prefix identifying this markup kind, or {@code null} if this is not a markup kind.
     */
    public String getMarker() {
        return marker;
    }

    public boolean isMarkup() {
        return marker != null;
    }

    /**
     * Classifies a line by its prefix.
     *
     * @param line the line content without its terminator.
     * @return never {@code null}.
     * @throws IllegalArgumentException if {@code line} is {@code null}.
     */
    public static StockholmLineType classify(final String line) {
        Utils.nonNull(line, "the line cannot be null");
        if (StringUtils.isBlank(line)) {
            return IGNORABLE;
        }
        for (final StockholmLineType markupType : MARKUP_TYPES) {
            if (line.startsWith(markupType.marker)) {
                return markupType;
            }
        }
        if (line.startsWith(TERMINATOR_PREFIX)) {
            return TERMINATOR;
        } else if (line.startsWith(COMMENT_PREFIX)) {
            return IGNORABLE;
        } else {
            return DATA;
        }
    }
}
