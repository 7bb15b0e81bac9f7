package org.broadinstitute.msa.codecs.stockholm;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Chars;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.msa.exceptions.MSAException;
import org.broadinstitute.msa.exceptions.StockholmFormatException;
import org.broadinstitute.msa.utils.Utils;
import org.broadinstitute.msa.utils.logging.OneShotLogger;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies single Stockholm lines to a {@link ParseSession}.
 * <p>
 * Field splitting differs per line kind:
 * <ul>
 *     <li>{@code #=GF} and {@code #=GS} lines are split on runs of whitespace into a fixed number of fields; the
 *     last field is free text starting at its first non-whitespace character and is otherwise kept verbatim.</li>
 *     <li>{@code #=GR}, {@code #=GC} and data lines are split on runs of whitespace; fields beyond the ones
 *     used are ignored.</li>
 * </ul>
 * </p>
 */
final class StockholmLineParser {

    private static final Logger logger = LogManager.getLogger(StockholmLineParser.class);

    static final int GF_FIELD_COUNT = 3;
    static final int GS_FIELD_COUNT = 4;

    private static final Pattern GF_PATTERN = freeTextPattern(GF_FIELD_COUNT);
    private static final Pattern GS_PATTERN = freeTextPattern(GS_FIELD_COUNT);
    static final int GR_FIELD_COUNT = 4;
    static final int GC_FIELD_COUNT = 3;
    static final int DATA_FIELD_COUNT = 2;

    private final ParseSession session;

    private final OneShotLogger droppedGsWarning = new OneShotLogger(logger);

    StockholmLineParser(final ParseSession session) {
        this.session = Utils.nonNull(session, "the session cannot be null");
    }

    /**
     * Creates the record for a data line.
     *
     * @throws StockholmFormatException.DuplicateSequenceLabel if the label was already seen on a data line.
     * @throws StockholmFormatException.MalformedDataLine if there is no sequence after the label.
     */
    void parseDataLine(final StockholmLine line) {
        checkType(line, StockholmLineType.DATA);
        final String[] fields = StringUtils.split(line.getText());
        if (fields.length < DATA_FIELD_COUNT) {
            throw new StockholmFormatException.MalformedDataLine(line);
        }
        final String label = fields[0];
        if (session.containsRecord(label)) {
            throw new StockholmFormatException.DuplicateSequenceLabel(line, label);
        }
        session.addRecord(new SequenceRecord(label, fields[1]));
    }

    /**
     * Dispatches a markup line to the handler for its kind. Lines that are not markup are ignored.
     */
    void parseMarkupLine(final StockholmLine line) {
        switch (line.getType()) {
            case GF: parseGF(line); break;
            case GS: parseGS(line); break;
            case GR: parseGR(line); break;
            case GC: parseGC(line); break;
            case DATA:
            case TERMINATOR:
            case IGNORABLE:
                break;
            default:
                throw new MSAException.ShouldNeverReachHereException("unexpected line type " + line.getType());
        }
    }

    /**
     * {@code #=GF <feature> <free text>}: a repeated feature gets the new text appended after a single space.
     */
    void parseGF(final StockholmLine line) {
        checkType(line, StockholmLineType.GF);
        final String[] fields = splitFreeTextLine(line, GF_PATTERN, GF_FIELD_COUNT);
        session.appendMetadata(fields[1], fields[2]);
    }

    /**
     * {@code #=GS <seqname> <feature> <free text>}: merged into the sequence metadata as the session's
     * {@link GsAnnotationPolicy} dictates.
     */
    void parseGS(final StockholmLine line) {
        checkType(line, StockholmLineType.GS);
        final String[] fields = splitFreeTextLine(line, GS_PATTERN, GS_FIELD_COUNT);
        final SequenceRecord record = lookUpRecord(line, fields[1]);
        final String feature = fields[2];
        switch (session.getGsPolicy()) {
            case FIRST_LINE_ONLY:
                if (record.hasMetadata()) {
                    session.recordDroppedGsLine();
                    logger.debug("Dropping #=GS feature {} for {} at line {}: sequence already has metadata",
                            feature, record.getLabel(), line.getLineNumber());
                    droppedGsWarning.warn("Only the first #=GS line of each sequence is kept (first dropped at line {}); " +
                            "use the {} policy to keep them all", line.getLineNumber(), GsAnnotationPolicy.ACCUMULATE);
                } else {
                    record.appendMetadata(feature, fields[3]);
                }
                break;
            case ACCUMULATE:
                record.appendMetadata(feature, fields[3]);
                break;
            default:
                throw new MSAException.ShouldNeverReachHereException("unexpected GS policy " + session.getGsPolicy());
        }
    }

    /**
     * {@code #=GR <seqname> <feature> <column chars>}.
     *
     * @throws StockholmFormatException.DuplicateSequenceColumnFeature if the sequence already has that feature.
     */
    void parseGR(final StockholmLine line) {
        checkType(line, StockholmLineType.GR);
        final String[] fields = splitColumnLine(line, GR_FIELD_COUNT);
        final SequenceRecord record = lookUpRecord(line, fields[1]);
        final String feature = fields[2];
        if (record.hasPositionalFeature(feature)) {
            throw new StockholmFormatException.DuplicateSequenceColumnFeature(line, feature, record.getLabel());
        }
        record.putPositionalFeature(feature, toCharacterList(fields[3]));
    }

    /**
     * {@code #=GC <feature> <column chars>}.
     *
     * @throws StockholmFormatException.DuplicateColumnFeature if the feature was already seen in the input.
     */
    void parseGC(final StockholmLine line) {
        checkType(line, StockholmLineType.GC);
        final String[] fields = splitColumnLine(line, GC_FIELD_COUNT);
        final String feature = fields[1];
        if (session.hasColumnFeature(feature)) {
            throw new StockholmFormatException.DuplicateColumnFeature(line, feature);
        }
        session.putColumnFeature(feature, toCharacterList(fields[2]));
    }

    private SequenceRecord lookUpRecord(final StockholmLine line, final String label) {
        final SequenceRecord record = session.getRecord(label);
        if (record == null) {
            throw new StockholmFormatException.UndeclaredSequenceReference(line, label);
        }
        return record;
    }

    /**
     * Matches {@code fieldCount - 1} whitespace-delimited fields followed by a free text field that must contain
     * something other than whitespace.
     */
    private static Pattern freeTextPattern(final int fieldCount) {
        final StringBuilder regex = new StringBuilder();
        for (int i = 1; i < fieldCount; i++) {
            regex.append("(\\S+)\\s+");
        }
        return Pattern.compile(regex.append("(\\S.*)").toString(), Pattern.DOTALL);
    }

    /**
     * Cuts the line into exactly {@code fieldCount} fields; the last one holds the rest of the line.
     */
    private static String[] splitFreeTextLine(final StockholmLine line, final Pattern pattern, final int fieldCount) {
        final Matcher matcher = pattern.matcher(line.getText());
        if (!matcher.matches()) {
            throw new StockholmFormatException.MalformedMarkupLine(line, fieldCount);
        }
        final String[] fields = new String[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            fields[i] = matcher.group(i + 1);
        }
        return fields;
    }

    private static String[] splitColumnLine(final StockholmLine line, final int fieldCount) {
        final String[] fields = StringUtils.split(line.getText());
        if (fields.length < fieldCount) {
            throw new StockholmFormatException.MalformedMarkupLine(line, fieldCount);
        }
        return fields;
    }

    private static List<Character> toCharacterList(final String columnCharacters) {
        return ImmutableList.copyOf(Chars.asList(columnCharacters.toCharArray()));
    }

    private static void checkType(final StockholmLine line, final StockholmLineType expected) {
        Utils.nonNull(line, "the line cannot be null");
        Utils.validateArg(line.getType() == expected,
                () -> String.format("expected a %s line but got %s", expected, line));
    }
}
