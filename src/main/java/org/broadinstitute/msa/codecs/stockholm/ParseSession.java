package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Intermediate state of a single Stockholm read.
 * <p>
 * Owns the sequence records keyed by label in order of first appearance among data lines, the alignment-wide
 * {@code #=GF} features and the per-column {@code #=GC} features. A fresh session is created for every read and
 * is never shared.
 * </p>
 */
final class ParseSession {

    private final String sourceName;

    private final GsAnnotationPolicy gsPolicy;

    private final Map<String, SequenceRecord> records = new LinkedHashMap<>();

    private final Map<String, String> metadata = new LinkedHashMap<>();

    private final Map<String, List<Character>> columnMetadata = new LinkedHashMap<>();

    private int droppedGsLineCount = 0;

    ParseSession(final String sourceName, final GsAnnotationPolicy gsPolicy) {
        this.sourceName = sourceName;
        this.gsPolicy = Utils.nonNull(gsPolicy, "the GS policy cannot be null");
    }

    String getSourceName() {
        return sourceName;
    }

    GsAnnotationPolicy getGsPolicy() {
        return gsPolicy;
    }

    boolean containsRecord(final String label) {
        return records.containsKey(label);
    }

    /**
     * @return {@code null} if there is no record under that label.
     */
    SequenceRecord getRecord(final String label) {
        return records.get(label);
    }

    void addRecord(final SequenceRecord record) {
        Utils.validate(!records.containsKey(record.getLabel()), () -> "record already present: " + record.getLabel());
        records.put(record.getLabel(), record);
    }

    /**
     * @return records in order of first appearance.
     */
    Collection<SequenceRecord> getRecords() {
        return Collections.unmodifiableCollection(records.values());
    }

    /**
     * @return labels in order of first appearance.
     */
    List<String> getLabels() {
        return new ArrayList<>(records.keySet());
    }

    int getRecordCount() {
        return records.size();
    }

    /**
     * Sets an alignment-wide feature, joining with a single space onto any value already present.
     */
    void appendMetadata(final String feature, final String value) {
        metadata.merge(feature, value, (previous, next) -> previous + " " + next);
    }

    Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    boolean hasColumnFeature(final String feature) {
        return columnMetadata.containsKey(feature);
    }

    void putColumnFeature(final String feature, final List<Character> values) {
        Utils.validate(!columnMetadata.containsKey(feature), () -> "column feature already present: " + feature);
        columnMetadata.put(feature, values);
    }

    Map<String, List<Character>> getColumnMetadata() {
        return Collections.unmodifiableMap(columnMetadata);
    }

    void recordDroppedGsLine() {
        droppedGsLineCount++;
    }

    int getDroppedGsLineCount() {
        return droppedGsLineCount;
    }
}
