package org.broadinstitute.msa.codecs.stockholm;

import org.broadinstitute.msa.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything collected for one sequence label while reading: its aligned characters (from its data line) and
 * the annotations later attached by {@code #=GS} and {@code #=GR} lines.
 * <p>
 * The characters never change after construction; the annotation maps are filled in by the markup pass and keep
 * insertion order.
 * </p>
 */
final class SequenceRecord {

    private final String label;

    private final String characters;

    private final Map<String, String> metadata = new LinkedHashMap<>();

    private final Map<String, List<Character>> positionalMetadata = new LinkedHashMap<>();

    SequenceRecord(final String label, final String characters) {
        this.label = Utils.nonEmpty(label, "the sequence label");
        this.characters = Utils.nonNull(characters, "the sequence characters cannot be null");
    }

    String getLabel() {
        return label;
    }

    String getCharacters() {
        return characters;
    }

    /**
     * @return read-only view.
     */
    Map<String, String> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * @return read-only view.
     */
    Map<String, List<Character>> getPositionalMetadata() {
        return Collections.unmodifiableMap(positionalMetadata);
    }

    boolean hasMetadata() {
        return !metadata.isEmpty();
    }

    boolean hasPositionalFeature(final String feature) {
        return positionalMetadata.containsKey(feature);
    }

    /**
     * Sets {@code feature}, joining with a single space onto any value already recorded for it.
     */
    void appendMetadata(final String feature, final String value) {
        metadata.merge(feature, value, (previous, next) -> previous + " " + next);
    }

    void putPositionalFeature(final String feature, final List<Character> values) {
        Utils.validate(!positionalMetadata.containsKey(feature),
                () -> String.format("positional feature %s of %s already set", feature, label));
        positionalMetadata.put(feature, values);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s %s", label, characters, metadata, positionalMetadata.keySet());
    }
}
