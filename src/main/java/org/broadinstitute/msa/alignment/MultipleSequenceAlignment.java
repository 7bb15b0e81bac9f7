package org.broadinstitute.msa.alignment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.broadinstitute.msa.utils.Utils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of equal-length {@link AlignedSequence}s keyed by label, plus alignment-wide and per-column annotations.
 * <p>
 * Instances are immutable. The constructor enforces the shape of the alignment:
 * <ul>
 *     <li>all sequences have the same length (the column count),</li>
 *     <li>there is exactly one unique label per sequence,</li>
 *     <li>every per-column annotation has one character per column.</li>
 * </ul>
 * </p>
 */
public final class MultipleSequenceAlignment {

    private final ImmutableList<AlignedSequence> sequences;

    private final ImmutableList<String> index;

    private final Map<String, Integer> positionByLabel;

    private final ImmutableMap<String, String> metadata;

    private final ImmutableMap<String, ImmutableList<Character>> positionalMetadata;

    private final int columnCount;

    /**
     * @throws IllegalArgumentException if the sequences, index and positional metadata do not describe a
     * well formed alignment.
     */
    public MultipleSequenceAlignment(final List<AlignedSequence> sequences,
                                     final Map<String, String> metadata,
                                     final Map<String, List<Character>> positionalMetadata,
                                     final List<String> index) {
        Utils.containsNoNull(sequences, "the sequence list cannot be null nor contain nulls");
        Utils.containsNoNull(index, "the index cannot be null nor contain nulls");
        Utils.nonNull(metadata, "the metadata cannot be null, use an empty map instead");
        Utils.nonNull(positionalMetadata, "the positional metadata cannot be null, use an empty map instead");
        Utils.validateArg(sequences.size() == index.size(), () -> String.format(
                "there are %d sequences but the index has %d labels", sequences.size(), index.size()));

        columnCount = sequences.isEmpty() ? 0 : sequences.get(0).length();
        for (int i = 0; i < sequences.size(); i++) {
            final int length = sequences.get(i).length();
            final String label = index.get(i);
            Utils.validateArg(length == columnCount, () -> String.format(
                    "sequence '%s' has length %d but the alignment has %d columns", label, length, columnCount));
        }

        positionByLabel = new HashMap<>(index.size() * 2);
        for (int i = 0; i < index.size(); i++) {
            final String label = index.get(i);
            Utils.validateArg(positionByLabel.put(label, i) == null, () -> "duplicated label in index: " + label);
        }

        final ImmutableMap.Builder<String, ImmutableList<Character>> builder = ImmutableMap.builder();
        positionalMetadata.forEach((feature, values) -> {
            Utils.validateArg(values.size() == columnCount, () -> String.format(
                    "column metadata '%s' has %d values but the alignment has %d columns",
                    feature, values.size(), columnCount));
            builder.put(feature, ImmutableList.copyOf(values));
        });

        this.sequences = ImmutableList.copyOf(sequences);
        this.index = ImmutableList.copyOf(index);
        this.metadata = ImmutableMap.copyOf(metadata);
        this.positionalMetadata = builder.build();
    }

    /**
     * Returns the factory used to assemble alignments of {@link AlignedSequence}s. Absent positional metadata
     * becomes an empty map.
     */
    public static AlignmentFactory<AlignedSequence, MultipleSequenceAlignment> factory() {
        return (sequences, metadata, positionalMetadata, index) -> new MultipleSequenceAlignment(
                sequences, metadata, positionalMetadata.orElse(ImmutableMap.of()), index);
    }

    public List<AlignedSequence> getSequences() {
        return sequences;
    }

    public List<String> getIndex() {
        return index;
    }

    public int getSequenceCount() {
        return sequences.size();
    }

    public int getColumnCount() {
        return columnCount;
    }

    /**
     * @throws IllegalArgumentException if there is no sequence under {@code label}.
     */
    public AlignedSequence getSequence(final String label) {
        final Integer position = positionByLabel.get(Utils.nonNull(label, "the label cannot be null"));
        Utils.validateArg(position != null, () -> "no sequence with label " + label);
        return sequences.get(position);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * @return empty if the alignment has no per-column annotations.
     */
    public Optional<Map<String, ImmutableList<Character>>> getPositionalMetadata() {
        return positionalMetadata.isEmpty() ? Optional.empty() : Optional.of(positionalMetadata);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final MultipleSequenceAlignment that = (MultipleSequenceAlignment) o;
        return sequences.equals(that.sequences) &&
                index.equals(that.index) &&
                metadata.equals(that.metadata) &&
                positionalMetadata.equals(that.positionalMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequences, index, metadata, positionalMetadata);
    }

    @Override
    public String toString() {
        return String.format("MultipleSequenceAlignment{sequences=%d, columns=%d, metadata=%s, positionalMetadata=%s}",
                sequences.size(), columnCount, metadata.keySet(), positionalMetadata.keySet());
    }
}
