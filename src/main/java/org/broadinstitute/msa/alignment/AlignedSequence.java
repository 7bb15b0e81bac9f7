package org.broadinstitute.msa.alignment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.broadinstitute.msa.utils.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of a multiple sequence alignment: the aligned characters plus per-sequence and per-column annotations.
 * <p>
 * Instances are immutable. Every positional annotation has exactly one character per aligned position.
 * </p>
 */
public final class AlignedSequence {

    private final String characters;

    private final ImmutableMap<String, String> metadata;

    private final ImmutableMap<String, ImmutableList<Character>> positionalMetadata;

    /**
     * Creates a sequence that accepts any character.
     */
    public AlignedSequence(final String characters,
                           final Map<String, String> metadata,
                           final Map<String, List<Character>> positionalMetadata) {
        this(characters, metadata, positionalMetadata, SequenceAlphabet.ANY);
    }

    /**
     * @throws IllegalArgumentException if a character is not in {@code alphabet} or a positional annotation does not
     * have one character per aligned position.
     */
    public AlignedSequence(final String characters,
                           final Map<String, String> metadata,
                           final Map<String, List<Character>> positionalMetadata,
                           final SequenceAlphabet alphabet) {
        Utils.nonNull(characters, "the sequence characters cannot be null");
        Utils.nonNull(metadata, "the metadata cannot be null, use an empty map instead");
        Utils.nonNull(positionalMetadata, "the positional metadata cannot be null, use an empty map instead");
        Utils.nonNull(alphabet, "the alphabet cannot be null");

        final int invalid = alphabet.firstInvalidIndex(characters);
        Utils.validateArg(invalid < 0, () -> String.format("invalid character '%c' at position %d for alphabet %s",
                characters.charAt(invalid), invalid + 1, alphabet));

        final ImmutableMap.Builder<String, ImmutableList<Character>> builder = ImmutableMap.builder();
        positionalMetadata.forEach((feature, values) -> {
            Utils.validateArg(values.size() == characters.length(), () -> String.format(
                    "positional metadata '%s' has %d values but the sequence has %d positions",
                    feature, values.size(), characters.length()));
            builder.put(feature, ImmutableList.copyOf(values));
        });

        this.characters = characters;
        this.metadata = ImmutableMap.copyOf(metadata);
        this.positionalMetadata = builder.build();
    }

    /**
     * Returns a factory that validates characters against {@code alphabet}.
     */
    public static SequenceFactory<AlignedSequence> factory(final SequenceAlphabet alphabet) {
        Utils.nonNull(alphabet, "the alphabet cannot be null");
        return (characters, metadata, positionalMetadata) -> new AlignedSequence(
                characters,
                metadata.orElse(ImmutableMap.of()),
                positionalMetadata.orElse(ImmutableMap.of()),
                alphabet);
    }

    public String getCharacters() {
        return characters;
    }

    public int length() {
        return characters.length();
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Map<String, ImmutableList<Character>> getPositionalMetadata() {
        return positionalMetadata;
    }

    public Optional<String> getMetadata(final String feature) {
        return Optional.ofNullable(metadata.get(feature));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AlignedSequence that = (AlignedSequence) o;
        return characters.equals(that.characters) &&
                metadata.equals(that.metadata) &&
                positionalMetadata.equals(that.positionalMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(characters, metadata, positionalMetadata);
    }

    @Override
    public String toString() {
        return characters;
    }
}
