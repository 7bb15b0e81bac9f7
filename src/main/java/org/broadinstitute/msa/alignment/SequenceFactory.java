package org.broadinstitute.msa.alignment;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a sequence value out of the raw aligned characters and the annotations attached to it.
 * <p>
 * Implementations are responsible for validating the characters themselves and should throw
 * {@link IllegalArgumentException} on invalid content.
 * </p>
 *
 * @param <S> the sequence type produced.
 */
@FunctionalInterface
public interface SequenceFactory<S> {

    /**
     * @param characters the aligned characters, gaps included.
     * @param metadata per-sequence features, empty if the sequence carries none.
     * @param positionalMetadata per-column features for this sequence, one character per column, empty if none.
     * @return never {@code null}.
     */
    S create(String characters,
             Optional<Map<String, String>> metadata,
             Optional<Map<String, List<Character>>> positionalMetadata);
}
