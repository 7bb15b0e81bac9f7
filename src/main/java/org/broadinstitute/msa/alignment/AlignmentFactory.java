package org.broadinstitute.msa.alignment;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the final alignment out of already constructed sequences.
 * <p>
 * Shape checks (equal sequence lengths, column annotation lengths) belong here; implementations should throw
 * {@link IllegalArgumentException} when they fail.
 * </p>
 *
 * @param <S> the sequence type.
 * @param <A> the alignment type produced.
 */
@FunctionalInterface
public interface AlignmentFactory<S, A> {

    /**
     * @param sequences sequences in alignment order.
     * @param metadata alignment-wide features, possibly empty.
     * @param positionalMetadata per-column features, empty if the input had none.
     * @param index sequence labels, in the same order as {@code sequences}.
     * @return never {@code null}.
     */
    A create(List<S> sequences,
             Map<String, String> metadata,
             Optional<Map<String, List<Character>>> positionalMetadata,
             List<String> index);
}
