package org.broadinstitute.msa.alignment;

import java.util.BitSet;

/**
 * Character sets accepted when building an {@link AlignedSequence}.
 * <p>
 * Letters are upper case only. The gap characters {@code '-'} and {@code '.'} are legal in every alphabet.
 * </p>
 */
public enum SequenceAlphabet {

    /** Nucleotides plus IUPAC degenerate codes. */
    DNA("ACGTRYSWKMBDHVN"),

    /** Ribonucleotides plus IUPAC degenerate codes. */
    RNA("ACGURYSWKMBDHVN"),

    /** The standard and non-canonical amino acids, degenerate codes and the stop symbol. */
    PROTEIN("ACDEFGHIKLMNOPQRSTUVWYBZJX*"),

    /** Accepts any character. */
    ANY(null);

    public static final String GAP_CHARACTERS = "-.";

    private final BitSet allowed;

    SequenceAlphabet(final String symbols) {
        if (symbols == null) {
            allowed = null;
        } else {
            allowed = new BitSet(128);
            (symbols + GAP_CHARACTERS).chars().forEach(allowed::set);
        }
    }

    public boolean isValid(final char c) {
        return allowed == null || allowed.get(c);
    }

    /**
     * @return the index of the first character not in this alphabet, or -1 if all are valid.
     */
    public int firstInvalidIndex(final CharSequence characters) {
        if (allowed == null) {
            return -1;
        }
        for (int i = 0; i < characters.length(); i++) {
            if (!isValid(characters.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
