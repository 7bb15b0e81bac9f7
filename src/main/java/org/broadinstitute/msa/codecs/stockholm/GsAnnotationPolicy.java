package org.broadinstitute.msa.codecs.stockholm;

/**
 * How {@code #=GS} lines are merged into a sequence's metadata.
 */
public enum GsAnnotationPolicy {

    /**
     * A {@code #=GS} line is recorded only while the sequence has no metadata yet; any later {@code #=GS} line
     * for the same sequence is dropped, whatever its feature.
     */
    FIRST_LINE_ONLY,

    /**
     * Every {@code #=GS} line is recorded. A repeated feature has its values joined with a single space, in line
     * order, as {@code #=GF} features are.
     */
    ACCUMULATE
}
