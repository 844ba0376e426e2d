package org.broadinstitute.mutator.tools.mutation;

/**
 * Outcome of folding one donor call into the stored call it overlaps.
 */
public enum OverlapResolution {
    /** Both calls carry the same interval and alleles; the map is left as is. */
    IDENTICAL,
    /** The stored single-base call is removed and the donor call inserted in its place. */
    REPLACE,
    /** The stored reference block is cut around the donor call. */
    SPLIT,
    /** No rule covers this pair; the donor call is dropped and counted. */
    UNSUPPORTED
}
