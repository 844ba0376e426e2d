package org.broadinstitute.mutator.utils;

import com.google.common.primitives.Ints;
import org.apache.commons.lang3.StringUtils;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Immutable 1-based position on a named contig.
 *
 * Positions on the same contig are ordered by offset. Positions on different contigs are ordered by
 * {@link #CONTIG_ORDER}: a leading "chr" (any case) and surrounding whitespace are stripped from both names, and
 * names that then parse as integers are compared numerically. Numeric contigs come before non-numeric ones, and
 * non-numeric contigs compare lexicographically, so that the ordering stays a total order suitable for sorted maps.
 */
public final class GenomicPosition implements Comparable<GenomicPosition>, Serializable {
    private static final long serialVersionUID = 1L;

    private static final String CONTIG_PREFIX = "chr";

    /**
     * Ordering of contig names used for map iteration order, e.g. chr2 < chr10 < chrX.
     * Two names only compare equal when they are identical.
     */
    public static final Comparator<String> CONTIG_ORDER = GenomicPosition::compareContigs;

    private final String contig;
    private final int position;

    /**
     * @param contig name of the contig, must not be null
     * @param position 1-based offset on the contig
     */
    public GenomicPosition(final String contig, final int position) {
        Utils.nonNull(contig, "contig");
        Utils.validateArg(position > 0, () -> "Invalid position " + position + " on contig " + contig);
        this.contig = contig;
        this.position = position;
    }

    public String getContig() {
        return contig;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public int compareTo(final GenomicPosition other) {
        if (contig.equals(other.contig)) {
            return Integer.compare(position, other.position);
        }
        return compareContigs(contig, other.contig);
    }

    static int compareContigs(final String first, final String second) {
        if (first.equals(second)) {
            return 0;
        }
        final Integer firstNumber = Ints.tryParse(stripContigPrefix(first));
        final Integer secondNumber = Ints.tryParse(stripContigPrefix(second));

        if (firstNumber != null && secondNumber != null) {
            final int result = Integer.compare(firstNumber, secondNumber);
            // "chr1" and "1" are different contigs
            return result != 0 ? result : first.compareTo(second);
        }
        if (firstNumber != null) {
            return -1;
        }
        if (secondNumber != null) {
            return 1;
        }
        return first.compareTo(second);
    }

    private static String stripContigPrefix(final String contig) {
        return StringUtils.removeStartIgnoreCase(contig.trim(), CONTIG_PREFIX).trim();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final GenomicPosition that = (GenomicPosition) o;
        return position == that.position && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        return 31 * contig.hashCode() + position;
    }

    @Override
    public String toString() {
        return contig + ":" + position;
    }
}
