package org.broadinstitute.mutator.utils;

import htsjdk.samtools.util.Locatable;

import java.io.Serializable;

/**
 * Immutable 1-based closed range [start, end] on one contig. Used as the key of the stored calls.
 * Empty ranges are not allowed.
 */
public final class SimpleInterval implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;

    private final String contig;
    private final int start;
    private final int end;

    /**
     * @param contig contig name, must not be null
     * @param start 1-based inclusive start
     * @param end 1-based inclusive end, not before {@code start}
     * @throws IllegalArgumentException if the range is empty, starts before 1 or has no contig
     */
    public SimpleInterval(final String contig, final int start, final int end) {
        Utils.validateArg(contig != null && start > 0 && end >= start,
                () -> "Invalid interval. Contig:" + contig + " start:" + start + " end:" + end);
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * Copies the extent of any {@link Locatable}, such as a {@code VariantContext}.
     * @throws IllegalArgumentException if {@code locatable} is null or spans an invalid range
     */
    public SimpleInterval(final Locatable locatable) {
        this(Utils.nonNull(locatable, "locatable").getContig(), locatable.getStart(), locatable.getEnd());
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public GenomicPosition getStartPosition() {
        return new GenomicPosition(contig, start);
    }

    public GenomicPosition getEndPosition() {
        return new GenomicPosition(contig, end);
    }

    /**
     * @return true if {@code other} shares at least one base with this range
     */
    public boolean overlaps(final Locatable other) {
        return other != null && contig.equals(other.getContig())
                && start <= other.getEnd() && other.getStart() <= end;
    }

    /**
     * @return true if every base of {@code other} lies inside this range
     */
    public boolean contains(final Locatable other) {
        return other != null && contig.equals(other.getContig())
                && start <= other.getStart() && other.getEnd() <= end;
    }

    public boolean contains(final GenomicPosition position) {
        return position != null && contig.equals(position.getContig())
                && start <= position.getPosition() && position.getPosition() <= end;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SimpleInterval that = (SimpleInterval) o;
        return start == that.start && end == that.end && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * contig.hashCode() + start) + end;
    }

    @Override
    public String toString() {
        return contig + ":" + start + "-" + end;
    }
}
