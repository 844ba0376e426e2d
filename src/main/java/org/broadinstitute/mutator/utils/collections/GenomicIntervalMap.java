package org.broadinstitute.mutator.utils.collections;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import htsjdk.samtools.util.Locatable;
import org.broadinstitute.mutator.utils.GenomicPosition;
import org.broadinstitute.mutator.utils.SimpleInterval;
import org.broadinstitute.mutator.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mutable map from disjoint closed genomic ranges to values.
 *
 * Ranges are held per contig, keyed by their start, with contigs ordered by {@link GenomicPosition#CONTIG_ORDER}.
 * At all times the stored ranges of one contig are pairwise disjoint: {@link #put} rejects a range that overlaps
 * a stored range unless it is exactly that range, so callers replacing part of a range must {@link #remove} it first.
 *
 * Not thread-safe; meant to be owned by a single caller for the lifetime of one operation.
 *
 * @param <V> type of the value bound to each range
 */
public final class GenomicIntervalMap<V> {

    private final SortedMap<String, NavigableMap<Integer, Map.Entry<SimpleInterval, V>>> contigs =
            new TreeMap<>(GenomicPosition.CONTIG_ORDER);

    private int size = 0;

    /**
     * Binds {@code value} to {@code range}, replacing the value already bound to exactly that range.
     *
     * @throws IllegalArgumentException if {@code range} overlaps a stored range other than itself
     */
    public void put(final SimpleInterval range, final V value) {
        Utils.nonNull(range, "range");
        Utils.nonNull(value, "value");

        final List<Map.Entry<SimpleInterval, V>> overlapping = getOverlapping(range);
        Utils.validateArg(overlapping.isEmpty() || (overlapping.size() == 1 && overlapping.get(0).getKey().equals(range)),
                () -> "Range " + range + " overlaps stored ranges " + Iterables.toString(Iterables.transform(overlapping, Map.Entry::getKey)));

        final Map.Entry<SimpleInterval, V> previous = contigs.computeIfAbsent(range.getContig(), k -> new TreeMap<>())
                .put(range.getStart(), Maps.immutableEntry(range, value));
        if (previous == null) {
            size++;
        }
    }

    /**
     * Removes the entry stored for exactly {@code range}. Does nothing if there is no such entry.
     */
    public void remove(final SimpleInterval range) {
        Utils.nonNull(range, "range");
        final NavigableMap<Integer, Map.Entry<SimpleInterval, V>> contigRanges = contigs.get(range.getContig());
        if (contigRanges == null) {
            return;
        }
        final Map.Entry<SimpleInterval, V> stored = contigRanges.get(range.getStart());
        if (stored != null && stored.getKey().equals(range)) {
            contigRanges.remove(range.getStart());
            size--;
            if (contigRanges.isEmpty()) {
                contigs.remove(range.getContig());
            }
        }
    }

    /**
     * @return the value whose range contains {@code position}, or {@code null} if no stored range does
     */
    public V get(final GenomicPosition position) {
        final Map.Entry<SimpleInterval, V> entry = getEntry(position);
        return entry == null ? null : entry.getValue();
    }

    /**
     * @return the stored (range, value) pair whose range contains {@code position}, or {@code null}
     */
    public Map.Entry<SimpleInterval, V> getEntry(final GenomicPosition position) {
        Utils.nonNull(position, "position");
        final NavigableMap<Integer, Map.Entry<SimpleInterval, V>> contigRanges = contigs.get(position.getContig());
        if (contigRanges == null) {
            return null;
        }
        final Map.Entry<Integer, Map.Entry<SimpleInterval, V>> candidate = contigRanges.floorEntry(position.getPosition());
        if (candidate == null || !candidate.getValue().getKey().contains(position)) {
            return null;
        }
        return candidate.getValue();
    }

    /**
     * @return the stored entries whose ranges overlap {@code query}, in start order. May be modified by the caller.
     */
    public List<Map.Entry<SimpleInterval, V>> getOverlapping(final Locatable query) {
        Utils.nonNull(query, "query");
        final List<Map.Entry<SimpleInterval, V>> result = new ArrayList<>();
        final NavigableMap<Integer, Map.Entry<SimpleInterval, V>> contigRanges = contigs.get(query.getContig());
        if (contigRanges == null) {
            return result;
        }
        // the range starting at or before the query start is the only earlier one that can reach into it
        final Integer from = contigRanges.floorKey(query.getStart());
        final NavigableMap<Integer, Map.Entry<SimpleInterval, V>> candidates = from == null
                ? contigRanges.headMap(query.getEnd(), true)
                : contigRanges.subMap(from, true, query.getEnd(), true);
        for (final Map.Entry<SimpleInterval, V> entry : candidates.values()) {
            if (entry.getKey().overlaps(query)) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Lazy view of all (range, value) pairs, ordered by contig and then start.
     * Each call to {@code iterator()} starts a new traversal; the map must not be modified while one is in progress.
     */
    public Iterable<Map.Entry<SimpleInterval, V>> entries() {
        return Iterables.unmodifiableIterable(
                Iterables.<Map.Entry<SimpleInterval, V>>concat(Iterables.transform(contigs.values(), NavigableMap::values)));
    }

    /**
     * @return the contigs with at least one stored range, in iteration order
     */
    @VisibleForTesting
    List<String> contigs() {
        return Collections.unmodifiableList(new ArrayList<>(contigs.keySet()));
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
