package org.broadinstitute.mutator.tools.mutation;

import org.broadinstitute.mutator.exceptions.MutatorException;

/**
 * Counts what happened to each donor record during one overlay.
 * Skipped records are never errors, so these counts are the only record of how often they occur.
 */
public final class OverlayStatistics {

    private long donorRecords = 0;
    private long referenceBlocksSkipped = 0;
    private long insertions = 0;
    private long replacements = 0;
    private long splits = 0;
    private long identical = 0;
    private long indelOverlapsSkipped = 0;
    private long unsupportedOverlapsSkipped = 0;

    void recordDonorRecord() { donorRecords++; }

    void recordReferenceBlockSkipped() { referenceBlocksSkipped++; }

    void recordInsertion() { insertions++; }

    void recordIndelOverlapSkipped() { indelOverlapsSkipped++; }

    void recordUnsupportedOverlapSkipped() { unsupportedOverlapsSkipped++; }

    void recordResolution(final OverlapResolution resolution) {
        switch (resolution) {
            case IDENTICAL:
                identical++;
                break;
            case REPLACE:
                replacements++;
                break;
            case SPLIT:
                splits++;
                break;
            case UNSUPPORTED:
                unsupportedOverlapsSkipped++;
                break;
            default:
                throw new MutatorException.ShouldNeverReachHereException("Unknown resolution " + resolution);
        }
    }

    public long getDonorRecords() {
        return donorRecords;
    }

    public long getReferenceBlocksSkipped() {
        return referenceBlocksSkipped;
    }

    public long getInsertions() {
        return insertions;
    }

    public long getReplacements() {
        return replacements;
    }

    public long getSplits() {
        return splits;
    }

    public long getIdentical() {
        return identical;
    }

    public long getIndelOverlapsSkipped() {
        return indelOverlapsSkipped;
    }

    public long getUnsupportedOverlapsSkipped() {
        return unsupportedOverlapsSkipped;
    }

    /**
     * @return number of donor records that changed the map
     */
    public long getAppliedCount() {
        return insertions + replacements + splits;
    }

    /**
     * @return number of donor records that overlapped a stored call but were dropped
     */
    public long getSkippedOverlapCount() {
        return indelOverlapsSkipped + unsupportedOverlapsSkipped;
    }

    public String getSummaryLine() {
        if (0 == donorRecords) {
            return "No donor records read";
        }
        return String.format("%d donor record(s) read: %d inserted, %d replaced, %d split, %d identical, "
                        + "%d reference block(s) skipped, %d indel overlap(s) skipped, %d unsupported overlap(s) skipped",
                donorRecords, insertions, replacements, splits, identical,
                referenceBlocksSkipped, indelOverlapsSkipped, unsupportedOverlapsSkipped);
    }

    @Override
    public String toString() {
        return getSummaryLine();
    }
}
