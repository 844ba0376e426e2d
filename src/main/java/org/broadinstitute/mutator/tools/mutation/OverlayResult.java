package org.broadinstitute.mutator.tools.mutation;

import org.broadinstitute.mutator.utils.Utils;
import org.broadinstitute.mutator.utils.collections.GenomicIntervalMap;
import org.broadinstitute.mutator.utils.variant.SimpleVariant;

/**
 * The finished map of one overlay, with the base sample name it belongs to.
 */
public final class OverlayResult {
    private final String sampleName;
    private final GenomicIntervalMap<SimpleVariant> variants;
    private final OverlayStatistics statistics;

    public OverlayResult(final String sampleName, final GenomicIntervalMap<SimpleVariant> variants, final OverlayStatistics statistics) {
        this.sampleName = Utils.nonNull(sampleName, "sampleName");
        this.variants = Utils.nonNull(variants, "variants");
        this.statistics = Utils.nonNull(statistics, "statistics");
    }

    public String getSampleName() {
        return sampleName;
    }

    public GenomicIntervalMap<SimpleVariant> getVariants() {
        return variants;
    }

    public OverlayStatistics getStatistics() {
        return statistics;
    }
}
