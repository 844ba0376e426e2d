package org.broadinstitute.mutator.tools.mutation;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.tribble.TribbleException;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import htsjdk.variant.vcf.VCFHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.mutator.exceptions.MutatorException;
import org.broadinstitute.mutator.exceptions.UserException;
import org.broadinstitute.mutator.utils.SimpleInterval;
import org.broadinstitute.mutator.utils.Utils;
import org.broadinstitute.mutator.utils.collections.GenomicIntervalMap;
import org.broadinstitute.mutator.utils.variant.SimpleVariant;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Overlays the calls of a donor GVCF onto the calls of a founder GVCF.
 *
 * The founder calls are read into a {@link GenomicIntervalMap} first. Donor calls are then folded into that map one
 * at a time, in file order, so a donor call may land in a remainder left by an earlier split. Each donor call is
 * handled by the first matching rule:
 * <ul>
 *     <li>reference blocks (and calls without any alternate allele) are dropped</li>
 *     <li>a call over uncovered space is inserted as is</li>
 *     <li>an indel overlapping a stored indel is dropped</li>
 *     <li>otherwise the stored call is kept, replaced, or split as decided by {@link #resolveOverlap}</li>
 * </ul>
 * Dropped calls are logged at debug level and counted in the returned {@link OverlayStatistics}; they never fail the run.
 *
 * Instances hold no state between calls.
 */
public final class VariantOverlayEngine {
    private static final Logger logger = LogManager.getLogger(VariantOverlayEngine.class);

    /**
     * Reads both GVCFs and overlays the donor calls onto the founder calls. Neither file needs an index.
     *
     * @param founderGvcf single-sample GVCF covering the genome without overlaps
     * @param donorGvcf GVCF whose calls are overlaid, in file order
     */
    public OverlayResult overlay(final Path founderGvcf, final Path donorGvcf) {
        Utils.nonNull(founderGvcf, "founderGvcf");
        Utils.nonNull(donorGvcf, "donorGvcf");
        assertReadable(founderGvcf);
        assertReadable(donorGvcf);

        final String sampleName;
        final GenomicIntervalMap<SimpleVariant> variants;
        try (final VCFFileReader founderReader = new VCFFileReader(founderGvcf, false)) {
            sampleName = getSingleSampleName(founderReader.getFileHeader(), founderGvcf.toString());
            variants = buildFounderVariantMap(founderReader.iterator());
        } catch (final TribbleException e) {
            throw new UserException.MalformedFile(founderGvcf, e.getMessage(), e);
        }
        logger.info("Read {} founder record(s) for sample {} from {}", variants.size(), sampleName, founderGvcf);

        final OverlayStatistics statistics = new OverlayStatistics();
        try (final VCFFileReader donorReader = new VCFFileReader(donorGvcf, false)) {
            addDonorVariants(variants, donorReader.iterator(), statistics);
        } catch (final TribbleException e) {
            throw new UserException.MalformedFile(donorGvcf, e.getMessage(), e);
        }
        logger.info(statistics.getSummaryLine());
        return new OverlayResult(sampleName, variants, statistics);
    }

    /**
     * Overlays already opened record streams.
     *
     * @param founderHeader header of the founder stream, must declare exactly one sample
     */
    public OverlayResult overlay(final VCFHeader founderHeader,
                                 final Iterator<VariantContext> founderVariants,
                                 final Iterator<VariantContext> donorVariants) {
        Utils.nonNull(founderHeader, "founderHeader");
        Utils.nonNull(founderVariants, "founderVariants");
        Utils.nonNull(donorVariants, "donorVariants");

        final String sampleName = getSingleSampleName(founderHeader, "founder");
        final GenomicIntervalMap<SimpleVariant> variants = buildFounderVariantMap(founderVariants);
        final OverlayStatistics statistics = new OverlayStatistics();
        addDonorVariants(variants, donorVariants, statistics);
        logger.info(statistics.getSummaryLine());
        return new OverlayResult(sampleName, variants, statistics);
    }

    private static void assertReadable(final Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "file does not exist or is not readable");
        }
    }

    /**
     * @return the only sample declared by {@code header}
     * @throws UserException.BadInput if the header declares no sample or more than one
     */
    @VisibleForTesting
    static String getSingleSampleName(final VCFHeader header, final String source) {
        final List<String> samples = header.getGenotypeSamples();
        if (samples.isEmpty()) {
            throw new UserException.BadInput(source + " declares no sample; a single-sample GVCF is required");
        }
        if (samples.size() > 1) {
            throw new UserException.BadInput(source + " declares " + samples.size() + " samples " + samples
                    + "; a single-sample GVCF is required");
        }
        return samples.get(0);
    }

    /**
     * Inserts every founder record under its own interval. The founder calls must not overlap each other.
     */
    @VisibleForTesting
    static GenomicIntervalMap<SimpleVariant> buildFounderVariantMap(final Iterator<VariantContext> founderVariants) {
        final GenomicIntervalMap<SimpleVariant> variants = new GenomicIntervalMap<>();
        while (founderVariants.hasNext()) {
            final SimpleVariant variant = SimpleVariant.fromBaseVariantContext(founderVariants.next());
            try {
                variants.put(variant.getInterval(), variant);
            } catch (final IllegalArgumentException e) {
                throw new UserException.BadInput("Founder records must not overlap: " + e.getMessage(), e);
            }
        }
        return variants;
    }

    @VisibleForTesting
    static void addDonorVariants(final GenomicIntervalMap<SimpleVariant> variants,
                                 final Iterator<VariantContext> donorVariants,
                                 final OverlayStatistics statistics) {
        while (donorVariants.hasNext()) {
            addDonorVariant(variants, donorVariants.next(), statistics);
        }
    }

    private static void addDonorVariant(final GenomicIntervalMap<SimpleVariant> variants,
                                        final VariantContext donorVariant,
                                        final OverlayStatistics statistics) {
        statistics.recordDonorRecord();
        final SimpleVariant incoming = SimpleVariant.fromDonorVariantContext(donorVariant);
        if (incoming == null || incoming.isReferenceBlock()) {
            statistics.recordReferenceBlockSkipped();
            return;
        }

        final Map.Entry<SimpleInterval, SimpleVariant> overlapping = variants.getEntry(incoming.getStartPosition());
        if (overlapping == null) {
            if (variants.getOverlapping(incoming).isEmpty()) {
                variants.put(incoming.getInterval(), incoming);
                statistics.recordInsertion();
            } else {
                logger.debug("Skipping donor call {}: starts in uncovered space but runs into stored calls", incoming);
                statistics.recordUnsupportedOverlapSkipped();
            }
            return;
        }

        final SimpleVariant existing = overlapping.getValue();
        if (existing.isIndel() && incoming.isIndel()) {
            logger.debug("Skipping donor indel {} overlapping stored indel {}", incoming, existing);
            statistics.recordIndelOverlapSkipped();
            return;
        }

        final OverlapResolution resolution = updateOverlappingVariant(variants, overlapping.getKey(), incoming);
        if (resolution == OverlapResolution.UNSUPPORTED) {
            logger.debug("Skipping donor call {}: unsupported overlap with stored call {}", incoming, existing);
        }
        statistics.recordResolution(resolution);
    }

    /**
     * Decides how {@code incoming} is folded into the stored call {@code existing} it overlaps.
     * A donor call replacing a single-position call must fit inside it, so the neighbouring calls are not truncated.
     * A single-base donor call running past the end of a reference block resolves to {@link OverlapResolution#SPLIT},
     * which {@link #splitReferenceBlock} then rejects.
     */
    @VisibleForTesting
    static OverlapResolution resolveOverlap(final SimpleVariant existing, final SimpleVariant incoming) {
        if (existing.sameCall(incoming)) {
            return OverlapResolution.IDENTICAL;
        }
        if (existing.isSinglePosition()) {
            return existing.getInterval().contains(incoming) ? OverlapResolution.REPLACE : OverlapResolution.UNSUPPORTED;
        }
        switch (existing.getKind()) {
            case REFERENCE_BLOCK:
                return incoming.getReferenceAllele().length() == 1 ? OverlapResolution.SPLIT : OverlapResolution.UNSUPPORTED;
            case SNP:
            case INDEL:
                // multi-base calls: replacing part of one would leave the rest uncovered
                return OverlapResolution.UNSUPPORTED;
            default:
                throw new MutatorException.ShouldNeverReachHereException("Unknown variant kind " + existing.getKind());
        }
    }

    /**
     * Applies the resolution of {@code incoming} against the call stored under {@code existingRange}.
     *
     * @return the resolution that was applied
     */
    @VisibleForTesting
    static OverlapResolution updateOverlappingVariant(final GenomicIntervalMap<SimpleVariant> variants,
                                                      final SimpleInterval existingRange,
                                                      final SimpleVariant incoming) {
        final SimpleVariant existing = Utils.nonNull(variants.getEntry(existingRange.getStartPosition()),
                () -> "No call stored at " + existingRange).getValue();
        final OverlapResolution resolution = resolveOverlap(existing, incoming);
        switch (resolution) {
            case IDENTICAL:
            case UNSUPPORTED:
                break;
            case REPLACE:
                variants.remove(existingRange);
                variants.put(incoming.getInterval(), incoming);
                break;
            case SPLIT:
                final List<SimpleVariant> pieces = splitReferenceBlock(existing, incoming);
                variants.remove(existingRange);
                for (final SimpleVariant piece : pieces) {
                    variants.put(piece.getInterval(), piece);
                }
                break;
            default:
                throw new MutatorException.ShouldNeverReachHereException("Unknown resolution " + resolution);
        }
        return resolution;
    }

    /**
     * Cuts {@code referenceBlock} around {@code incoming}.
     *
     * @return in order: the remainder before {@code incoming} if any, {@code incoming} itself, and the remainder after
     * it if any. Remainders keep the block's reference allele, use {@code <NON_REF>} and are not of donor origin.
     * The pieces are disjoint and together cover exactly the block.
     * @throws MutatorException.ContractViolation if {@code incoming} is not contained in {@code referenceBlock}
     */
    public static List<SimpleVariant> splitReferenceBlock(final SimpleVariant referenceBlock, final SimpleVariant incoming) {
        Utils.nonNull(referenceBlock, "referenceBlock");
        Utils.nonNull(incoming, "incoming");
        if (!referenceBlock.getInterval().contains(incoming)) {
            throw new MutatorException.ContractViolation("cannot split " + referenceBlock + " around " + incoming
                    + " which it does not contain");
        }

        final List<SimpleVariant> pieces = new ArrayList<>(3);
        if (incoming.getStart() > referenceBlock.getStart()) {
            pieces.add(SimpleVariant.referenceBlock(
                    new SimpleInterval(referenceBlock.getContig(), referenceBlock.getStart(), incoming.getStart() - 1),
                    referenceBlock.getReferenceAllele()));
        }
        pieces.add(incoming);
        if (incoming.getEnd() < referenceBlock.getEnd()) {
            pieces.add(SimpleVariant.referenceBlock(
                    new SimpleInterval(referenceBlock.getContig(), incoming.getEnd() + 1, referenceBlock.getEnd()),
                    referenceBlock.getReferenceAllele()));
        }
        return pieces;
    }
}
