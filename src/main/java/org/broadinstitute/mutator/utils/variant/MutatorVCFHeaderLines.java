package org.broadinstitute.mutator.utils.variant;

import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFFormatHeaderLine;
import htsjdk.variant.vcf.VCFHeader;
import htsjdk.variant.vcf.VCFHeaderLine;
import htsjdk.variant.vcf.VCFHeaderLineCount;
import htsjdk.variant.vcf.VCFHeaderLineType;
import htsjdk.variant.vcf.VCFInfoHeaderLine;
import org.broadinstitute.mutator.utils.Utils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.broadinstitute.mutator.utils.variant.MutatorVCFConstants.*;

/**
 * The {@link VCFHeaderLine} definitions written at the top of every mutated GVCF.
 * The four assembly coordinate lines are always declared, but the matching INFO fields are only written on
 * records that carry them.
 */
public final class MutatorVCFHeaderLines {

    private MutatorVCFHeaderLines() {}

    private static final Set<VCFHeaderLine> genericHeaderLines = new LinkedHashSet<>();

    static {
        genericHeaderLines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_ALLELE_DEPTHS, 3, VCFHeaderLineType.Integer, "Allelic depths for the ref and alt alleles in the order listed"));
        genericHeaderLines.add(new VCFFormatHeaderLine(VCFConstants.DEPTH_KEY, 1, VCFHeaderLineType.Integer, "Read Depth (only filtered reads used for calling)"));
        genericHeaderLines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_QUALITY_KEY, 1, VCFHeaderLineType.Integer, "Genotype Quality"));
        genericHeaderLines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_KEY, 1, VCFHeaderLineType.String, "Genotype"));
        genericHeaderLines.add(new VCFFormatHeaderLine(VCFConstants.GENOTYPE_PL_KEY, VCFHeaderLineCount.G, VCFHeaderLineType.Integer, "Normalized, Phred-scaled likelihoods for genotypes as defined in the VCF specification"));

        genericHeaderLines.add(new VCFInfoHeaderLine(VCFConstants.DEPTH_KEY, 1, VCFHeaderLineType.Integer, "Total Depth"));
        genericHeaderLines.add(new VCFInfoHeaderLine(VCFConstants.SAMPLE_NUMBER_KEY, 1, VCFHeaderLineType.Integer, "Number of Samples With Data"));
        genericHeaderLines.add(new VCFInfoHeaderLine(VCFConstants.ALLELE_FREQUENCY_KEY, VCFHeaderLineCount.A, VCFHeaderLineType.Float, "Allele Frequency"));
        genericHeaderLines.add(new VCFInfoHeaderLine(VCFConstants.END_KEY, 1, VCFHeaderLineType.Integer, "Stop position of the interval"));

        genericHeaderLines.add(new VCFInfoHeaderLine(ASM_CHROMOSOME_KEY, 1, VCFHeaderLineType.String, "Assembly chromosome"));
        genericHeaderLines.add(new VCFInfoHeaderLine(ASM_START_KEY, 1, VCFHeaderLineType.Integer, "Assembly start position"));
        genericHeaderLines.add(new VCFInfoHeaderLine(ASM_END_KEY, 1, VCFHeaderLineType.Integer, "Assembly end position"));
        genericHeaderLines.add(new VCFInfoHeaderLine(ASM_STRAND_KEY, 1, VCFHeaderLineType.String, "Assembly strand"));
    }

    /**
     * @return the FORMAT and INFO lines every mutated GVCF declares
     */
    public static Set<VCFHeaderLine> getGenericHeaderLines() {
        return Collections.unmodifiableSet(genericHeaderLines);
    }

    /**
     * Creates a header with the generic lines, any {@code extraLines}, and the given sample columns.
     */
    public static VCFHeader createGenericHeader(final List<String> sampleNames, final Collection<VCFHeaderLine> extraLines) {
        Utils.nonNull(sampleNames, "sampleNames");
        Utils.nonNull(extraLines, "extraLines");
        final Set<VCFHeaderLine> headerLines = new LinkedHashSet<>(genericHeaderLines);
        headerLines.addAll(extraLines);
        return new VCFHeader(headerLines, sampleNames);
    }
}
