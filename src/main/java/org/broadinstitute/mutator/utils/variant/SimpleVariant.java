package org.broadinstitute.mutator.utils.variant;

import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Locatable;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import org.broadinstitute.mutator.utils.GenomicPosition;
import org.broadinstitute.mutator.utils.SimpleInterval;
import org.broadinstitute.mutator.utils.Utils;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable call over a closed genomic interval, either a reference block or a called variant.
 *
 * The two are told apart by allele content, but the result is exposed as an explicit {@link Kind} so that
 * callers can switch over it exhaustively.
 */
public final class SimpleVariant implements Locatable {

    /**
     * Shape of a {@link SimpleVariant}, derived from its alleles.
     */
    public enum Kind {
        /** One reference base and the {@code <NON_REF>} alternate: coverage with no called variant. */
        REFERENCE_BLOCK,
        /** One reference base and only single-base alternates, besides {@code <NON_REF>}. */
        SNP,
        /** Anything else: insertions, deletions, and multi-base substitutions. */
        INDEL
    }

    private final SimpleInterval interval;
    private final String referenceAllele;
    private final String alternateAllele;
    private final boolean donorOrigin;
    private final Map<String, Object> assemblyAnnotations;
    private final Kind kind;

    public SimpleVariant(final SimpleInterval interval, final String referenceAllele, final String alternateAllele,
                         final boolean donorOrigin, final Map<String, Object> assemblyAnnotations) {
        this.interval = Utils.nonNull(interval, "interval");
        this.referenceAllele = Utils.nonEmpty(referenceAllele, "referenceAllele");
        this.alternateAllele = Utils.nonEmpty(alternateAllele, "alternateAllele");
        this.donorOrigin = donorOrigin;
        this.assemblyAnnotations = ImmutableMap.copyOf(Utils.nonNull(assemblyAnnotations, "assemblyAnnotations"));
        this.kind = classify(referenceAllele, alternateAllele);
    }

    public SimpleVariant(final SimpleInterval interval, final String referenceAllele, final String alternateAllele,
                         final boolean donorOrigin) {
        this(interval, referenceAllele, alternateAllele, donorOrigin, ImmutableMap.of());
    }

    /**
     * Builds a {@code <NON_REF>} block over {@code interval}. Blocks made here never carry assembly annotations.
     */
    public static SimpleVariant referenceBlock(final SimpleInterval interval, final String referenceAllele) {
        return new SimpleVariant(interval, referenceAllele, MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE, false);
    }

    /**
     * Converts a base (founder) record. All alternates are kept, joined by {@link MutatorVCFConstants#ALT_ALLELE_SEPARATOR}.
     * A record without any alternate allele is read as {@code <NON_REF>} so that its coverage is kept.
     */
    public static SimpleVariant fromBaseVariantContext(final VariantContext vc) {
        Utils.nonNull(vc, "vc");
        final String alternates = vc.getAlternateAlleles().isEmpty()
                ? MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE
                : vc.getAlternateAlleles().stream()
                        .map(Allele::getDisplayString)
                        .collect(Collectors.joining(MutatorVCFConstants.ALT_ALLELE_SEPARATOR));
        return new SimpleVariant(new SimpleInterval(vc), vc.getReference().getDisplayString(), alternates,
                false, extractAssemblyAnnotations(vc));
    }

    /**
     * Converts a donor record, keeping only its first alternate allele.
     *
     * @return null if the record has no alternate allele at all
     */
    public static SimpleVariant fromDonorVariantContext(final VariantContext vc) {
        Utils.nonNull(vc, "vc");
        if (vc.getAlternateAlleles().isEmpty()) {
            return null;
        }
        return new SimpleVariant(new SimpleInterval(vc), vc.getReference().getDisplayString(),
                vc.getAlternateAllele(0).getDisplayString(), true, extractAssemblyAnnotations(vc));
    }

    private static Map<String, Object> extractAssemblyAnnotations(final VariantContext vc) {
        final ImmutableMap.Builder<String, Object> annotations = ImmutableMap.builder();
        for (final String key : MutatorVCFConstants.ASSEMBLY_ANNOTATION_KEYS) {
            final Object value = vc.getAttribute(key);
            if (value != null) {
                annotations.put(key, value);
            }
        }
        return annotations.build();
    }

    static Kind classify(final String referenceAllele, final String alternateAllele) {
        if (referenceAllele.length() != 1) {
            return Kind.INDEL;
        }
        if (MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE.equals(alternateAllele)) {
            return Kind.REFERENCE_BLOCK;
        }
        // a trailing <NON_REF> at a called site does not make it an indel
        for (final String alternate : alternateAllele.split(MutatorVCFConstants.ALT_ALLELE_SEPARATOR, -1)) {
            if (alternate.length() != 1 && !MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE.equals(alternate)) {
                return Kind.INDEL;
            }
        }
        return Kind.SNP;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isReferenceBlock() {
        return kind == Kind.REFERENCE_BLOCK;
    }

    public boolean isIndel() {
        return kind == Kind.INDEL;
    }

    /**
     * @return true if this call spans a single base
     */
    public boolean isSinglePosition() {
        return interval.getStart() == interval.getEnd();
    }

    public SimpleInterval getInterval() {
        return interval;
    }

    @Override
    public String getContig() {
        return interval.getContig();
    }

    @Override
    public int getStart() {
        return interval.getStart();
    }

    @Override
    public int getEnd() {
        return interval.getEnd();
    }

    public GenomicPosition getStartPosition() {
        return interval.getStartPosition();
    }

    public GenomicPosition getEndPosition() {
        return interval.getEndPosition();
    }

    public String getReferenceAllele() {
        return referenceAllele;
    }

    public String getAlternateAllele() {
        return alternateAllele;
    }

    public boolean isDonorOrigin() {
        return donorOrigin;
    }

    public Map<String, Object> getAssemblyAnnotations() {
        return assemblyAnnotations;
    }

    /**
     * @return true if {@code other} calls the same alleles over the same interval, whatever its origin
     */
    public boolean sameCall(final SimpleVariant other) {
        return other != null
                && interval.equals(other.interval)
                && referenceAllele.equals(other.referenceAllele)
                && alternateAllele.equals(other.alternateAllele);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final SimpleVariant that = (SimpleVariant) o;
        return donorOrigin == that.donorOrigin
                && sameCall(that)
                && assemblyAnnotations.equals(that.assemblyAnnotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, referenceAllele, alternateAllele, donorOrigin, assemblyAnnotations);
    }

    @Override
    public String toString() {
        return String.format("%s %s>%s%s", interval, referenceAllele, alternateAllele, donorOrigin ? " (donor)" : "");
    }
}
