package org.broadinstitute.mutator.utils.variant;

import com.google.common.collect.ImmutableMap;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.variantcontext.VariantContextBuilder;
import org.broadinstitute.mutator.MutatorBaseTest;
import org.broadinstitute.mutator.utils.SimpleInterval;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

public final class SimpleVariantUnitTest extends MutatorBaseTest {

    @DataProvider(name = "kinds")
    public Object[][] kinds() {
        return new Object[][]{
                {"A", "<NON_REF>", SimpleVariant.Kind.REFERENCE_BLOCK},
                {"A", "T", SimpleVariant.Kind.SNP},
                {"A", "T,G", SimpleVariant.Kind.SNP},
                {"A", "T,<NON_REF>", SimpleVariant.Kind.SNP},
                {"A", "AT", SimpleVariant.Kind.INDEL},
                {"A", "T,AT", SimpleVariant.Kind.INDEL},
                {"ACGT", "A", SimpleVariant.Kind.INDEL},
                {"AC", "GT", SimpleVariant.Kind.INDEL},
                {"AC", "<NON_REF>", SimpleVariant.Kind.INDEL},
        };
    }

    @Test(dataProvider = "kinds")
    public void testKind(final String ref, final String alt, final SimpleVariant.Kind expected) {
        final SimpleVariant variant = new SimpleVariant(new SimpleInterval("chr1", 10, 10 + ref.length() - 1), ref, alt, false);
        Assert.assertEquals(variant.getKind(), expected);
        Assert.assertEquals(variant.isReferenceBlock(), expected == SimpleVariant.Kind.REFERENCE_BLOCK);
        Assert.assertEquals(variant.isIndel(), expected == SimpleVariant.Kind.INDEL);
    }

    @Test
    public void testReferenceBlockFactory() {
        final SimpleVariant block = SimpleVariant.referenceBlock(new SimpleInterval("chr1", 10, 20), "A");
        Assert.assertTrue(block.isReferenceBlock());
        Assert.assertFalse(block.isDonorOrigin());
        Assert.assertFalse(block.isSinglePosition());
        Assert.assertEquals(block.getAlternateAllele(), MutatorVCFConstants.NON_REF_SYMBOLIC_ALLELE);
        Assert.assertTrue(block.getAssemblyAnnotations().isEmpty());
    }

    @Test
    public void testFromBaseVariantContextKeepsAllAlternates() {
        final VariantContext vc = new VariantContextBuilder("test", "chr1", 100, 100,
                Arrays.asList(Allele.create("A", true), Allele.create("T"), Allele.create("<NON_REF>")))
                .attribute(MutatorVCFConstants.ASM_CHROMOSOME_KEY, "asm1")
                .attribute(MutatorVCFConstants.ASM_START_KEY, 4242)
                .make();
        final SimpleVariant variant = SimpleVariant.fromBaseVariantContext(vc);
        Assert.assertEquals(variant.getInterval(), new SimpleInterval("chr1", 100, 100));
        Assert.assertEquals(variant.getReferenceAllele(), "A");
        Assert.assertEquals(variant.getAlternateAllele(), "T,<NON_REF>");
        Assert.assertFalse(variant.isDonorOrigin());
        Assert.assertEquals(variant.getAssemblyAnnotations(), ImmutableMap.of(
                MutatorVCFConstants.ASM_CHROMOSOME_KEY, "asm1",
                MutatorVCFConstants.ASM_START_KEY, 4242));
    }

    @Test
    public void testFromBaseVariantContextWithoutAlternate() {
        final VariantContext vc = new VariantContextBuilder("test", "chr1", 100, 100,
                Arrays.asList(Allele.create("A", true))).make();
        final SimpleVariant variant = SimpleVariant.fromBaseVariantContext(vc);
        Assert.assertTrue(variant.isReferenceBlock());
    }

    @Test
    public void testFromDonorVariantContextKeepsFirstAlternate() {
        final VariantContext vc = new VariantContextBuilder("test", "chr1", 100, 102,
                Arrays.asList(Allele.create("ACG", true), Allele.create("A"), Allele.create("<NON_REF>"))).make();
        final SimpleVariant variant = SimpleVariant.fromDonorVariantContext(vc);
        Assert.assertEquals(variant.getInterval(), new SimpleInterval("chr1", 100, 102));
        Assert.assertEquals(variant.getAlternateAllele(), "A");
        Assert.assertTrue(variant.isDonorOrigin());
        Assert.assertTrue(variant.isIndel());
    }

    @Test
    public void testFromDonorVariantContextWithoutAlternate() {
        final VariantContext vc = new VariantContextBuilder("test", "chr1", 100, 100,
                Arrays.asList(Allele.create("A", true))).make();
        Assert.assertNull(SimpleVariant.fromDonorVariantContext(vc));
    }

    @Test
    public void testSameCallIgnoresOrigin() {
        final SimpleInterval interval = new SimpleInterval("chr1", 100, 100);
        final SimpleVariant base = new SimpleVariant(interval, "A", "T", false);
        final SimpleVariant donor = new SimpleVariant(interval, "A", "T", true);
        Assert.assertTrue(base.sameCall(donor));
        Assert.assertNotEquals(base, donor);
        Assert.assertFalse(base.sameCall(new SimpleVariant(interval, "A", "G", true)));
        Assert.assertFalse(base.sameCall(null));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyAlleleRejected() {
        new SimpleVariant(new SimpleInterval("chr1", 1, 1), "", "T", false);
    }
}
