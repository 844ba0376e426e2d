package org.broadinstitute.mutator.utils;

import org.broadinstitute.mutator.MutatorBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class GenomicPositionUnitTest extends MutatorBaseTest {

    @DataProvider(name = "orderedPairs")
    public Object[][] orderedPairs() {
        return new Object[][]{
                {new GenomicPosition("chr1", 5), new GenomicPosition("chr1", 6)},
                {new GenomicPosition("chr1", 100), new GenomicPosition("chr2", 1)},
                {new GenomicPosition("chr2", 1), new GenomicPosition("chr10", 1)},
                {new GenomicPosition("2", 1), new GenomicPosition("chr10", 1)},
                {new GenomicPosition("CHR9", 1), new GenomicPosition("chr10", 1)},
                {new GenomicPosition(" chr3 ", 1), new GenomicPosition("chr4", 1)},
                {new GenomicPosition("chr22", 1), new GenomicPosition("chrX", 1)},
                {new GenomicPosition("chrX", 1), new GenomicPosition("chrY", 1)},
                {new GenomicPosition("scaffold_1", 1), new GenomicPosition("scaffold_2", 1)},
        };
    }

    @Test(dataProvider = "orderedPairs")
    public void testOrdering(final GenomicPosition lower, final GenomicPosition higher) {
        Assert.assertTrue(lower.compareTo(higher) < 0, lower + " should sort before " + higher);
        Assert.assertTrue(higher.compareTo(lower) > 0, higher + " should sort after " + lower);
    }

    @Test
    public void testSameNumberWithDifferentNamesAreDistinct() {
        final GenomicPosition prefixed = new GenomicPosition("chr1", 10);
        final GenomicPosition bare = new GenomicPosition("1", 10);
        Assert.assertNotEquals(prefixed.compareTo(bare), 0);
        Assert.assertEquals(Integer.signum(prefixed.compareTo(bare)), -Integer.signum(bare.compareTo(prefixed)));
        Assert.assertNotEquals(prefixed, bare);
    }

    @Test
    public void testSortingIsStableForMixedNames() {
        final List<String> contigs = new ArrayList<>(Arrays.asList("chrX", "10", "chr1a", "9", "chr2", "1a", "chrM"));
        Collections.shuffle(contigs, new java.util.Random(42));
        contigs.sort(GenomicPosition.CONTIG_ORDER);
        Assert.assertEquals(contigs, Arrays.asList("chr2", "9", "10", "1a", "chr1a", "chrM", "chrX"));
    }

    @Test
    public void testEqualsAndHashCode() {
        final GenomicPosition a = new GenomicPosition("chr1", 10);
        final GenomicPosition b = new GenomicPosition("chr1", 10);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertEquals(a.compareTo(b), 0);
        Assert.assertNotEquals(a, new GenomicPosition("chr1", 11));
        Assert.assertEquals(a.toString(), "chr1:10");
    }

    @DataProvider(name = "badPositions")
    public Object[][] badPositions() {
        return new Object[][]{
                {null, 1},
                {"chr1", 0},
                {"chr1", -3},
        };
    }

    @Test(dataProvider = "badPositions", expectedExceptions = IllegalArgumentException.class)
    public void testBadPositions(final String contig, final int position) {
        new GenomicPosition(contig, position);
    }
}
