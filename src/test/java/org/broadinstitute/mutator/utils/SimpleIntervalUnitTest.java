package org.broadinstitute.mutator.utils;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.mutator.MutatorBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class SimpleIntervalUnitTest extends MutatorBaseTest {

    @DataProvider(name = "badIntervals")
    public Object[][] badIntervals(){
        return new Object[][]{
                {null,1,12, "null contig"},
                {"1", 0, 10, "start==0"},
                {"1", -10, 10, "negative start"},
                {"1", 10, 9, "end < start"}
        };
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervals(String contig, int start, int end, String name){
        new SimpleInterval(contig, start, end);
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervalsFromLocatable(String contig, int start, int end, String name){
        final Locatable l = getLocatable(contig, start, end);
        new SimpleInterval(l);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void illegalArgumentExceptionFromNullLocatable(){
        new SimpleInterval((Locatable)null);
    }

    @Test
    public void testFromLocatable(){
        final SimpleInterval interval = new SimpleInterval(getLocatable("chr2", 10, 20));
        Assert.assertEquals(interval, new SimpleInterval("chr2", 10, 20));
        Assert.assertEquals(interval.getStartPosition(), new GenomicPosition("chr2", 10));
        Assert.assertEquals(interval.getEndPosition(), new GenomicPosition("chr2", 20));
    }

    @DataProvider(name = "overlaps")
    public Object[][] overlaps(){
        final SimpleInterval block = new SimpleInterval("chr1", 10, 20);
        return new Object[][]{
                {block, new SimpleInterval("chr1", 10, 20), true, true},
                {block, new SimpleInterval("chr1", 15, 15), true, true},
                {block, new SimpleInterval("chr1", 5, 10), true, false},
                {block, new SimpleInterval("chr1", 20, 25), true, false},
                {block, new SimpleInterval("chr1", 21, 25), false, false},
                {block, new SimpleInterval("chr1", 1, 9), false, false},
                {block, new SimpleInterval("chr2", 15, 15), false, false},
                {block, null, false, false},
        };
    }

    @Test(dataProvider = "overlaps")
    public void testOverlapsAndContains(final SimpleInterval interval, final SimpleInterval other,
                                       final boolean overlaps, final boolean contains){
        Assert.assertEquals(interval.overlaps(other), overlaps, "overlaps");
        Assert.assertEquals(interval.contains(other), contains, "contains");
    }

    @Test
    public void testContainsPosition(){
        final SimpleInterval interval = new SimpleInterval("chr1", 10, 20);
        Assert.assertTrue(interval.contains(new GenomicPosition("chr1", 10)));
        Assert.assertTrue(interval.contains(new GenomicPosition("chr1", 20)));
        Assert.assertFalse(interval.contains(new GenomicPosition("chr1", 21)));
        Assert.assertFalse(interval.contains(new GenomicPosition("chr2", 15)));
        Assert.assertFalse(interval.contains((GenomicPosition) null));
    }

    @Test
    public void testEqualsAndToString(){
        Assert.assertEquals(new SimpleInterval("chr1", 1, 2), new SimpleInterval("chr1", 1, 2));
        Assert.assertEquals(new SimpleInterval("chr1", 1, 2).hashCode(), new SimpleInterval("chr1", 1, 2).hashCode());
        Assert.assertNotEquals(new SimpleInterval("chr1", 1, 2), new SimpleInterval("chr1", 1, 3));
        Assert.assertEquals(new SimpleInterval("chr1", 1, 2).toString(), "chr1:1-2");
    }

    private static Locatable getLocatable(final String contig, final int start, final int end) {
        return new Locatable() {
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
        };
    }
}
