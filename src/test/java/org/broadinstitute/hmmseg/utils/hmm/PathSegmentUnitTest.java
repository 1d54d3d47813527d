package org.broadinstitute.hmmseg.utils.hmm;

import org.broadinstitute.hmmseg.HmmSegBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class PathSegmentUnitTest extends HmmSegBaseTest {

    @Test
    public void testAccessors() {
        final PathSegment segment = new PathSegment(3, 7);
        Assert.assertEquals(segment.getStart(), 3);
        Assert.assertEquals(segment.getEnd(), 7);
        Assert.assertEquals(segment.size(), 5);
        Assert.assertTrue(segment.contains(3));
        Assert.assertTrue(segment.contains(7));
        Assert.assertFalse(segment.contains(2));
        Assert.assertFalse(segment.contains(8));
        Assert.assertEquals(segment.toString(), "[3, 7]");
    }

    @Test
    public void testSinglePositionSegment() {
        final PathSegment segment = new PathSegment(0, 0);
        Assert.assertEquals(segment.size(), 1);
        Assert.assertEquals(segment.toString(), "[0, 0]");
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(new PathSegment(1, 4), new PathSegment(1, 4));
        Assert.assertEquals(new PathSegment(1, 4).hashCode(), new PathSegment(1, 4).hashCode());
        Assert.assertNotEquals(new PathSegment(1, 4), new PathSegment(1, 5));
        Assert.assertNotEquals(new PathSegment(1, 4), new PathSegment(0, 4));
    }

    @DataProvider(name = "badBounds")
    public Object[][] badBounds() {
        return new Object[][] {{-1, 3}, {5, 4}, {-2, -1}};
    }

    @Test(dataProvider = "badBounds", expectedExceptions = IllegalArgumentException.class)
    public void testBadBounds(final int start, final int end) {
        new PathSegment(start, end);
    }
}
