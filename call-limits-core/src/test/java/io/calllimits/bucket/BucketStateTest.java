package io.calllimits.bucket;

import org.junit.Assert;
import org.junit.Test;

public class BucketStateTest {
    @Test
    public void holdsObservedValues() {
        BucketState state = new BucketState(40, 32);
        Assert.assertEquals(40, state.getCapacity());
        Assert.assertEquals(32, state.getCurrentFillLevel());
    }

    @Test
    public void fullBucketIsValid() {
        Assert.assertEquals(40, new BucketState(40, 40).getCurrentFillLevel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroCapacity() {
        new BucketState(0, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeFillLevel() {
        new BucketState(40, -1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsFillLevelAboveCapacity() {
        new BucketState(40, 41);
    }

    @Test
    public void equality() {
        Assert.assertEquals(new BucketState(40, 5), new BucketState(40, 5));
        Assert.assertEquals(new BucketState(40, 5).hashCode(), new BucketState(40, 5).hashCode());
        Assert.assertNotEquals(new BucketState(40, 5), new BucketState(80, 5));
        Assert.assertNotEquals(new BucketState(40, 5), new BucketState(40, 6));
        Assert.assertEquals("BucketState [5/40]", new BucketState(40, 5).toString());
    }
}
