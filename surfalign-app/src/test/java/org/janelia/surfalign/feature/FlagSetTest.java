package org.janelia.surfalign.feature;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FlagSet} class.
 */
public class FlagSetTest {

    @Test
    public void testValidity() {

        final FlagSet flags = new FlagSet(new double[] {1.0, 0.5, 0.49, 0.0});

        Assert.assertEquals("invalid size", 4, flags.size());
        Assert.assertTrue("flag 0 should be valid", flags.isValid(0));
        Assert.assertTrue("flag 1 should be valid", flags.isValid(1));
        Assert.assertFalse("flag 2 should be invalid", flags.isValid(2));
        Assert.assertEquals("invalid valid count", 2, flags.getValidCount());

        Assert.assertEquals("invalid all valid count", 5, FlagSet.allValid(5).getValidCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRange() {
        new FlagSet(new double[] {1.5});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaN() {
        new FlagSet(new double[] {Double.NaN});
    }

    @Test
    public void testJsonProcessing() {
        final FlagSet parsedFlags = FlagSet.fromJson(new FlagSet(new double[] {0.0, 1.0, 0.25}).toJson());
        Assert.assertArrayEquals("invalid flags after parse",
                                 new double[] {0.0, 1.0, 0.25}, parsedFlags.toArray(), 0.0);
    }

}
