package org.janelia.surfalign.match;

import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CorrespondenceResolver} class.
 */
public class CorrespondenceResolverTest {

    private static final FeatureSet TARGET_FEATURES = new FeatureSet(new double[][] {
            {2.0, 0.0, 4.0},
            {-1.0, 1.0, 4.0}
    });

    private static final FlagSet TARGET_FLAGS = new FlagSet(new double[] { 1.0, 0.0 });

    @Test
    public void testFeaturesAreAffinityWeighted() {

        final AffinityMatrix affinity = AffinityMatrix.fromDenseArray(new double[][] {
                {0.9, 0.1},
                {0.0, 1.0},
                {0.5, 0.5}
        }, 2);

        final Correspondences correspondences = new CorrespondenceResolver().resolve(TARGET_FEATURES,
                                                                                     TARGET_FLAGS,
                                                                                     affinity);

        Assert.assertEquals("invalid number of correspondences", 3, correspondences.size());
        Assert.assertArrayEquals("invalid features for element 0",
                                 new double[] {1.7, 0.1, 4.0}, correspondences.getFeatures().get(0), 1e-12);
        Assert.assertArrayEquals("invalid features for element 1",
                                 new double[] {-1.0, 1.0, 4.0}, correspondences.getFeatures().get(1), 1e-12);
        Assert.assertArrayEquals("invalid features for element 2",
                                 new double[] {0.5, 0.5, 4.0}, correspondences.getFeatures().get(2), 1e-12);
    }

    @Test
    public void testFlagThresholdIsStrict() {

        final AffinityMatrix affinity = AffinityMatrix.fromDenseArray(new double[][] {
                {0.9, 0.1},
                {0.9000001, 0.0999999},
                {1.0, 0.0}
        }, 2);

        final FlagSet flags =
                new CorrespondenceResolver().resolve(TARGET_FEATURES, TARGET_FLAGS, affinity).getFlags();

        Assert.assertEquals("flag exactly at threshold should be invalid", 0.0, flags.get(0), 0.0);
        Assert.assertEquals("flag just above threshold should be valid", 1.0, flags.get(1), 0.0);
        Assert.assertEquals("fully valid flag should be valid", 1.0, flags.get(2), 0.0);
    }

    @Test
    public void testCustomThreshold() {

        final AffinityMatrix affinity = AffinityMatrix.fromDenseArray(new double[][] {{0.6, 0.4}}, 2);

        Assert.assertEquals("flag should be invalid with default threshold",
                            0.0,
                            new CorrespondenceResolver().resolve(TARGET_FEATURES, TARGET_FLAGS, affinity)
                                    .getFlags().get(0),
                            0.0);
        Assert.assertEquals("flag should be valid with lower threshold",
                            1.0,
                            new CorrespondenceResolver(0.5).resolve(TARGET_FEATURES, TARGET_FLAGS, affinity)
                                    .getFlags().get(0),
                            0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testColumnMismatch() {
        final AffinityMatrix affinity = AffinityMatrix.fromDenseArray(new double[][] {{0.5, 0.25, 0.25}}, 3);
        new CorrespondenceResolver().resolve(TARGET_FEATURES, TARGET_FLAGS, affinity);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreshold() {
        new CorrespondenceResolver(1.5);
    }

}
