package org.janelia.surfalign.match;

import java.util.Random;

import org.janelia.surfalign.feature.FeatureSet;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link AffinityBuilder} class.
 */
public class AffinityBuilderTest {

    @Test
    public void testRowsAreStochastic() {

        final FeatureSet source = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(3), 20);
        final FeatureSet target = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(5), 30);
        final int k = 4;

        final AffinityMatrix affinity = new AffinityBuilder().buildAffinity(source, target, k);

        Assert.assertEquals("invalid shape", "(20, 30)", affinity.getShape());
        Assert.assertEquals("each row should link k targets", 20 * k, affinity.getNumberOfNonZeroEntries());

        final double[][] dense = affinity.toDenseArray();
        for (int row = 0; row < dense.length; row++) {
            double sum = 0.0;
            for (final double value : dense[row]) {
                Assert.assertTrue("negative entry in row " + row, value >= 0.0);
                sum += value;
            }
            Assert.assertEquals("row " + row + " does not sum to 1", 1.0, sum, 1e-12);
        }
    }

    @Test
    public void testNearerNeighborsGetLargerWeights() {

        final FeatureSet source = positions(new double[] {0, 0, 0});
        final FeatureSet target = positions(new double[] {3, 0, 0}, new double[] {1, 0, 0}, new double[] {2, 0, 0});

        final AffinityMatrix affinity = new AffinityBuilder().buildAffinity(source, target, 3);

        // weights 1/9, 1, 1/4 normalized by 49/36
        Assert.assertEquals("invalid weight for nearest target", 36.0 / 49.0, affinity.get(0, 1), 1e-12);
        Assert.assertEquals("invalid weight for middle target", 9.0 / 49.0, affinity.get(0, 2), 1e-12);
        Assert.assertEquals("invalid weight for farthest target", 4.0 / 49.0, affinity.get(0, 0), 1e-12);
    }

    @Test
    public void testCoincidentPointsUseDistanceFloor() {

        final double weight = AffinityBuilder.getWeight(0.0);
        Assert.assertTrue("weight should be finite", Double.isFinite(weight));
        Assert.assertEquals("coincident weight should be derived from distance floor", 1.0e6, weight, 1e-3);

        final FeatureSet source = positions(new double[] {0, 0, 0});
        final FeatureSet target = positions(new double[] {0, 0, 0}, new double[] {1, 0, 0});

        final AffinityMatrix affinity = new AffinityBuilder().buildAffinity(source, target, 2);

        Assert.assertEquals("invalid coincident affinity", weight / (weight + 1.0), affinity.get(0, 0), 1e-12);
        Assert.assertEquals("invalid distant affinity", 1.0 / (weight + 1.0), affinity.get(0, 1), 1e-12);
    }

    @Test
    public void testNeighborsAtFloorDistanceGetUniformWeights() {

        final FeatureSet source = positions(new double[] {0, 0, 0});
        final FeatureSet target = positions(new double[] {0, 0, 0},
                                            new double[] {0.0005, 0, 0},
                                            new double[] {0, 0.001, 0},
                                            new double[] {5, 0, 0});

        final AffinityMatrix affinity = new AffinityBuilder().buildAffinity(source, target, 3);

        for (int column = 0; column < 3; column++) {
            Assert.assertEquals("invalid affinity for target " + column, 1.0 / 3.0, affinity.get(0, column), 1e-12);
        }
        Assert.assertEquals("target outside of k neighbors should have zero affinity",
                            0.0, affinity.get(0, 3), 0.0);
    }

    @Test
    public void testDistantNeighborsUseWeightFloor() {

        Assert.assertEquals("invalid floored weight", AffinityBuilder.WEIGHT_FLOOR, AffinityBuilder.getWeight(200.0), 0.0);

        final FeatureSet source = positions(new double[] {0, 0, 0});
        final FeatureSet target = positions(new double[] {200, 0, 0}, new double[] {0, 400, 0});

        final AffinityMatrix affinity = new AffinityBuilder().buildAffinity(source, target, 2);

        Assert.assertEquals("invalid affinity for target 0", 0.5, affinity.get(0, 0), 1e-12);
        Assert.assertEquals("invalid affinity for target 1", 0.5, affinity.get(0, 1), 1e-12);
    }

    @Test
    public void testCustomSearchIsUsed() {

        final FeatureSet source = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(7), 10);
        final FeatureSet target = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(9), 12);

        final double[][] expected =
                new AffinityBuilder(new BruteForceNearestNeighborSearch()).buildAffinity(source, target, 3)
                        .toDenseArray();
        final double[][] actual = new AffinityBuilder().buildAffinity(source, target, 3).toDenseArray();

        for (int row = 0; row < expected.length; row++) {
            Assert.assertArrayEquals("invalid row " + row, expected[row], actual[row], 1e-12);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKTooLarge() {
        new AffinityBuilder().buildAffinity(positions(new double[] {0, 0, 0}),
                                            positions(new double[] {1, 0, 0}),
                                            2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKTooSmall() {
        new AffinityBuilder().buildAffinity(positions(new double[] {0, 0, 0}),
                                            positions(new double[] {1, 0, 0}),
                                            0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDimensionMismatch() {
        new AffinityBuilder().buildAffinity(positions(new double[] {0, 0, 0}),
                                            KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(1), 2),
                                            1);
    }

    static FeatureSet positions(final double[]... positions) {
        return new FeatureSet(positions);
    }

}
