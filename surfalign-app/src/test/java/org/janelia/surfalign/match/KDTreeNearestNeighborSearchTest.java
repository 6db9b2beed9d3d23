package org.janelia.surfalign.match;

import java.util.Random;

import org.janelia.surfalign.feature.FeatureSet;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link KDTreeNearestNeighborSearch} class.
 */
public class KDTreeNearestNeighborSearchTest {

    @Test
    public void testMatchesExhaustiveSearch() {

        final FeatureSet querySet = buildRandomFeatures(new Random(11), 40);
        final FeatureSet referenceSet = buildRandomFeatures(new Random(23), 60);
        final int k = 4;

        final NearestNeighbors expected =
                new BruteForceNearestNeighborSearch().findNearestNeighbors(querySet, referenceSet, k);

        for (final int numberOfThreads : new int[] {1, 3}) {

            final NearestNeighbors actual =
                    new KDTreeNearestNeighborSearch(numberOfThreads).findNearestNeighbors(querySet, referenceSet, k);

            Assert.assertEquals("invalid number of rows", querySet.size(), actual.size());
            Assert.assertEquals("invalid k", k, actual.getK());

            for (int i = 0; i < querySet.size(); i++) {
                for (int n = 0; n < k; n++) {
                    Assert.assertEquals("invalid distance for query " + i + ", neighbor " + n +
                                        " with " + numberOfThreads + " threads",
                                        expected.getDistance(i, n), actual.getDistance(i, n), 1e-12);
                    Assert.assertEquals("invalid index for query " + i + ", neighbor " + n +
                                        " with " + numberOfThreads + " threads",
                                        expected.getIndex(i, n), actual.getIndex(i, n));
                }
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testKLargerThanReferenceSet() {
        final FeatureSet features = buildRandomFeatures(new Random(1), 3);
        new KDTreeNearestNeighborSearch().findNearestNeighbors(features, features, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroK() {
        final FeatureSet features = buildRandomFeatures(new Random(1), 3);
        new KDTreeNearestNeighborSearch().findNearestNeighbors(features, features, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreadCount() {
        new KDTreeNearestNeighborSearch(0);
    }

    static FeatureSet buildRandomFeatures(final Random random,
                                          final int size) {
        final double[][] features = new double[size][6];
        for (int i = 0; i < size; i++) {
            for (int d = 0; d < 3; d++) {
                features[i][d] = random.nextDouble() * 10.0;
            }
            // unit normal
            final double theta = random.nextDouble() * Math.PI;
            final double phi = random.nextDouble() * 2.0 * Math.PI;
            features[i][3] = Math.sin(theta) * Math.cos(phi);
            features[i][4] = Math.sin(theta) * Math.sin(phi);
            features[i][5] = Math.cos(theta);
        }
        return new FeatureSet(features);
    }

}
