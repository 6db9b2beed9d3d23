package org.janelia.surfalign.match;

import java.util.Random;

import org.janelia.surfalign.feature.FeatureSet;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link AffinityFuser} class.
 */
public class AffinityFuserTest {

    @Test
    public void testFusedAffinityIsStochastic() {

        final FeatureSet a = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(11), 25);
        final FeatureSet b = KDTreeNearestNeighborSearchTest.buildRandomFeatures(new Random(13), 15);

        final AffinityBuilder builder = new AffinityBuilder();
        final AffinityMatrix forward = builder.buildAffinity(a, b, 3);
        final AffinityMatrix reverse = builder.buildAffinity(b, a, 3);

        final AffinityMatrix fused = new AffinityFuser().fuse(forward, reverse);

        Assert.assertEquals("invalid shape", "(25, 15)", fused.getShape());
        Assert.assertTrue("fused rows should be stochastic", fused.isRowStochastic());

        // every link from either direction survives fusion
        for (int i = 0; i < a.size(); i++) {
            for (int j = 0; j < b.size(); j++) {
                final boolean linked = (forward.get(i, j) > 0.0) || (reverse.get(j, i) > 0.0);
                Assert.assertEquals("invalid link state for (" + i + ", " + j + ")",
                                    linked, fused.get(i, j) > 0.0);
            }
        }
    }

    @Test
    public void testFusionBeforeNormalization() {

        final AffinityMatrix forward = AffinityMatrix.fromDenseArray(new double[][] {
                {0.5, 0.5, 0.0},
                {0.0, 0.25, 0.75}
        }, 3);
        final AffinityMatrix reverse = AffinityMatrix.fromDenseArray(new double[][] {
                {1.0, 0.0},
                {0.0, 1.0},
                {0.5, 0.5}
        }, 2);

        final AffinityMatrix fused = new AffinityFuser().fuse(forward, reverse);

        // row 0: {1.5, 0.5, 0.5} / 2.5, row 1: {0.0, 1.25, 1.25} / 2.5
        Assert.assertEquals("invalid (0, 0)", 0.6, fused.get(0, 0), 1e-12);
        Assert.assertEquals("invalid (0, 1)", 0.2, fused.get(0, 1), 1e-12);
        Assert.assertEquals("invalid (0, 2)", 0.2, fused.get(0, 2), 1e-12);
        Assert.assertEquals("invalid (1, 0)", 0.0, fused.get(1, 0), 0.0);
        Assert.assertEquals("invalid (1, 1)", 0.5, fused.get(1, 1), 1e-12);
        Assert.assertEquals("invalid (1, 2)", 0.5, fused.get(1, 2), 1e-12);

        Assert.assertEquals("forward affinity should not be modified", 0.25, forward.get(1, 1), 0.0);
        Assert.assertEquals("reverse affinity should not be modified", 0.5, reverse.get(2, 0), 0.0);
    }

    @Test
    public void testPermutationFusionIsSymmetric() {

        final double[][] permutation = {
                {0.0, 1.0, 0.0},
                {0.0, 0.0, 1.0},
                {1.0, 0.0, 0.0}
        };
        final AffinityMatrix forward = AffinityMatrix.fromDenseArray(permutation, 3);
        final AffinityMatrix reverse = forward.transpose();

        final AffinityFuser fuser = new AffinityFuser();
        final double[][] fusedForward = fuser.fuse(forward, reverse).toDenseArray();
        final double[][] fusedReverseTransposed = fuser.fuse(reverse, forward).transpose().toDenseArray();

        for (int row = 0; row < permutation.length; row++) {
            Assert.assertArrayEquals("invalid fused row " + row, permutation[row], fusedForward[row], 1e-15);
            Assert.assertArrayEquals("fusion should not depend on direction for row " + row,
                                     fusedForward[row], fusedReverseTransposed[row], 1e-15);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testShapeMismatch() {
        final AffinityMatrix forward = AffinityMatrix.fromDenseArray(new double[][] {{1.0, 0.0, 0.0}}, 3);
        new AffinityFuser().fuse(forward, forward);
    }

}
