package org.janelia.surfalign.match;

import java.util.Arrays;
import java.util.Comparator;

import org.janelia.surfalign.feature.FeatureSet;

/**
 * Exhaustive nearest neighbor search used to verify tree based searches in tests.
 */
public class BruteForceNearestNeighborSearch
        implements NearestNeighborSearch {

    @Override
    public NearestNeighbors findNearestNeighbors(final FeatureSet querySet,
                                                 final FeatureSet referenceSet,
                                                 final int k)
            throws IllegalArgumentException {

        KDTreeNearestNeighborSearch.validateQuery(querySet, referenceSet, k);

        final double[][] distances = new double[querySet.size()][k];
        final int[][] indices = new int[querySet.size()][k];

        for (int i = 0; i < querySet.size(); i++) {
            final double[] query = querySet.get(i);
            final Integer[] order = new Integer[referenceSet.size()];
            final double[] referenceDistances = new double[referenceSet.size()];
            for (int j = 0; j < order.length; j++) {
                order[j] = j;
                referenceDistances[j] = FeatureSet.distance(query, referenceSet.get(j));
            }
            Arrays.sort(order, Comparator.comparingDouble(j -> referenceDistances[j]));
            for (int n = 0; n < k; n++) {
                indices[i][n] = order[n];
                distances[i][n] = referenceDistances[order[n]];
            }
        }

        return new NearestNeighbors(k, distances, indices);
    }

}
