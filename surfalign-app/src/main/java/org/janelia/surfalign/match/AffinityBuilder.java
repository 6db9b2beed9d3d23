package org.janelia.surfalign.match;

import java.util.Arrays;

import org.janelia.surfalign.feature.FeatureSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts k nearest neighbor distances between two feature sets into a row stochastic
 * soft correspondence {@link AffinityMatrix}.
 *
 * Each of the k neighbors of a source element receives the weight 1/d<sup>2</sup> before the row is normalized.
 * Distances are clamped to {@link #DISTANCE_FLOOR} and weights to {@link #WEIGHT_FLOOR} so that
 * coincident or very distant elements produce extreme but finite affinities.
 */
public class AffinityBuilder {

    public static final double DISTANCE_FLOOR = 0.001;
    public static final double WEIGHT_FLOOR = 0.0001;

    private final NearestNeighborSearch nearestNeighborSearch;

    public AffinityBuilder() {
        this(new KDTreeNearestNeighborSearch());
    }

    public AffinityBuilder(final NearestNeighborSearch nearestNeighborSearch) {
        this.nearestNeighborSearch = nearestNeighborSearch;
    }

    /**
     * @param  sourceFeatures  features of the elements that become matrix rows.
     * @param  targetFeatures  features of the elements that become matrix columns.
     * @param  k               number of nearest target neighbors linked to each source element.
     *
     * @return (sourceFeatures.size() x targetFeatures.size()) row stochastic affinity matrix.
     *
     * @throws IllegalArgumentException
     *   if k is not in [1, targetFeatures.size()] or the feature dimensions differ.
     */
    public AffinityMatrix buildAffinity(final FeatureSet sourceFeatures,
                                        final FeatureSet targetFeatures,
                                        final int k)
            throws IllegalArgumentException {

        KDTreeNearestNeighborSearch.validateQuery(sourceFeatures, targetFeatures, k);

        final NearestNeighbors neighbors =
                nearestNeighborSearch.findNearestNeighbors(sourceFeatures, targetFeatures, k);

        if (neighbors.size() != sourceFeatures.size()) {
            throw new IllegalStateException("nearest neighbor search returned " + neighbors.size() +
                                            " rows for " + sourceFeatures.size() + " source elements");
        }

        final int numberOfRows = sourceFeatures.size();
        final int[][] rowColumns = new int[numberOfRows][];
        final double[][] rowValues = new double[numberOfRows][];

        for (int i = 0; i < numberOfRows; i++) {
            buildRow(neighbors, i, rowColumns, rowValues);
        }

        final AffinityMatrix affinity =
                new AffinityMatrix(numberOfRows, targetFeatures.size(), rowColumns, rowValues).normalizeRows();

        LOG.debug("buildAffinity: built {} affinity with k={}", affinity.getShape(), k);

        return affinity;
    }

    /**
     * @return un-normalized weight for a neighbor at the specified distance.
     */
    public static double getWeight(final double distance) {
        final double clampedDistance = Math.max(distance, DISTANCE_FLOOR);
        return Math.max(1.0 / (clampedDistance * clampedDistance), WEIGHT_FLOOR);
    }

    private static void buildRow(final NearestNeighbors neighbors,
                                 final int i,
                                 final int[][] rowColumns,
                                 final double[][] rowValues) {

        final int k = neighbors.getK();

        // sort neighbor ranks by target index so the row can be stored sparsely
        final long[] columnAndRank = new long[k];
        for (int n = 0; n < k; n++) {
            columnAndRank[n] = ((long) neighbors.getIndex(i, n) << 32) | n;
        }
        Arrays.sort(columnAndRank);

        final int[] columns = new int[k];
        final double[] values = new double[k];
        int count = 0;
        for (final long packed : columnAndRank) {
            final int column = (int) (packed >>> 32);
            final int rank = (int) (packed & 0xffffffffL);
            final double weight = getWeight(neighbors.getDistance(i, rank));
            if ((count > 0) && (columns[count - 1] == column)) {
                // the same target reported twice keeps the last weight
                values[count - 1] = weight;
            } else {
                columns[count] = column;
                values[count] = weight;
                count++;
            }
        }

        rowColumns[i] = Arrays.copyOf(columns, count);
        rowValues[i] = Arrays.copyOf(values, count);
    }

    private static final Logger LOG = LoggerFactory.getLogger(AffinityBuilder.class);
}
