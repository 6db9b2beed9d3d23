package org.janelia.surfalign.match;

import java.io.Serializable;

/**
 * Result of a k nearest neighbor query: for each query element, the indices of its k nearest
 * reference elements and the Euclidean distances to them, ordered from nearest to farthest.
 * The constructor copies the specified rows so instances are immutable.
 */
public class NearestNeighbors
        implements Serializable {

    private final int k;
    private final double[][] distances;
    private final int[][] indices;

    public NearestNeighbors(final int k,
                            final double[][] distances,
                            final int[][] indices)
            throws IllegalArgumentException {

        if (distances.length != indices.length) {
            throw new IllegalArgumentException("found " + distances.length + " distance rows but " +
                                               indices.length + " index rows");
        }

        for (int i = 0; i < distances.length; i++) {
            if ((distances[i].length != k) || (indices[i].length != k)) {
                throw new IllegalArgumentException("row " + i + " does not contain " + k + " neighbors");
            }
        }

        this.k = k;
        this.distances = new double[distances.length][];
        this.indices = new int[indices.length][];
        for (int i = 0; i < distances.length; i++) {
            this.distances[i] = distances[i].clone();
            this.indices[i] = indices[i].clone();
        }
    }

    public int getK() {
        return k;
    }

    public int size() {
        return distances.length;
    }

    public double getDistance(final int queryIndex,
                              final int neighborRank) {
        return distances[queryIndex][neighborRank];
    }

    public int getIndex(final int queryIndex,
                        final int neighborRank) {
        return indices[queryIndex][neighborRank];
    }

}
