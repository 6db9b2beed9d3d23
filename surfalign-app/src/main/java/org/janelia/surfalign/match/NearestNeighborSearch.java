package org.janelia.surfalign.match;

import org.janelia.surfalign.feature.FeatureSet;

/**
 * Oracle that finds, for each element of a query set, the k nearest elements of a reference set.
 */
public interface NearestNeighborSearch {

    /**
     * @param  querySet      elements to find neighbors for.
     * @param  referenceSet  elements that are candidate neighbors.
     * @param  k             number of neighbors to find for each query element.
     *
     * @return Euclidean distances and reference indices of the k nearest neighbors of each query element.
     *
     * @throws IllegalArgumentException
     *   if k is not in [1, referenceSet.size()] or the feature dimensions differ.
     */
    NearestNeighbors findNearestNeighbors(FeatureSet querySet,
                                          FeatureSet referenceSet,
                                          int k)
            throws IllegalArgumentException;

}
