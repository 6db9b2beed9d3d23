package org.janelia.surfalign.match;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.surfalign.feature.FeatureSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.KNearestNeighborSearchOnKDTree;

/**
 * Nearest neighbor search over the full feature space backed by an ImgLib2 {@link KDTree}.
 *
 * The tree is built once per query and shared read-only across threads,
 * each thread uses its own {@link KNearestNeighborSearchOnKDTree} instance.
 */
public class KDTreeNearestNeighborSearch
        implements NearestNeighborSearch {

    private final int numberOfThreads;

    public KDTreeNearestNeighborSearch() {
        this(1);
    }

    public KDTreeNearestNeighborSearch(final int numberOfThreads) {
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be positive");
        }
        this.numberOfThreads = numberOfThreads;
    }

    @Override
    public NearestNeighbors findNearestNeighbors(final FeatureSet querySet,
                                                 final FeatureSet referenceSet,
                                                 final int k)
            throws IllegalArgumentException {

        validateQuery(querySet, referenceSet, k);

        final List<Integer> referenceIndices = new ArrayList<>(referenceSet.size());
        final List<RealPoint> referencePoints = new ArrayList<>(referenceSet.size());
        for (int i = 0; i < referenceSet.size(); i++) {
            referenceIndices.add(i);
            referencePoints.add(new RealPoint(referenceSet.get(i)));
        }

        final KDTree<Integer> tree = new KDTree<>(referenceIndices, referencePoints);

        final int querySize = querySet.size();
        final double[][] distances = new double[querySize][k];
        final int[][] indices = new int[querySize][k];

        if ((numberOfThreads == 1) || (querySize < numberOfThreads)) {
            searchRange(tree, querySet, k, 0, querySize, distances, indices);
        } else {
            searchInParallel(tree, querySet, k, distances, indices);
        }

        LOG.debug("findNearestNeighbors: found {} neighbors for {} query elements in {} reference elements",
                  k, querySize, referenceSet.size());

        return new NearestNeighbors(k, distances, indices);
    }

    static void validateQuery(final FeatureSet querySet,
                              final FeatureSet referenceSet,
                              final int k)
            throws IllegalArgumentException {

        if ((k < 1) || (k > referenceSet.size())) {
            throw new IllegalArgumentException("k (" + k + ") must be between 1 and the reference set size (" +
                                               referenceSet.size() + ")");
        }

        if ((querySet.size() > 0) && (querySet.getDimension() != referenceSet.getDimension())) {
            throw new IllegalArgumentException("query features have " + querySet.getDimension() +
                                               " components but reference features have " +
                                               referenceSet.getDimension());
        }
    }

    private void searchInParallel(final KDTree<Integer> tree,
                                  final FeatureSet querySet,
                                  final int k,
                                  final double[][] distances,
                                  final int[][] indices) {

        final int querySize = querySet.size();
        final int rowsPerTask = (querySize + numberOfThreads - 1) / numberOfThreads;

        final List<Callable<Void>> tasks = new ArrayList<>();
        for (int start = 0; start < querySize; start += rowsPerTask) {
            final int taskStart = start;
            final int taskStop = Math.min(start + rowsPerTask, querySize);
            tasks.add(() -> {
                searchRange(tree, querySet, k, taskStart, taskStop, distances, indices);
                return null;
            });
        }

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {
            for (final Future<Void> future : executorService.invokeAll(tasks)) {
                future.get();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while searching for nearest neighbors", e);
        } catch (final ExecutionException e) {
            throw new IllegalStateException("failed to search for nearest neighbors", e.getCause());
        } finally {
            executorService.shutdown();
        }
    }

    private static void searchRange(final KDTree<Integer> tree,
                                    final FeatureSet querySet,
                                    final int k,
                                    final int start,
                                    final int stop,
                                    final double[][] distances,
                                    final int[][] indices) {

        final KNearestNeighborSearchOnKDTree<Integer> search = new KNearestNeighborSearchOnKDTree<>(tree, k);
        final RealPoint queryPoint = new RealPoint(querySet.getDimension());

        for (int i = start; i < stop; i++) {
            queryPoint.setPosition(querySet.get(i));
            search.search(queryPoint);
            for (int n = 0; n < k; n++) {
                distances[i][n] = search.getDistance(n);
                indices[i][n] = search.getSampler(n).get();
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(KDTreeNearestNeighborSearch.class);
}
