package org.janelia.surfalign.transform;

import org.janelia.surfalign.DegenerateStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import Jama.EigenvalueDecomposition;
import Jama.Matrix;

/**
 * Weighted Procrustes estimator for the similarity transform (rotation, optional isotropic scale, translation)
 * that minimizes sum( w_i * || s R x_i + t - y_i ||^2 ).
 *
 * The rotation is derived with the closed form quaternion method of
 * <a href="https://doi.org/10.1364/JOSAA.4.000629">
 *     Horn, "Closed-form solution of absolute orientation using unit quaternions", JOSA A 4(4), 1987
 * </a>: the optimal unit quaternion is the eigenvector of a symmetric 4x4 matrix built from the weighted
 * cross-covariance of the two point sets.
 */
public class RigidTransformEstimator {

    /** Relative tolerance for treating two eigenvalue magnitudes as equal. */
    public static final double EIGENVALUE_TIE_TOLERANCE = 1e-9;

    /** Relative tolerance for treating the weighted floating points as collinear. */
    public static final double COLLINEAR_TOLERANCE = 1e-12;

    private final boolean adjustScale;

    public RigidTransformEstimator() {
        this(false);
    }

    /**
     * @param  adjustScale  indicates whether an isotropic scale should be estimated (otherwise scale is exactly 1).
     */
    public RigidTransformEstimator(final boolean adjustScale) {
        this.adjustScale = adjustScale;
    }

    public boolean isAdjustScale() {
        return adjustScale;
    }

    /**
     * Estimates the transform from floating to corresponding positions, applies it to the
     * floating positions in place, and returns it.
     *
     * @param  floatingPositions       N x 3 positions that are transformed in place.
     * @param  floatingWeights         non-negative weight for each correspondence.
     * @param  correspondingPositions  N x 3 positions the floating positions should move onto.
     *
     * @return the applied transform.
     *
     * @throws IllegalArgumentException
     *   if the arrays have inconsistent sizes or the weights are invalid.
     *
     * @throws DegenerateStateException
     *   if the weights sum to zero, fewer than 3 non-collinear points are weighted,
     *   or the dominant eigenvalue is ambiguous.
     */
    public SimilarityTransform estimateAndApply(final double[][] floatingPositions,
                                                final double[] floatingWeights,
                                                final double[][] correspondingPositions)
            throws IllegalArgumentException, DegenerateStateException {

        final SimilarityTransform transform = estimate(floatingPositions, floatingWeights, correspondingPositions);
        transform.applyToPositions(floatingPositions);
        return transform;
    }

    /**
     * Same as {@link #estimateAndApply} but leaves the floating positions unchanged.
     */
    public SimilarityTransform estimate(final double[][] floatingPositions,
                                        final double[] floatingWeights,
                                        final double[][] correspondingPositions)
            throws IllegalArgumentException, DegenerateStateException {

        validate(floatingPositions, floatingWeights, correspondingPositions);

        final int size = floatingPositions.length;

        double weightSum = 0.0;
        int weightedCount = 0;
        final double[] floatingCentroid = new double[3];
        final double[] correspondingCentroid = new double[3];
        for (int i = 0; i < size; i++) {
            final double w = floatingWeights[i];
            if (w > 0.0) {
                weightedCount++;
            }
            weightSum += w;
            for (int d = 0; d < 3; d++) {
                floatingCentroid[d] += w * floatingPositions[i][d];
                correspondingCentroid[d] += w * correspondingPositions[i][d];
            }
        }

        if (! (weightSum > 0.0)) {
            throw new DegenerateStateException("cannot estimate transform because all " + size + " weights are zero");
        }

        if (weightedCount < 3) {
            throw new DegenerateStateException("cannot estimate transform from " + weightedCount +
                                               " weighted points, at least 3 are required");
        }

        for (int d = 0; d < 3; d++) {
            floatingCentroid[d] /= weightSum;
            correspondingCentroid[d] /= weightSum;
        }

        checkCollinearity(floatingPositions, floatingWeights, weightSum, floatingCentroid);

        // weighted cross-covariance of floating and corresponding positions
        final double[][] c = new double[3][3];
        for (int i = 0; i < size; i++) {
            final double w = floatingWeights[i];
            for (int row = 0; row < 3; row++) {
                for (int column = 0; column < 3; column++) {
                    c[row][column] += w * floatingPositions[i][row] * correspondingPositions[i][column];
                }
            }
        }
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                c[row][column] = c[row][column] / weightSum - floatingCentroid[row] * correspondingCentroid[column];
            }
        }

        final double[] quaternion = getDominantEigenvector(buildQuaternionMatrix(c));
        final double[][] rotation = toRotationMatrix(quaternion);

        final double scale = adjustScale ?
                             estimateScale(floatingPositions, floatingWeights, correspondingPositions,
                                           floatingCentroid, correspondingCentroid, rotation) :
                             1.0;

        final double[] translation = new double[3];
        for (int row = 0; row < 3; row++) {
            translation[row] = correspondingCentroid[row] - scale * (rotation[row][0] * floatingCentroid[0] +
                                                                     rotation[row][1] * floatingCentroid[1] +
                                                                     rotation[row][2] * floatingCentroid[2]);
        }

        final SimilarityTransform transform = new SimilarityTransform(scale, rotation, translation);

        LOG.debug("estimate: derived {} from {} weighted points", transform, weightedCount);

        return transform;
    }

    /**
     * @return symmetric 4x4 matrix whose dominant eigenvector is the optimal rotation quaternion
     *         for the specified cross-covariance matrix.
     */
    static double[][] buildQuaternionMatrix(final double[][] c) {

        final double trace = c[0][0] + c[1][1] + c[2][2];
        final double[] delta = {
                c[1][2] - c[2][1],
                c[2][0] - c[0][2],
                c[0][1] - c[1][0]
        };

        final double[][] q = new double[4][4];
        q[0][0] = trace;
        for (int row = 0; row < 3; row++) {
            q[0][row + 1] = delta[row];
            q[row + 1][0] = delta[row];
            for (int column = 0; column < 3; column++) {
                q[row + 1][column + 1] = c[row][column] + c[column][row];
            }
            q[row + 1][row + 1] -= trace;
        }

        return q;
    }

    /**
     * @return unit eigenvector for the eigenvalue with the largest magnitude.
     *
     * @throws DegenerateStateException
     *   if the largest magnitude is shared by two eigenvalues of the same sign.
     */
    static double[] getDominantEigenvector(final double[][] q)
            throws DegenerateStateException {

        final EigenvalueDecomposition decomposition = new EigenvalueDecomposition(new Matrix(q));
        final double[] eigenvalues = decomposition.getRealEigenvalues();
        final int dominantIndex = selectDominantEigenvalue(eigenvalues);
        final Matrix eigenvectors = decomposition.getV();

        final double[] eigenvector = new double[eigenvalues.length];
        double squaredLength = 0.0;
        for (int row = 0; row < eigenvector.length; row++) {
            eigenvector[row] = eigenvectors.get(row, dominantIndex);
            squaredLength += eigenvector[row] * eigenvector[row];
        }

        final double length = Math.sqrt(squaredLength);
        if (! (length > 0.0) || ! Double.isFinite(length)) {
            throw new DegenerateStateException("dominant eigenvector has length " + length);
        }
        for (int row = 0; row < eigenvector.length; row++) {
            eigenvector[row] /= length;
        }

        return eigenvector;
    }

    /**
     * Scans the eigenvalues in the eigensolver's order and keeps the first one with a strictly greater magnitude.
     * Magnitudes that differ by no more than {@link #EIGENVALUE_TIE_TOLERANCE} (relative to the largest magnitude)
     * are equal.  An equal magnitude pair with opposite signs (which is what coplanar point sets produce,
     * the negative eigenvalue encoding a reflection) is resolved in favor of the positive eigenvalue.
     *
     * @return index of the dominant eigenvalue.
     *
     * @throws DegenerateStateException
     *   if the eigenvalues are not finite, all zero, or the dominant magnitude is shared by
     *   two eigenvalues of the same sign.
     */
    static int selectDominantEigenvalue(final double[] eigenvalues)
            throws DegenerateStateException {

        double maxMagnitude = 0.0;
        for (final double eigenvalue : eigenvalues) {
            if (! Double.isFinite(eigenvalue)) {
                throw new DegenerateStateException("eigenvalue " + eigenvalue + " is not finite");
            }
            maxMagnitude = Math.max(maxMagnitude, Math.abs(eigenvalue));
        }

        if (maxMagnitude == 0.0) {
            throw new DegenerateStateException("all eigenvalues are zero");
        }

        final double tolerance = EIGENVALUE_TIE_TOLERANCE * maxMagnitude;

        int dominantIndex = 0;
        for (int i = 1; i < eigenvalues.length; i++) {
            final double difference = Math.abs(eigenvalues[i]) - Math.abs(eigenvalues[dominantIndex]);
            if (difference > tolerance) {
                dominantIndex = i;
            } else if ((Math.abs(difference) <= tolerance) &&
                       (eigenvalues[i] > 0.0) && (eigenvalues[dominantIndex] < 0.0)) {
                dominantIndex = i;
            }
        }

        for (int i = 0; i < eigenvalues.length; i++) {
            if ((i != dominantIndex) &&
                (Math.abs(Math.abs(eigenvalues[i]) - Math.abs(eigenvalues[dominantIndex])) <= tolerance) &&
                (Math.signum(eigenvalues[i]) == Math.signum(eigenvalues[dominantIndex]))) {
                throw new DegenerateStateException("dominant eigenvalue " + eigenvalues[dominantIndex] +
                                                   " is not unique, rotation is ill-conditioned");
            }
        }

        return dominantIndex;
    }

    /**
     * @param  q  unit quaternion (w, x, y, z).
     *
     * @return corresponding 3x3 rotation matrix.
     */
    static double[][] toRotationMatrix(final double[] q) {

        final double w = q[0];
        final double x = q[1];
        final double y = q[2];
        final double z = q[3];

        final double[][] r = new double[3][3];

        r[0][0] = w * w + x * x - y * y - z * z;
        r[1][1] = w * w + y * y - x * x - z * z;
        r[2][2] = w * w + z * z - x * x - y * y;

        r[1][0] = 2.0 * (x * y + w * z);
        r[0][1] = 2.0 * (x * y - w * z);
        r[2][0] = 2.0 * (x * z - w * y);
        r[0][2] = 2.0 * (x * z + w * y);
        r[2][1] = 2.0 * (y * z + w * x);
        r[1][2] = 2.0 * (y * z - w * x);

        return r;
    }

    private static double estimateScale(final double[][] floatingPositions,
                                        final double[] floatingWeights,
                                        final double[][] correspondingPositions,
                                        final double[] floatingCentroid,
                                        final double[] correspondingCentroid,
                                        final double[][] rotation)
            throws DegenerateStateException {

        double numerator = 0.0;
        double denominator = 0.0;
        final double[] centered = new double[3];
        final double[] rotated = new double[3];

        for (int i = 0; i < floatingPositions.length; i++) {
            for (int d = 0; d < 3; d++) {
                centered[d] = floatingPositions[i][d] - floatingCentroid[d];
            }
            for (int row = 0; row < 3; row++) {
                rotated[row] = rotation[row][0] * centered[0] +
                               rotation[row][1] * centered[1] +
                               rotation[row][2] * centered[2];
            }
            for (int d = 0; d < 3; d++) {
                numerator += floatingWeights[i] * (correspondingPositions[i][d] - correspondingCentroid[d]) *
                             rotated[d];
                denominator += floatingWeights[i] * rotated[d] * rotated[d];
            }
        }

        final double scale = numerator / denominator;
        if (! (Double.isFinite(scale) && (scale > 0.0))) {
            throw new DegenerateStateException("estimated scale " + scale + " is not a positive number");
        }

        return scale;
    }

    private static void checkCollinearity(final double[][] floatingPositions,
                                          final double[] floatingWeights,
                                          final double weightSum,
                                          final double[] floatingCentroid)
            throws DegenerateStateException {

        // upper triangle only, mirrored below so that the symmetric eigensolver is used
        final double[][] covariance = new double[3][3];
        for (int i = 0; i < floatingPositions.length; i++) {
            for (int row = 0; row < 3; row++) {
                final double rowDelta = floatingPositions[i][row] - floatingCentroid[row];
                for (int column = row; column < 3; column++) {
                    covariance[row][column] += floatingWeights[i] * rowDelta *
                                               (floatingPositions[i][column] - floatingCentroid[column]);
                }
            }
        }
        for (int row = 0; row < 3; row++) {
            for (int column = row; column < 3; column++) {
                covariance[row][column] /= weightSum;
                covariance[column][row] = covariance[row][column];
            }
        }

        // eigenvalues of a symmetric matrix are returned in ascending order
        final double[] spread = new EigenvalueDecomposition(new Matrix(covariance)).getRealEigenvalues();
        if (! (spread[2] > 0.0) || (spread[1] <= COLLINEAR_TOLERANCE * spread[2])) {
            throw new DegenerateStateException("weighted floating points are collinear or coincident");
        }
    }

    private static void validate(final double[][] floatingPositions,
                                 final double[] floatingWeights,
                                 final double[][] correspondingPositions)
            throws IllegalArgumentException {

        final int size = floatingPositions.length;
        if ((floatingWeights.length != size) || (correspondingPositions.length != size)) {
            throw new IllegalArgumentException("sizes differ: " + size + " floating positions, " +
                                               floatingWeights.length + " weights, " +
                                               correspondingPositions.length + " corresponding positions");
        }

        for (int i = 0; i < size; i++) {
            if ((floatingPositions[i].length < 3) || (correspondingPositions[i].length < 3)) {
                throw new IllegalArgumentException("position " + i + " is not 3-D");
            }
            if (! (Double.isFinite(floatingWeights[i]) && (floatingWeights[i] >= 0.0))) {
                throw new IllegalArgumentException("weight " + i + " has invalid value " + floatingWeights[i]);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RigidTransformEstimator.class);
}
