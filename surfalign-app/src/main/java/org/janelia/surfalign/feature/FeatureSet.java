package org.janelia.surfalign.feature;

import java.io.Reader;
import java.io.Serializable;
import java.util.Arrays;

import org.janelia.surfalign.json.JsonUtils;

/**
 * Ordered set of fixed length feature vectors, one per sampled surface element.
 * By convention each feature holds a 3-D position (components 0 to 2)
 * followed by a 3-D unit normal (components 3 to 5).
 *
 * The element index is the join key with {@link FlagSet} values and affinity matrix rows/columns,
 * so the order of features must never change.
 */
public class FeatureSet
        implements Serializable {

    public static final int POSITION_OFFSET = 0;
    public static final int NORMAL_OFFSET = 3;
    public static final int POSITION_AND_NORMAL_DIMENSION = 6;

    /** Allowed deviation of a normal's length from 1. */
    public static final double UNIT_NORMAL_TOLERANCE = 1e-6;

    private final double[][] features;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FeatureSet() {
        this.features = null;
    }

    /**
     * @param  features  feature rows (not copied, the set takes ownership of the array).
     *
     * @throws IllegalArgumentException
     *   if the rows are ragged, too short to hold a position, or contain non-finite values.
     */
    public FeatureSet(final double[][] features)
            throws IllegalArgumentException {
        this.features = features;
        validate();
    }

    public static FeatureSet fromPositionsAndNormals(final double[][] positions,
                                                     final double[][] normals)
            throws IllegalArgumentException {

        if (positions.length != normals.length) {
            throw new IllegalArgumentException(positions.length + " positions but " + normals.length + " normals");
        }

        final double[][] features = new double[positions.length][POSITION_AND_NORMAL_DIMENSION];
        for (int i = 0; i < positions.length; i++) {
            if ((positions[i].length != 3) || (normals[i].length != 3)) {
                throw new IllegalArgumentException("position and normal for element " + i + " must be 3-D");
            }
            System.arraycopy(positions[i], 0, features[i], POSITION_OFFSET, 3);
            System.arraycopy(normals[i], 0, features[i], NORMAL_OFFSET, 3);
        }

        return new FeatureSet(features);
    }

    public int size() {
        return features.length;
    }

    /**
     * @return number of components in each feature (zero for an empty set).
     */
    public int getDimension() {
        return features.length == 0 ? 0 : features[0].length;
    }

    public boolean hasNormals() {
        return getDimension() >= POSITION_AND_NORMAL_DIMENSION;
    }

    /**
     * @return the feature for the specified element (the internal row, not a copy).
     */
    public double[] get(final int index) {
        return features[index];
    }

    public double[] getPosition(final int index) {
        return Arrays.copyOfRange(features[index], POSITION_OFFSET, POSITION_OFFSET + 3);
    }

    public void setPosition(final int index,
                            final double[] position) {
        System.arraycopy(position, 0, features[index], POSITION_OFFSET, 3);
    }

    public double[] getNormal(final int index) {
        checkNormals();
        return Arrays.copyOfRange(features[index], NORMAL_OFFSET, NORMAL_OFFSET + 3);
    }

    public void setNormal(final int index,
                          final double[] normal) {
        checkNormals();
        System.arraycopy(normal, 0, features[index], NORMAL_OFFSET, 3);
    }

    /**
     * @return copy of all element positions as an N x 3 array.
     */
    public double[][] getPositions() {
        final double[][] positions = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            positions[i] = getPosition(i);
        }
        return positions;
    }

    public void setPositions(final double[][] positions)
            throws IllegalArgumentException {
        if (positions.length != features.length) {
            throw new IllegalArgumentException("expected " + features.length + " positions but received " +
                                               positions.length);
        }
        for (int i = 0; i < positions.length; i++) {
            setPosition(i, positions[i]);
        }
    }

    /**
     * @return Euclidean distance between the full feature vectors of the specified elements.
     */
    public static double distance(final double[] a,
                                  final double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            final double delta = a[d] - b[d];
            sum += delta * delta;
        }
        return Math.sqrt(sum);
    }

    /**
     * @return deep copy of the feature rows.
     */
    public double[][] toArray() {
        final double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        return copy;
    }

    public FeatureSet copy() {
        return new FeatureSet(toArray());
    }

    /**
     * @throws IllegalArgumentException
     *   if this set is invalid.
     */
    public void validate()
            throws IllegalArgumentException {

        if (features == null) {
            throw new IllegalArgumentException("features must be specified");
        }

        final int dimension = getDimension();
        if ((features.length > 0) && (dimension < 3)) {
            throw new IllegalArgumentException("features must have at least 3 (position) components");
        }

        for (int i = 0; i < features.length; i++) {
            if (features[i].length != dimension) {
                throw new IllegalArgumentException("feature " + i + " has " + features[i].length +
                                                   " components instead of " + dimension);
            }
            for (final double value : features[i]) {
                if (! Double.isFinite(value)) {
                    throw new IllegalArgumentException("feature " + i + " contains non-finite value " + value);
                }
            }
        }
    }

    /**
     * @throws IllegalArgumentException
     *   if this set has normals and any normal length differs from 1 by more than {@link #UNIT_NORMAL_TOLERANCE}.
     */
    public void validateUnitNormals()
            throws IllegalArgumentException {

        if (! hasNormals()) {
            return;
        }

        for (int i = 0; i < features.length; i++) {
            double squaredLength = 0.0;
            for (int d = NORMAL_OFFSET; d < NORMAL_OFFSET + 3; d++) {
                squaredLength += features[i][d] * features[i][d];
            }
            final double length = Math.sqrt(squaredLength);
            if (Math.abs(length - 1.0) > UNIT_NORMAL_TOLERANCE) {
                throw new IllegalArgumentException("normal for element " + i + " has length " + length +
                                                   " instead of 1");
            }
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static FeatureSet fromJson(final String json) {
        final FeatureSet featureSet = JSON_HELPER.fromJson(json);
        featureSet.validate();
        return featureSet;
    }

    public static FeatureSet fromJson(final Reader json) {
        final FeatureSet featureSet = JSON_HELPER.fromJson(json);
        featureSet.validate();
        return featureSet;
    }

    @Override
    public String toString() {
        return "{ size: " + size() + ", dimension: " + getDimension() + " }";
    }

    private void checkNormals() {
        if (! hasNormals()) {
            throw new IllegalArgumentException("features with " + getDimension() + " components do not have normals");
        }
    }

    private static final JsonUtils.Helper<FeatureSet> JSON_HELPER =
            new JsonUtils.Helper<>(FeatureSet.class);

}
