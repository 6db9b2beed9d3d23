package org.janelia.surfalign.transform;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Reader;
import java.io.Serializable;

import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.json.JsonUtils;

import net.imglib2.realtransform.AffineTransform3D;

/**
 * Similarity transform x' = s R x + t backed by an ImgLib2 {@link AffineTransform3D}
 * whose linear part is s R and whose translation is t.
 * The isotropic scale s is kept separately so that rotation and scale can be reported individually.
 *
 * The JSON form holds the scale and the row packed 3x4 affine matrix.
 */
public class SimilarityTransform
        implements Serializable {

    private final double scale;
    private final double[] rowPackedMatrix;

    @JsonIgnore
    private transient AffineTransform3D affine;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SimilarityTransform() {
        this.scale = 1.0;
        this.rowPackedMatrix = null;
        this.affine = null;
    }

    /**
     * @param  scale        isotropic scale factor.
     * @param  rotation     3x3 rotation matrix.
     * @param  translation  translation vector.
     */
    public SimilarityTransform(final double scale,
                               final double[][] rotation,
                               final double[] translation) {
        this(scale, buildAffine(scale, rotation, translation));
    }

    private SimilarityTransform(final double scale,
                                final AffineTransform3D affine) {
        this.scale = scale;
        this.rowPackedMatrix = affine.getRowPackedCopy();
        this.affine = affine;
    }

    public static SimilarityTransform identity() {
        return new SimilarityTransform(1.0, new AffineTransform3D());
    }

    public double getScale() {
        return scale;
    }

    /**
     * @return copy of the 3x3 rotation block (the scale removed).
     */
    public double[][] getRotation() {
        final AffineTransform3D a = getAffine();
        final double[][] rotation = new double[3][3];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                rotation[row][column] = a.get(row, column) / scale;
            }
        }
        return rotation;
    }

    public double[] getTranslation() {
        final AffineTransform3D a = getAffine();
        return new double[] {a.get(0, 3), a.get(1, 3), a.get(2, 3)};
    }

    /**
     * @return 4x4 homogeneous matrix.
     */
    public double[][] getMatrix() {
        final AffineTransform3D a = getAffine();
        final double[][] matrix = new double[4][4];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 4; column++) {
                matrix[row][column] = a.get(row, column);
            }
        }
        matrix[3][3] = 1.0;
        return matrix;
    }

    /**
     * @return copy of the backing affine transform.
     */
    public AffineTransform3D getAffineTransform() {
        return getAffine().copy();
    }

    /**
     * Transforms the specified position in place.
     */
    public void applyInPlace(final double[] position) {
        final double[] transformed = new double[3];
        getAffine().apply(position, transformed);
        System.arraycopy(transformed, 0, position, 0, 3);
    }

    public double[] apply(final double[] position) {
        final double[] transformed = position.clone();
        applyInPlace(transformed);
        return transformed;
    }

    /**
     * Transforms each of the specified positions in place.
     */
    public void applyToPositions(final double[][] positions) {
        for (final double[] position : positions) {
            applyInPlace(position);
        }
    }

    /**
     * Transforms the positions of the specified features in place and, when the features have normals,
     * rotates (and renormalizes) the normals.  Scale and translation do not affect normals.
     */
    public void applyToFeatures(final FeatureSet features) {

        final boolean hasNormals = features.hasNormals();

        final AffineTransform3D linear = getAffine().copy();
        for (int row = 0; row < 3; row++) {
            linear.set(0.0, row, 3);
        }

        final double[] rotatedNormal = new double[3];

        for (int i = 0; i < features.size(); i++) {

            final double[] position = features.getPosition(i);
            applyInPlace(position);
            features.setPosition(i, position);

            if (hasNormals) {
                linear.apply(features.getNormal(i), rotatedNormal);
                final double length = Math.sqrt(rotatedNormal[0] * rotatedNormal[0] +
                                                rotatedNormal[1] * rotatedNormal[1] +
                                                rotatedNormal[2] * rotatedNormal[2]);
                if (length > 0.0) {
                    for (int d = 0; d < 3; d++) {
                        rotatedNormal[d] /= length;
                    }
                }
                features.setNormal(i, rotatedNormal);
            }
        }
    }

    /**
     * @return transform that applies this transform first and then the specified transform.
     */
    public SimilarityTransform preConcatenate(final SimilarityTransform after) {
        return new SimilarityTransform(after.scale * scale, getAffine().copy().preConcatenate(after.getAffine()));
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static SimilarityTransform fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static SimilarityTransform fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        final double[] m = getAffine().getRowPackedCopy();
        final StringBuilder sb = new StringBuilder("{ scale: ").append(scale).append(", matrix: [");
        for (int row = 0; row < 3; row++) {
            if (row > 0) {
                sb.append(", ");
            }
            sb.append('[');
            for (int column = 0; column < 4; column++) {
                if (column > 0) {
                    sb.append(", ");
                }
                sb.append(m[row * 4 + column]);
            }
            sb.append(']');
        }
        return sb.append("] }").toString();
    }

    private AffineTransform3D getAffine() {
        if (affine == null) {
            // deserialized instances only carry the row packed matrix
            final AffineTransform3D a = new AffineTransform3D();
            a.set(rowPackedMatrix);
            affine = a;
        }
        return affine;
    }

    private static AffineTransform3D buildAffine(final double scale,
                                                 final double[][] rotation,
                                                 final double[] translation) {
        final AffineTransform3D a = new AffineTransform3D();
        a.set(scale * rotation[0][0], scale * rotation[0][1], scale * rotation[0][2], translation[0],
              scale * rotation[1][0], scale * rotation[1][1], scale * rotation[1][2], translation[1],
              scale * rotation[2][0], scale * rotation[2][1], scale * rotation[2][2], translation[2]);
        return a;
    }

    private static final JsonUtils.Helper<SimilarityTransform> JSON_HELPER =
            new JsonUtils.Helper<>(SimilarityTransform.class);

}
