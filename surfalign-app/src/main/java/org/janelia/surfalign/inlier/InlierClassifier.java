package org.janelia.surfalign.inlier;

import org.janelia.surfalign.DegenerateStateException;
import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns each element the probability that its correspondence reflects true surface overlap.
 *
 * Three sequential passes update the caller's probability array in place:
 * <ol>
 *     <li>
 *         flag gate: elements whose corresponding flag is invalid are forced to zero
 *         and stay at zero regardless of the later passes,
 *     </li>
 *     <li>
 *         distance mixture: residual distances are treated as drawn from a zero mean Gaussian (inliers)
 *         plus a constant outlier density equal to the Gaussian density at kappa standard deviations;
 *         the Gaussian standard deviation is re-estimated once from the current probabilities,
 *     </li>
 *     <li>
 *         orientation gate (optional): probabilities are scaled by the agreement between the element normal
 *         and the corresponding normal, rescaled from [-1, 1] to [0, 1].
 *     </li>
 * </ol>
 */
public class InlierClassifier {

    public static final double DEFAULT_KAPPA = 3.0;

    private static final double SQRT_TWO_PI = Math.sqrt(2.0 * Math.PI);

    private final double kappa;
    private final boolean useOrientation;

    public InlierClassifier() {
        this(DEFAULT_KAPPA, true);
    }

    /**
     * @param  kappa           number of standard deviations that separates inliers from outliers.
     * @param  useOrientation  indicates whether normal agreement should scale the probabilities.
     *
     * @throws IllegalArgumentException
     *   if kappa is not a positive finite number.
     */
    public InlierClassifier(final double kappa,
                            final boolean useOrientation)
            throws IllegalArgumentException {

        if (! (Double.isFinite(kappa) && (kappa > 0.0))) {
            throw new IllegalArgumentException("kappa must be a positive number");
        }

        this.kappa = kappa;
        this.useOrientation = useOrientation;
    }

    public double getKappa() {
        return kappa;
    }

    public boolean isUseOrientation() {
        return useOrientation;
    }

    /**
     * Updates the specified inlier probabilities in place.
     *
     * @param  features               features of the classified elements.
     * @param  correspondingFeatures  features corresponding to each classified element.
     * @param  correspondingFlags     binarized flags corresponding to each classified element.
     * @param  inlierProbability      current probabilities (used as weights for the noise estimate)
     *                                that are replaced with the updated probabilities.
     *
     * @return the updated inlierProbability array.
     *
     * @throws IllegalArgumentException
     *   if the inputs have inconsistent sizes or normals are needed but missing.
     *
     * @throws DegenerateStateException
     *   if every element has a zero probability (so the noise level is undefined)
     *   or the mixture model produces a non-finite result.
     */
    public double[] classify(final FeatureSet features,
                             final FeatureSet correspondingFeatures,
                             final FlagSet correspondingFlags,
                             final double[] inlierProbability)
            throws IllegalArgumentException, DegenerateStateException {

        validate(features, correspondingFeatures, correspondingFlags, inlierProbability);

        final int size = features.size();

        final boolean[] gated = new boolean[size];
        int gatedCount = 0;
        for (int i = 0; i < size; i++) {
            if (correspondingFlags.get(i) < 0.5) {
                inlierProbability[i] = 0.0;
                gated[i] = true;
                gatedCount++;
            }
        }

        final double[] distances = new double[size];
        for (int i = 0; i < size; i++) {
            distances[i] = FeatureSet.distance(correspondingFeatures.get(i), features.get(i));
        }

        final double sigma = estimateSigma(distances, inlierProbability);

        for (int i = 0; i < size; i++) {
            inlierProbability[i] = gated[i] ? 0.0 : getMixtureProbability(distances[i], sigma);
        }

        if (useOrientation) {
            for (int i = 0; i < size; i++) {
                inlierProbability[i] *= getOrientationAgreement(features.get(i), correspondingFeatures.get(i));
            }
        }

        for (int i = 0; i < size; i++) {
            if (! Double.isFinite(inlierProbability[i])) {
                throw new DegenerateStateException("inlier probability for element " + i + " is " +
                                                   inlierProbability[i]);
            }
        }

        LOG.debug("classify: sigma is {}, {} of {} elements gated by flags", sigma, gatedCount, size);

        return inlierProbability;
    }

    /**
     * @return inlier probability weighted root mean square of the specified distances.
     *
     * @throws DegenerateStateException
     *   if the probabilities sum to zero.
     */
    static double estimateSigma(final double[] distances,
                                final double[] inlierProbability)
            throws DegenerateStateException {

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < distances.length; i++) {
            numerator += inlierProbability[i] * distances[i] * distances[i];
            denominator += inlierProbability[i];
        }

        if (! (denominator > 0.0)) {
            throw new DegenerateStateException("cannot estimate noise level because all " + distances.length +
                                               " inlier probabilities are zero");
        }

        final double sigma = Math.sqrt(numerator / denominator);
        if (! Double.isFinite(sigma)) {
            throw new DegenerateStateException("noise level estimate is " + sigma);
        }

        return sigma;
    }

    /**
     * @return responsibility of the Gaussian inlier component for the specified residual distance.
     */
    double getMixtureProbability(final double distance,
                                 final double sigma) {

        final double probability;
        if (sigma > 0.0) {
            final double normalization = 1.0 / (sigma * SQRT_TWO_PI);
            final double outlierDensity = normalization * Math.exp(-0.5 * kappa * kappa);
            final double scaledDistance = distance / sigma;
            final double inlierDensity = normalization * Math.exp(-0.5 * scaledDistance * scaledDistance);
            probability = inlierDensity / (inlierDensity + outlierDensity);
        } else {
            // limit for sigma -> 0: only exact matches keep a (kappa dependent) probability
            probability = distance == 0.0 ? 1.0 / (1.0 + Math.exp(-0.5 * kappa * kappa)) : 0.0;
        }

        return probability;
    }

    /**
     * @return dot product of the normals clamped to [-1, 1] and rescaled to [0, 1].
     */
    static double getOrientationAgreement(final double[] feature,
                                          final double[] correspondingFeature) {
        double dotProduct = 0.0;
        for (int d = FeatureSet.NORMAL_OFFSET; d < FeatureSet.NORMAL_OFFSET + 3; d++) {
            dotProduct += feature[d] * correspondingFeature[d];
        }
        // unit normals can still produce a dot product slightly outside [-1, 1] after rounding
        dotProduct = Math.max(-1.0, Math.min(1.0, dotProduct));
        return dotProduct / 2.0 + 0.5;
    }

    private void validate(final FeatureSet features,
                          final FeatureSet correspondingFeatures,
                          final FlagSet correspondingFlags,
                          final double[] inlierProbability)
            throws IllegalArgumentException {

        final int size = features.size();
        if ((correspondingFeatures.size() != size) ||
            (correspondingFlags.size() != size) ||
            (inlierProbability.length != size)) {
            throw new IllegalArgumentException(
                    "sizes differ: " + size + " features, " + correspondingFeatures.size() +
                    " corresponding features, " + correspondingFlags.size() + " corresponding flags, " +
                    inlierProbability.length + " inlier probabilities");
        }

        if ((size > 0) && (features.getDimension() != correspondingFeatures.getDimension())) {
            throw new IllegalArgumentException("features have " + features.getDimension() +
                                               " components but corresponding features have " +
                                               correspondingFeatures.getDimension());
        }

        if (useOrientation && (size > 0) && (! features.hasNormals())) {
            throw new IllegalArgumentException("orientation based classification requires features with normals");
        }

        for (int i = 0; i < size; i++) {
            if (! ((inlierProbability[i] >= 0.0) && (inlierProbability[i] <= 1.0))) {
                throw new IllegalArgumentException("inlier probability " + i + " has value " +
                                                   inlierProbability[i] + " outside [0, 1]");
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(InlierClassifier.class);
}
