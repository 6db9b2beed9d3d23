package org.janelia.surfalign.registration;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.surfalign.DegenerateStateException;
import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.janelia.surfalign.inlier.InlierClassifier;
import org.janelia.surfalign.json.JsonUtils;
import org.janelia.surfalign.match.AffinityBuilder;
import org.janelia.surfalign.match.AffinityFuser;
import org.janelia.surfalign.match.AffinityMatrix;
import org.janelia.surfalign.match.CorrespondenceResolver;
import org.janelia.surfalign.match.Correspondences;
import org.janelia.surfalign.match.KDTreeNearestNeighborSearch;
import org.janelia.surfalign.match.NearestNeighborSearch;
import org.janelia.surfalign.parameters.RigidRegistrationParameters;
import org.janelia.surfalign.transform.RigidTransformEstimator;
import org.janelia.surfalign.transform.SimilarityTransform;
import org.janelia.surfalign.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Iteratively registers a floating feature set onto a target feature set.
 *
 * Each iteration derives (optionally symmetric) soft correspondences, updates the inlier probabilities,
 * and moves the floating features with the weighted similarity transform that best aligns them with their
 * correspondences.  The registration runs a fixed number of iterations and accumulates the applied transforms.
 */
public class RigidRegistration {

    /**
     * Outcome of a registration run.
     */
    public static class Result
            implements Serializable {

        private final SimilarityTransform transform;
        private final int iterations;
        private final double[] inlierProbability;

        @JsonIgnore
        private final transient FeatureSet registeredFeatures;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Result() {
            this(null, 0, null, null);
        }

        public Result(final SimilarityTransform transform,
                      final int iterations,
                      final double[] inlierProbability,
                      final FeatureSet registeredFeatures) {
            this.transform = transform;
            this.iterations = iterations;
            this.inlierProbability = inlierProbability;
            this.registeredFeatures = registeredFeatures;
        }

        /**
         * @return accumulated transform that maps the original floating positions onto the registered positions.
         */
        public SimilarityTransform getTransform() {
            return transform;
        }

        public int getIterations() {
            return iterations;
        }

        public double[] getInlierProbability() {
            return inlierProbability;
        }

        public double getMeanInlierProbability() {
            return inlierProbability.length == 0 ? 0.0 : Arrays.stream(inlierProbability).average().orElse(0.0);
        }

        /**
         * @return registered copy of the floating features (not serialized).
         */
        public FeatureSet getRegisteredFeatures() {
            return registeredFeatures;
        }

        public String toJson() {
            return JSON_HELPER.toJson(this);
        }

        public static Result fromJson(final String json) {
            return JSON_HELPER.fromJson(json);
        }

        private static final JsonUtils.Helper<Result> JSON_HELPER =
                new JsonUtils.Helper<>(Result.class);
    }

    private final RigidRegistrationParameters parameters;
    private final AffinityBuilder affinityBuilder;
    private final AffinityFuser affinityFuser;
    private final CorrespondenceResolver correspondenceResolver;
    private final InlierClassifier inlierClassifier;
    private final RigidTransformEstimator transformEstimator;

    public RigidRegistration(final RigidRegistrationParameters parameters)
            throws IllegalArgumentException {
        this(parameters, new KDTreeNearestNeighborSearch(parameters.correspondence.neighborSearchThreads));
    }

    public RigidRegistration(final RigidRegistrationParameters parameters,
                             final NearestNeighborSearch nearestNeighborSearch)
            throws IllegalArgumentException {

        parameters.validate();

        this.parameters = parameters;
        this.affinityBuilder = new AffinityBuilder(nearestNeighborSearch);
        this.affinityFuser = new AffinityFuser();
        this.correspondenceResolver = new CorrespondenceResolver(parameters.correspondence.flagThreshold);
        this.inlierClassifier = parameters.inlier.buildClassifier();
        this.transformEstimator = new RigidTransformEstimator(parameters.useScaling);
    }

    /**
     * Registers a copy of the floating features onto the target features.
     *
     * @param  floatingFeatures  features to move (not modified).
     * @param  targetFeatures    features to move onto.
     * @param  floatingFlags     validity flags for the floating features.
     * @param  targetFlags       validity flags for the target features.
     *
     * @return accumulated transform, final inlier probabilities, and the registered floating features.
     *
     * @throws IllegalArgumentException
     *   if the sets are inconsistent with each other or with the parameters,
     *   or if any normal is not unit length.
     *
     * @throws DegenerateStateException
     *   if an iteration cannot produce a well defined transform.
     */
    public Result run(final FeatureSet floatingFeatures,
                      final FeatureSet targetFeatures,
                      final FlagSet floatingFlags,
                      final FlagSet targetFlags)
            throws IllegalArgumentException, DegenerateStateException {

        validate(floatingFeatures, targetFeatures, floatingFlags, targetFlags);

        LOG.info("run: entry, registering {} floating features onto {} target features",
                 floatingFeatures, targetFeatures);

        final ProcessTimer timer = new ProcessTimer();

        final FeatureSet registeredFeatures = floatingFeatures.copy();
        final double[] inlierProbability = new double[floatingFeatures.size()];
        Arrays.fill(inlierProbability, 1.0);

        SimilarityTransform accumulatedTransform = SimilarityTransform.identity();

        for (int iteration = 0; iteration < parameters.numIterations; iteration++) {

            final SimilarityTransform transform = iterate(registeredFeatures,
                                                          targetFeatures,
                                                          floatingFlags,
                                                          targetFlags,
                                                          inlierProbability);

            accumulatedTransform = accumulatedTransform.preConcatenate(transform);

            LOG.debug("run: iteration {} applied {}", iteration, transform);

            if (timer.hasIntervalPassed()) {
                LOG.info("run: completed {} of {} iterations", iteration + 1, parameters.numIterations);
            }
        }

        final Result result = new Result(accumulatedTransform,
                                         parameters.numIterations,
                                         inlierProbability,
                                         registeredFeatures);

        LOG.info("run: exit, mean inlier probability is {} after {} iterations in {}",
                 result.getMeanInlierProbability(), parameters.numIterations, timer);

        return result;
    }

    /**
     * Runs one registration iteration, moving the floating features in place.
     *
     * @param  floatingFeatures   features to move (positions and normals are updated in place).
     * @param  targetFeatures     features to move onto.
     * @param  floatingFlags      validity flags for the floating features.
     * @param  targetFlags        validity flags for the target features.
     * @param  inlierProbability  probabilities from the previous iteration, updated in place.
     *
     * @return the transform applied to the floating features.
     */
    public SimilarityTransform iterate(final FeatureSet floatingFeatures,
                                       final FeatureSet targetFeatures,
                                       final FlagSet floatingFlags,
                                       final FlagSet targetFlags,
                                       final double[] inlierProbability)
            throws IllegalArgumentException, DegenerateStateException {

        final AffinityMatrix affinity = buildAffinity(floatingFeatures, targetFeatures);

        final Correspondences correspondences = correspondenceResolver.resolve(targetFeatures,
                                                                               targetFlags,
                                                                               affinity);

        inlierClassifier.classify(floatingFeatures,
                                  correspondences.getFeatures(),
                                  getGateFlags(floatingFlags, correspondences.getFlags()),
                                  inlierProbability);

        final double[][] floatingPositions = floatingFeatures.getPositions();
        final SimilarityTransform transform =
                transformEstimator.estimate(floatingPositions,
                                            inlierProbability,
                                            correspondences.getFeatures().getPositions());

        transform.applyToFeatures(floatingFeatures);

        return transform;
    }

    /**
     * @return forward floating-to-target affinity, fused with the reverse affinity when symmetric.
     */
    public AffinityMatrix buildAffinity(final FeatureSet floatingFeatures,
                                        final FeatureSet targetFeatures)
            throws IllegalArgumentException {

        final int k = parameters.correspondence.numNeighbors;

        final AffinityMatrix forwardAffinity = affinityBuilder.buildAffinity(floatingFeatures, targetFeatures, k);

        final AffinityMatrix affinity;
        if (parameters.correspondence.symmetric) {
            final AffinityMatrix reverseAffinity = affinityBuilder.buildAffinity(targetFeatures,
                                                                                 floatingFeatures,
                                                                                 k);
            affinity = affinityFuser.fuse(forwardAffinity, reverseAffinity);
        } else {
            affinity = forwardAffinity;
        }

        return affinity;
    }

    /**
     * @return flags that are only valid where both the floating element and its correspondence are valid.
     */
    static FlagSet getGateFlags(final FlagSet floatingFlags,
                                final FlagSet correspondingFlags) {
        final double[] gateFlags = new double[floatingFlags.size()];
        for (int i = 0; i < gateFlags.length; i++) {
            gateFlags[i] = (floatingFlags.isValid(i) && correspondingFlags.isValid(i)) ?
                           FlagSet.VALID : FlagSet.INVALID;
        }
        return new FlagSet(gateFlags);
    }

    private void validate(final FeatureSet floatingFeatures,
                          final FeatureSet targetFeatures,
                          final FlagSet floatingFlags,
                          final FlagSet targetFlags)
            throws IllegalArgumentException {

        if (floatingFeatures.size() != floatingFlags.size()) {
            throw new IllegalArgumentException(floatingFeatures.size() + " floating features but " +
                                               floatingFlags.size() + " floating flags");
        }

        if (targetFeatures.size() != targetFlags.size()) {
            throw new IllegalArgumentException(targetFeatures.size() + " target features but " +
                                               targetFlags.size() + " target flags");
        }

        if (floatingFeatures.getDimension() != targetFeatures.getDimension()) {
            throw new IllegalArgumentException("floating features have " + floatingFeatures.getDimension() +
                                               " components but target features have " +
                                               targetFeatures.getDimension());
        }

        floatingFeatures.validateUnitNormals();
        targetFeatures.validateUnitNormals();

        final int k = parameters.correspondence.numNeighbors;
        if (k > targetFeatures.size()) {
            throw new IllegalArgumentException("numNeighbors (" + k + ") exceeds the " + targetFeatures.size() +
                                               " target features");
        }

        if (parameters.correspondence.symmetric && (k > floatingFeatures.size())) {
            throw new IllegalArgumentException("numNeighbors (" + k + ") exceeds the " + floatingFeatures.size() +
                                               " floating features");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RigidRegistration.class);
}
