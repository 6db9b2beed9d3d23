package org.janelia.surfalign.match;

import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects target features and flags through an affinity matrix to derive the
 * {@link Correspondences} of each source element.
 *
 * Corresponding flags are binarized with a strict comparison against the flag threshold, so a source element
 * only corresponds to valid geometry when an overwhelming share of its soft matches are valid.
 */
public class CorrespondenceResolver {

    public static final double DEFAULT_FLAG_THRESHOLD = 0.9;

    private final double flagThreshold;

    public CorrespondenceResolver() {
        this(DEFAULT_FLAG_THRESHOLD);
    }

    public CorrespondenceResolver(final double flagThreshold)
            throws IllegalArgumentException {
        if (! ((flagThreshold >= 0.0) && (flagThreshold <= 1.0))) {
            throw new IllegalArgumentException("flagThreshold must be in [0, 1]");
        }
        this.flagThreshold = flagThreshold;
    }

    public double getFlagThreshold() {
        return flagThreshold;
    }

    /**
     * @param  targetFeatures  features of the affinity matrix columns.
     * @param  targetFlags     flags of the affinity matrix columns.
     * @param  affinity        (N_source x N_target) affinity.
     *
     * @return affinity weighted target features and binarized flags for each source element.
     *
     * @throws IllegalArgumentException
     *   if the target sets do not match the affinity matrix columns.
     */
    public Correspondences resolve(final FeatureSet targetFeatures,
                                   final FlagSet targetFlags,
                                   final AffinityMatrix affinity)
            throws IllegalArgumentException {

        if ((targetFeatures.size() != affinity.getNumberOfColumns()) ||
            (targetFlags.size() != affinity.getNumberOfColumns())) {
            throw new IllegalArgumentException(targetFeatures.size() + " target features and " +
                                               targetFlags.size() + " target flags do not match " +
                                               affinity.getShape() + " affinity");
        }

        final double[][] correspondingFeatures = affinity.multiply(targetFeatures.toArray());
        final double[] correspondingFlags = affinity.multiply(targetFlags.toArray());

        for (int i = 0; i < correspondingFlags.length; i++) {
            correspondingFlags[i] = correspondingFlags[i] > flagThreshold ? FlagSet.VALID : FlagSet.INVALID;
        }

        final Correspondences correspondences = new Correspondences(new FeatureSet(correspondingFeatures),
                                                                    new FlagSet(correspondingFlags));

        LOG.debug("resolve: derived {} with flagThreshold {}", correspondences, flagThreshold);

        return correspondences;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CorrespondenceResolver.class);
}
