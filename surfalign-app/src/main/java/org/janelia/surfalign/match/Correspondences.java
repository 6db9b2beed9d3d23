package org.janelia.surfalign.match;

import org.janelia.surfalign.feature.FeatureSet;
import org.janelia.surfalign.feature.FlagSet;

/**
 * Synthesized target features and binarized target flags corresponding to each source element.
 */
public class Correspondences {

    private final FeatureSet features;
    private final FlagSet flags;

    public Correspondences(final FeatureSet features,
                           final FlagSet flags)
            throws IllegalArgumentException {
        if (features.size() != flags.size()) {
            throw new IllegalArgumentException(features.size() + " corresponding features but " +
                                               flags.size() + " corresponding flags");
        }
        this.features = features;
        this.flags = flags;
    }

    public FeatureSet getFeatures() {
        return features;
    }

    public FlagSet getFlags() {
        return flags;
    }

    public int size() {
        return features.size();
    }

    @Override
    public String toString() {
        return "{ features: " + features + ", flags: " + flags + " }";
    }
}
