package org.janelia.surfalign.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.surfalign.inlier.InlierClassifier;

/**
 * Parameters for inlier classification.
 */
public class InlierParameters
        implements Serializable {

    @Parameter(
            names = "--inlierKappa",
            description = "Number of standard deviations (Mahalanobis distance) that separates inliers from outliers")
    public double kappa = InlierClassifier.DEFAULT_KAPPA;

    @Parameter(
            names = "--inlierUseOrientation",
            description = "Scale inlier probabilities by the agreement of element and corresponding normals",
            arity = 1)
    public boolean useOrientation = true;

    public InlierParameters() {
    }

    public InlierParameters(final double kappa,
                            final boolean useOrientation) {
        this.kappa = kappa;
        this.useOrientation = useOrientation;
    }

    public InlierClassifier buildClassifier() {
        return new InlierClassifier(kappa, useOrientation);
    }

    public void validate()
            throws IllegalArgumentException {
        if (! (Double.isFinite(kappa) && (kappa > 0.0))) {
            throw new IllegalArgumentException("kappa must be a positive number");
        }
    }
}
