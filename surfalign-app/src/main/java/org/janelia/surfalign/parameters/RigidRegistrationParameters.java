package org.janelia.surfalign.parameters;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.Serializable;

/**
 * Parameters for iterative rigid (or similarity) registration of a floating feature set onto a target feature set.
 */
public class RigidRegistrationParameters
        implements Serializable {

    @Parameter(
            names = "--numIterations",
            description = "Number of correspondence, inlier, and transform estimation iterations")
    public int numIterations = 20;

    @Parameter(
            names = "--useScaling",
            description = "Estimate an isotropic scale in addition to rotation and translation",
            arity = 1)
    public boolean useScaling = false;

    @ParametersDelegate
    public CorrespondenceParameters correspondence = new CorrespondenceParameters();

    @ParametersDelegate
    public InlierParameters inlier = new InlierParameters();

    public RigidRegistrationParameters() {
    }

    /**
     * @throws IllegalArgumentException
     *   if these parameters are invalid.
     */
    public void validate()
            throws IllegalArgumentException {
        if (numIterations < 1) {
            throw new IllegalArgumentException("numIterations must be positive");
        }
        correspondence.validate();
        inlier.validate();
    }
}
