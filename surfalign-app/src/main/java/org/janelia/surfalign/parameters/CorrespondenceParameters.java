package org.janelia.surfalign.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.surfalign.match.CorrespondenceResolver;

/**
 * Parameters for deriving soft correspondences between two feature sets.
 */
public class CorrespondenceParameters
        implements Serializable {

    @Parameter(
            names = "--numNeighbors",
            description = "Number of nearest neighbors linked to each element")
    public int numNeighbors = 3;

    @Parameter(
            names = "--flagThreshold",
            description = "Corresponding flags above this value are rounded up to valid, all others down to invalid")
    public double flagThreshold = CorrespondenceResolver.DEFAULT_FLAG_THRESHOLD;

    @Parameter(
            names = "--symmetric",
            description = "Fuse floating-to-target and target-to-floating affinities (false uses only the forward direction)",
            arity = 1)
    public boolean symmetric = true;

    @Parameter(
            names = "--neighborSearchThreads",
            description = "Number of threads for nearest neighbor searches")
    public int neighborSearchThreads = 1;

    public CorrespondenceParameters() {
    }

    public CorrespondenceParameters(final int numNeighbors,
                                    final double flagThreshold,
                                    final boolean symmetric) {
        this.numNeighbors = numNeighbors;
        this.flagThreshold = flagThreshold;
        this.symmetric = symmetric;
    }

    /**
     * @throws IllegalArgumentException
     *   if these parameters are invalid.
     */
    public void validate()
            throws IllegalArgumentException {
        if (numNeighbors < 1) {
            throw new IllegalArgumentException("numNeighbors must be positive");
        }
        if (! ((flagThreshold >= 0.0) && (flagThreshold <= 1.0))) {
            throw new IllegalArgumentException("flagThreshold must be in [0, 1]");
        }
        if (neighborSearchThreads < 1) {
            throw new IllegalArgumentException("neighborSearchThreads must be positive");
        }
    }
}
