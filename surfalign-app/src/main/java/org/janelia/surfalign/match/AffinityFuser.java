package org.janelia.surfalign.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symmetrizes two directional affinities into one mutually consistent affinity.
 *
 * A single direction k nearest neighbor affinity is asymmetric (the nearest target of a source element
 * need not have that source element as its own nearest neighbor), so the forward matrix is summed with the
 * transpose of an independently built reverse matrix and the rows are normalized again.
 */
public class AffinityFuser {

    /**
     * @param  forwardAffinity  (N_A x N_B) affinity from set A to set B.
     * @param  reverseAffinity  (N_B x N_A) affinity from set B to set A.
     *
     * @return new (N_A x N_B) row stochastic fused affinity (the inputs are not modified).
     *
     * @throws IllegalArgumentException
     *   if the reverse affinity shape is not the transpose of the forward affinity shape.
     */
    public AffinityMatrix fuse(final AffinityMatrix forwardAffinity,
                               final AffinityMatrix reverseAffinity)
            throws IllegalArgumentException {

        if ((forwardAffinity.getNumberOfRows() != reverseAffinity.getNumberOfColumns()) ||
            (forwardAffinity.getNumberOfColumns() != reverseAffinity.getNumberOfRows())) {
            throw new IllegalArgumentException("reverse affinity shape " + reverseAffinity.getShape() +
                                               " must be the transpose of forward affinity shape " +
                                               forwardAffinity.getShape());
        }

        final AffinityMatrix fusedAffinity = forwardAffinity.add(reverseAffinity.transpose()).normalizeRows();

        LOG.debug("fuse: fused {} and {} affinities into {}",
                  forwardAffinity, reverseAffinity, fusedAffinity);

        return fusedAffinity;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AffinityFuser.class);
}
