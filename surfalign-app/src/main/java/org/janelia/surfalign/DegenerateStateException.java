package org.janelia.surfalign;

/**
 * Thrown when well formed input still leaves a registration step without a defined result
 * (e.g. zero weight sums, collinear points, undefined mixture variance, or an ambiguous dominant eigenvalue).
 */
public class DegenerateStateException
        extends IllegalStateException {

    public DegenerateStateException(final String message) {
        super(message);
    }

}
