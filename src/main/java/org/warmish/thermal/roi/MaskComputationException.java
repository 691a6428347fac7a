package org.warmish.thermal.roi;

/**
 * Thrown when a ROI mask cannot be built at all, as opposed to a well-formed but empty mask.
 *
 * <p>Typical causes are non-finite geometry or a grid with non-positive dimensions. Callers
 * degrade the affected ROI's statistics and carry on with the others.</p>
 */
public class MaskComputationException extends Exception {

    public MaskComputationException(String message) {
        super(message);
    }

    public MaskComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
