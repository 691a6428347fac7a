package org.warmish.thermal.service;

import java.util.List;

/**
 * Thrown when a conversion is requested with calibration parameters that are missing or not
 * numeric. The temperatures produced under such a calibration are all missing and must not
 * be read as real measurements.
 */
public class InvalidCalibrationException extends Exception {
    private final List<String> invalidParameters;

    public InvalidCalibrationException(List<String> invalidParameters) {
        super("Invalid calibration parameters: " + String.join(", ", invalidParameters));
        this.invalidParameters = List.copyOf(invalidParameters);
    }

    /**
     * @return metadata keys of the parameters that could not be used
     */
    public List<String> getInvalidParameters() {
        return invalidParameters;
    }
}
