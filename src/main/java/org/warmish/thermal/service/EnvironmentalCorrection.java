package org.warmish.thermal.service;

import org.warmish.thermal.model.CalibrationParameters;

/**
 * Small empirical offset for atmospheric conditions, added to every temperature after the
 * Planck inversion when enabled ({@code conversion.environmental_correction}).
 *
 * <pre>
 * offset = (AtmosphericTemperature - 20) * 0.0005
 *        + (1 - AtmosphericTransmission)  * 0.002
 *        + (RelativeHumidity - 50)        * 0.00002
 * </pre>
 */
public final class EnvironmentalCorrection {
    static final double REFERENCE_ATMOSPHERIC_TEMPERATURE = 20.0;
    static final double REFERENCE_HUMIDITY = 50.0;
    static final double TEMPERATURE_FACTOR = 0.0005;
    static final double TRANSMISSION_FACTOR = 0.002;
    static final double HUMIDITY_FACTOR = 0.00002;

    private EnvironmentalCorrection() {
    }

    /**
     * @return offset in degrees Celsius; 0 when any of the three inputs is not finite
     */
    public static double offset(CalibrationParameters params) {
        double atmT = params.getAtmosphericTemperature();
        double trans = params.getAtmosphericTransmission();
        double rh = params.getRelativeHumidity();
        if (!Double.isFinite(atmT) || !Double.isFinite(trans) || !Double.isFinite(rh)) {
            return 0.0;
        }
        return (atmT - REFERENCE_ATMOSPHERIC_TEMPERATURE) * TEMPERATURE_FACTOR
                + (1.0 - trans) * TRANSMISSION_FACTOR
                + (rh - REFERENCE_HUMIDITY) * HUMIDITY_FACTOR;
    }
}
