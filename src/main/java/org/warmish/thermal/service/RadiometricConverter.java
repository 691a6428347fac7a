package org.warmish.thermal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.model.RawThermalFrame;
import org.warmish.thermal.model.TemperatureField;

import java.util.Arrays;
import java.util.List;

/**
 * Converts raw sensor counts to degrees Celsius with the Planck radiance model.
 *
 * <h3>Algorithm</h3>
 * <pre>
 * reflK     = ReflectedApparentTemperature + 273.15
 * rawRefl   = R1 / (R2 * (exp(B / reflK) - F)) - O
 * rawObj    = (raw - (1 - e) * rawRefl) / max(e, floor)
 * logArg    = R1 / (R2 * (rawObj + O)) + F
 * celsius   = B / ln(logArg) - 273.15      where logArg > 0, otherwise NaN
 * </pre>
 *
 * <p>{@code e} is the calibration's emissivity for a whole-frame conversion, or a ROI's own
 * override when its pixels are reprocessed. A physically impossible inversion yields NaN for
 * that pixel and never throws.</p>
 *
 * <p>If any calibration value is missing or non-finite the conversion is aborted for the
 * whole frame and {@link TemperatureField#calibrationFailure} is returned instead of partial
 * results.</p>
 *
 * <p>Instances hold only immutable settings and are safe to share.</p>
 */
public class RadiometricConverter {
    private static final Logger logger = LoggerFactory.getLogger(RadiometricConverter.class);

    public static final double KELVIN_OFFSET = 273.15;
    public static final double DEFAULT_EMISSIVITY_FLOOR = 1e-6;

    private final double emissivityFloor;
    private final boolean environmentalCorrection;

    public RadiometricConverter() {
        this(DEFAULT_EMISSIVITY_FLOOR, false);
    }

    /**
     * @param emissivityFloor         smallest emissivity used as a divisor, must be positive
     * @param environmentalCorrection add {@link EnvironmentalCorrection#offset} to every value
     */
    public RadiometricConverter(double emissivityFloor, boolean environmentalCorrection) {
        if (!(emissivityFloor > 0) || !Double.isFinite(emissivityFloor)) {
            throw new IllegalArgumentException("Emissivity floor must be a positive number: " + emissivityFloor);
        }
        this.emissivityFloor = emissivityFloor;
        this.environmentalCorrection = environmentalCorrection;
    }

    /**
     * Converts a whole frame using the calibration's own emissivity.
     */
    public TemperatureField convert(RawThermalFrame frame, CalibrationParameters params) {
        List<String> invalid = params.findInvalidParameters();
        if (!invalid.isEmpty()) {
            logger.warn("Aborting conversion of {}x{} frame, invalid calibration: {}",
                    frame.getWidth(), frame.getHeight(), invalid);
            return TemperatureField.calibrationFailure(frame.getWidth(), frame.getHeight(),
                    "Invalid calibration parameters: " + String.join(", ", invalid));
        }

        int[] counts = frame.getCounts();
        double[] celsius = new double[counts.length];
        Inversion inversion = new Inversion(params, params.getEmissivity());
        for (int i = 0; i < counts.length; i++) {
            celsius[i] = inversion.apply(counts[i]);
        }
        TemperatureField field = TemperatureField.of(frame.getWidth(), frame.getHeight(), celsius);

        if (environmentalCorrection) {
            double offset = EnvironmentalCorrection.offset(params);
            logger.debug("Applying environmental correction of {} C", offset);
            field = field.shifted(offset);
        }
        logger.debug("Converted {}x{} frame: {} valid pixels, range {} .. {}",
                frame.getWidth(), frame.getHeight(), field.getValidCount(), field.getMin(), field.getMax());
        return field;
    }

    /**
     * Converts a subset of raw counts with an explicit emissivity, e.g. a ROI's pixels under
     * its own emissivity override.
     *
     * @return temperatures in the order of {@code rawCounts}; all NaN if the calibration is
     * invalid
     */
    public double[] toCelsius(double[] rawCounts, CalibrationParameters params, double emissivity) {
        double[] out = new double[rawCounts.length];
        List<String> invalid = params.findInvalidParameters();
        if (!invalid.isEmpty() || !Double.isFinite(emissivity)) {
            logger.warn("Cannot reprocess {} samples, invalid calibration {} or emissivity {}",
                    rawCounts.length, invalid, emissivity);
            Arrays.fill(out, Double.NaN);
            return out;
        }
        Inversion inversion = new Inversion(params, emissivity);
        double offset = environmentalCorrection ? EnvironmentalCorrection.offset(params) : 0.0;
        for (int i = 0; i < rawCounts.length; i++) {
            out[i] = inversion.apply(rawCounts[i]) + offset;
        }
        return out;
    }

    public double getEmissivityFloor() {
        return emissivityFloor;
    }

    public boolean isEnvironmentalCorrection() {
        return environmentalCorrection;
    }

    /**
     * Per-conversion constants, computed once and applied to every pixel.
     */
    private final class Inversion {
        private final double r1;
        private final double r2;
        private final double b;
        private final double f;
        private final double o;
        private final double emissivity;
        private final double divisor;
        private final double reflectedTerm;

        Inversion(CalibrationParameters params, double emissivity) {
            this.r1 = params.getPlanckR1();
            this.r2 = params.getPlanckR2();
            this.b = params.getPlanckB();
            this.f = params.getPlanckF();
            this.o = params.getPlanckO();
            this.emissivity = emissivity;
            this.divisor = Math.max(emissivity, emissivityFloor);

            double reflectedK = params.getReflectedApparentTemperature() + KELVIN_OFFSET;
            double rawReflected = r1 / (r2 * (Math.exp(b / reflectedK) - f)) - o;
            this.reflectedTerm = (1.0 - emissivity) * rawReflected;
        }

        double apply(double raw) {
            double rawObject = (raw - reflectedTerm) / divisor;
            double logArg = r1 / (r2 * (rawObject + o)) + f;
            // NaN > 0 is false, so non-finite intermediates also end up missing
            if (!(logArg > 0)) {
                return Double.NaN;
            }
            double kelvin = b / Math.log(logArg);
            return Double.isFinite(kelvin) ? kelvin - KELVIN_OFFSET : Double.NaN;
        }

        @Override
        public String toString() {
            return "Inversion[e=" + emissivity + "]";
        }
    }
}
