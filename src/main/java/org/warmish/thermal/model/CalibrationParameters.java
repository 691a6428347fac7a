package org.warmish.thermal.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the radiometric calibration used for one conversion.
 *
 * <p>Values come from the camera metadata collaborator and may be edited by the user.
 * A parameter that was never supplied is stored as {@link Double#NaN}; such a snapshot is
 * still a valid object but {@link #isValid()} reports false and a conversion with it
 * yields a calibration-failure field rather than temperatures.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * CalibrationParameters params = new CalibrationParameters.Builder()
 *     .emissivity(0.95)
 *     .reflectedApparentTemperature(20.0)
 *     .planck(21106.77, 0.012545258, 1501.0, 1.0, -7340.0)
 *     .build();
 *
 * // Same calibration, different surface
 * CalibrationParameters painted = params.withEmissivity(0.90);
 * }</pre>
 */
public final class CalibrationParameters {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationParameters.class);

    private final Map<CalibrationKey, Double> values;

    private CalibrationParameters(Map<CalibrationKey, Double> values) {
        EnumMap<CalibrationKey, Double> copy = new EnumMap<>(CalibrationKey.class);
        for (CalibrationKey key : CalibrationKey.values()) {
            Double v = values.get(key);
            copy.put(key, v == null ? Double.NaN : v);
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public double get(CalibrationKey key) {
        return values.get(key);
    }

    public double getEmissivity() { return get(CalibrationKey.EMISSIVITY); }
    public double getAtmosphericTemperature() { return get(CalibrationKey.ATMOSPHERIC_TEMPERATURE); }
    public double getAtmosphericTransmission() { return get(CalibrationKey.ATMOSPHERIC_TRANSMISSION); }
    public double getRelativeHumidity() { return get(CalibrationKey.RELATIVE_HUMIDITY); }
    public double getObjectDistance() { return get(CalibrationKey.OBJECT_DISTANCE); }
    public double getReflectedApparentTemperature() { return get(CalibrationKey.REFLECTED_APPARENT_TEMPERATURE); }
    public double getPlanckR1() { return get(CalibrationKey.PLANCK_R1); }
    public double getPlanckR2() { return get(CalibrationKey.PLANCK_R2); }
    public double getPlanckB() { return get(CalibrationKey.PLANCK_B); }
    public double getPlanckF() { return get(CalibrationKey.PLANCK_F); }
    public double getPlanckO() { return get(CalibrationKey.PLANCK_O); }

    /**
     * Returns a copy with a different emissivity; every other value is shared.
     */
    public CalibrationParameters withEmissivity(double emissivity) {
        return toBuilder().emissivity(emissivity).build();
    }

    /**
     * Lists every parameter that cannot take part in a conversion (missing, NaN or infinite).
     *
     * @return metadata keys of the offending parameters, empty when the snapshot is usable
     */
    public List<String> findInvalidParameters() {
        List<String> invalid = new ArrayList<>();
        for (Map.Entry<CalibrationKey, Double> entry : values.entrySet()) {
            if (!Double.isFinite(entry.getValue())) {
                invalid.add(entry.getKey().getKey());
            }
        }
        return invalid;
    }

    public boolean isValid() {
        return findInvalidParameters().isEmpty();
    }

    /**
     * Flat key to value view, in {@link CalibrationKey} order, using the metadata key names.
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        values.forEach((k, v) -> map.put(k.getKey(), v));
        return map;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationParameters other)) return false;
        // Double.equals treats NaN == NaN, which is what we want for "missing"
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CalibrationParameters" + toMap();
    }

    /**
     * Builder for {@link CalibrationParameters}. Unset parameters are NaN.
     */
    public static class Builder {
        private final Map<CalibrationKey, Double> values = new EnumMap<>(CalibrationKey.class);

        public Builder set(CalibrationKey key, double value) {
            if (key == null) {
                throw new IllegalArgumentException("Calibration key must not be null");
            }
            if (!Double.isFinite(value)) {
                logger.debug("Calibration parameter {} set to non-finite value {}", key.getKey(), value);
            }
            values.put(key, value);
            return this;
        }

        public Builder emissivity(double v) { return set(CalibrationKey.EMISSIVITY, v); }
        public Builder atmosphericTemperature(double v) { return set(CalibrationKey.ATMOSPHERIC_TEMPERATURE, v); }
        public Builder atmosphericTransmission(double v) { return set(CalibrationKey.ATMOSPHERIC_TRANSMISSION, v); }
        public Builder relativeHumidity(double v) { return set(CalibrationKey.RELATIVE_HUMIDITY, v); }
        public Builder objectDistance(double v) { return set(CalibrationKey.OBJECT_DISTANCE, v); }
        public Builder reflectedApparentTemperature(double v) { return set(CalibrationKey.REFLECTED_APPARENT_TEMPERATURE, v); }

        /**
         * Sets the five camera constants in one call.
         */
        public Builder planck(double r1, double r2, double b, double f, double o) {
            set(CalibrationKey.PLANCK_R1, r1);
            set(CalibrationKey.PLANCK_R2, r2);
            set(CalibrationKey.PLANCK_B, b);
            set(CalibrationKey.PLANCK_F, f);
            return set(CalibrationKey.PLANCK_O, o);
        }

        public CalibrationParameters build() {
            return new CalibrationParameters(values);
        }
    }
}
