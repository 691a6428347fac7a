package org.warmish.thermal.model;

/**
 * Recognised calibration parameter names, as they appear in camera metadata and in the
 * flat parameter maps exchanged with the metadata and settings collaborators.
 */
public enum CalibrationKey {
    EMISSIVITY("Emissivity", false),
    ATMOSPHERIC_TEMPERATURE("AtmosphericTemperature", false),
    ATMOSPHERIC_TRANSMISSION("AtmosphericTransmission", false),
    RELATIVE_HUMIDITY("RelativeHumidity", false),
    OBJECT_DISTANCE("ObjectDistance", false),
    REFLECTED_APPARENT_TEMPERATURE("ReflectedApparentTemperature", false),
    PLANCK_R1("PlanckR1", true),
    PLANCK_R2("PlanckR2", true),
    PLANCK_B("PlanckB", true),
    PLANCK_F("PlanckF", true),
    PLANCK_O("PlanckO", true);

    private final String key;
    private final boolean cameraConstant;

    CalibrationKey(String key, boolean cameraConstant) {
        this.key = key;
        this.cameraConstant = cameraConstant;
    }

    /**
     * @return the metadata/settings key, e.g. {@code "PlanckR1"}
     */
    public String getKey() {
        return key;
    }

    /**
     * Camera constants (the Planck coefficients) have no documented default and must come
     * from the camera metadata; environmental parameters fall back to configured defaults.
     */
    public boolean isCameraConstant() {
        return cameraConstant;
    }

    /**
     * Case-sensitive lookup by metadata key.
     *
     * @return the matching key, or null if the name is not recognised
     */
    public static CalibrationKey fromKey(String key) {
        for (CalibrationKey k : values()) {
            if (k.key.equals(key)) {
                return k;
            }
        }
        return null;
    }
}
