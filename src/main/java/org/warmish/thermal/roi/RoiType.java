package org.warmish.thermal.roi;

/**
 * Closed set of ROI shapes. Code that treats shapes differently switches on this tag.
 */
public enum RoiType {
    RECTANGLE("Rectangle", "RectROI", "ROI"),
    SPOT("Spot", "SpotROI", "Spot"),
    POLYGON("Polygon", "PolygonROI", "Polygon");

    private final String label;
    private final String legacyLabel;
    private final String namePrefix;

    RoiType(String label, String legacyLabel, String namePrefix) {
        this.label = label;
        this.legacyLabel = legacyLabel;
        this.namePrefix = namePrefix;
    }

    /**
     * @return the type tag written to exported ROI lists
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the tag older settings files used for this shape
     */
    public String getLegacyLabel() {
        return legacyLabel;
    }

    /**
     * @return prefix of auto-generated names, e.g. {@code Spot} for {@code Spot_3}
     */
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * Resolves an exported type tag. Both current and legacy tags are accepted.
     *
     * @return the matching type, or null if the tag is not recognised
     */
    public static RoiType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String trimmed = label.trim();
        for (RoiType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.legacyLabel.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
