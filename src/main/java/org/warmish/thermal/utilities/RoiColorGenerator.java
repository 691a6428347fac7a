package org.warmish.thermal.utilities;

import java.awt.Color;

/**
 * Deterministic display colours for new ROIs: the hue advances by a fixed step per ROI,
 * saturation and value stay constant.
 */
public class RoiColorGenerator {
    private final int hueStep;
    private final float saturation;
    private final float value;

    public RoiColorGenerator() {
        this(55, 220, 255);
    }

    /**
     * @param hueStep    degrees added per ROI
     * @param saturation 0-255
     * @param value      0-255
     */
    public RoiColorGenerator(int hueStep, int saturation, int value) {
        if (saturation < 0 || saturation > 255 || value < 0 || value > 255) {
            throw new IllegalArgumentException("Saturation and value must be in 0-255");
        }
        this.hueStep = hueStep;
        this.saturation = saturation / 255f;
        this.value = value / 255f;
    }

    public static RoiColorGenerator fromConfig(ThermalConfigManager config) {
        return new RoiColorGenerator(
                config.getIntegerOrDefault(55, "roi", "color", "hue_step"),
                config.getIntegerOrDefault(220, "roi", "color", "saturation"),
                config.getIntegerOrDefault(255, "roi", "color", "value"));
    }

    /**
     * @param index position of the ROI in the registry at creation time
     */
    public Color colorFor(int index) {
        int hue = Math.floorMod(index * hueStep, 360);
        return Color.getHSBColor(hue / 360f, saturation, value);
    }
}
