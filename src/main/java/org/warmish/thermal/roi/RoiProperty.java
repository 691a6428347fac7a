package org.warmish.thermal.roi;

/**
 * Non-geometry ROI fields that can be edited through
 * {@link org.warmish.thermal.controller.RoiController#updateProperty}.
 */
public enum RoiProperty {
    /** Display name, a non-blank {@link String}. */
    NAME,
    /** Emissivity override, a {@link Number} in [0, 1]. Editing it triggers a recompute. */
    EMISSIVITY,
    /** Display colour, a {@link java.awt.Color}. */
    COLOR
}
