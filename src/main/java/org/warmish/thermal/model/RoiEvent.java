package org.warmish.thermal.model;

import java.util.UUID;

/**
 * Notification posted by the ROI controller.
 *
 * @param type  what happened
 * @param roiId ROI concerned, or null for registry-wide events ({@link Type#CLEARED},
 *              {@link Type#ANALYSIS_UPDATED})
 */
public record RoiEvent(Type type, UUID roiId) {

    public enum Type {
        ADDED,
        REMOVED,
        MODIFIED,
        STATISTICS_UPDATED,
        CLEARED,
        ANALYSIS_UPDATED
    }

    public static RoiEvent of(Type type, UUID roiId) {
        return new RoiEvent(type, roiId);
    }

    public static RoiEvent registryWide(Type type) {
        return new RoiEvent(type, null);
    }
}
