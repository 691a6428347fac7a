package org.warmish.thermal.model;

/**
 * Notification posted by the thermal engine.
 *
 * @param type    what happened
 * @param message human readable detail, empty when there is nothing to add
 */
public record EngineEvent(Type type, String message) {

    public enum Type {
        FRAME_LOADED,
        TEMPERATURES_CALCULATED,
        CALIBRATION_FAILED,
        RESET
    }

    public static EngineEvent of(Type type) {
        return new EngineEvent(type, "");
    }

    public static EngineEvent of(Type type, String message) {
        return new EngineEvent(type, message == null ? "" : message);
    }
}
