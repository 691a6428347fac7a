package org.warmish.thermal.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.model.EngineEvent;
import org.warmish.thermal.model.EventBus;
import org.warmish.thermal.model.RawThermalFrame;
import org.warmish.thermal.model.TemperatureField;
import org.warmish.thermal.roi.RoiMask;
import org.warmish.thermal.service.RadiometricConverter;

import java.util.Optional;

/**
 * Holds the loaded raw frame, the calibration in effect and the temperature field computed
 * from them.
 *
 * <p>The field is replaced as a whole on every {@link #calculateTemperatures} call and is
 * never edited in place. Progress is announced on the {@link EventBus} as
 * {@link EngineEvent}s, posted after the engine's lock is released so subscribers may call
 * back into it from any thread.</p>
 */
public class ThermalEngine {
    private static final Logger logger = LoggerFactory.getLogger(ThermalEngine.class);

    private final EventBus eventBus;
    private final RadiometricConverter converter;

    private RawThermalFrame frame;
    private CalibrationParameters parameters;
    private TemperatureField field;

    public ThermalEngine(EventBus eventBus) {
        this(eventBus, new RadiometricConverter());
    }

    public ThermalEngine(EventBus eventBus, RadiometricConverter converter) {
        if (eventBus == null || converter == null) {
            throw new IllegalArgumentException("Event bus and converter are required");
        }
        this.eventBus = eventBus;
        this.converter = converter;
    }

    /**
     * Replaces the current frame and calibration. The previous temperature field is dropped;
     * call {@link #calculateTemperatures()} to compute the new one.
     */
    public void loadFrame(RawThermalFrame frame, CalibrationParameters parameters) {
        if (frame == null || parameters == null) {
            throw new IllegalArgumentException("Frame and calibration parameters are required");
        }
        synchronized (this) {
            this.frame = frame;
            this.parameters = parameters;
            this.field = null;
        }
        logger.info("Loaded {}x{} thermal frame", frame.getWidth(), frame.getHeight());
        eventBus.post(EngineEvent.of(EngineEvent.Type.FRAME_LOADED));
    }

    /**
     * Recomputes the temperature field with the current calibration.
     *
     * @return true if temperatures were computed, false if no frame is loaded or the
     * calibration is invalid
     */
    public boolean calculateTemperatures() {
        EngineEvent event;
        synchronized (this) {
            event = calculateLocked();
        }
        return publish(event);
    }

    /**
     * Replaces the calibration (for example after the user edited a parameter) and
     * recomputes the field.
     */
    public boolean calculateTemperatures(CalibrationParameters parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("Calibration parameters are required");
        }
        EngineEvent event;
        synchronized (this) {
            this.parameters = parameters;
            event = calculateLocked();
        }
        return publish(event);
    }

    /**
     * @return the event describing the outcome, or null when no frame is loaded
     */
    private EngineEvent calculateLocked() {
        if (frame == null) {
            logger.warn("No thermal frame loaded, cannot calculate temperatures");
            return null;
        }
        field = converter.convert(frame, parameters);
        if (field.isCalibrationFailure()) {
            logger.warn("Temperature calculation failed: {}", field.getFailureReason());
            return EngineEvent.of(EngineEvent.Type.CALIBRATION_FAILED, field.getFailureReason());
        }
        logger.info("Calculated temperatures: {} valid pixels, range {} .. {}",
                field.getValidCount(), field.getMin(), field.getMax());
        return EngineEvent.of(EngineEvent.Type.TEMPERATURES_CALCULATED);
    }

    private boolean publish(EngineEvent event) {
        if (event == null) {
            return false;
        }
        eventBus.post(event);
        return event.type() == EngineEvent.Type.TEMPERATURES_CALCULATED;
    }

    /**
     * Temperatures of the masked pixels, reprocessed from the raw counts with the given
     * emissivity in place of the calibration's own.
     *
     * @return temperatures in mask index order; empty when no frame is loaded
     * @throws IllegalArgumentException if the mask was built for a different grid
     */
    public synchronized double[] computeRoiTemperatures(RoiMask mask, double emissivity) {
        if (frame == null) {
            return new double[0];
        }
        if (mask.getWidth() != frame.getWidth() || mask.getHeight() != frame.getHeight()) {
            throw new IllegalArgumentException(String.format("Mask %dx%d does not match frame %dx%d",
                    mask.getWidth(), mask.getHeight(), frame.getWidth(), frame.getHeight()));
        }
        double[] raw = frame.samplesAt(mask.getIndices());
        return converter.toCelsius(raw, parameters, emissivity);
    }

    /**
     * @return temperature at a pixel, NaN when no field exists or the point is outside it
     */
    public synchronized double getTemperatureAt(int x, int y) {
        return field == null ? Double.NaN : field.valueAt(x, y);
    }

    public synchronized Optional<TemperatureField> getTemperatureField() {
        return Optional.ofNullable(field);
    }

    public synchronized Optional<RawThermalFrame> getFrame() {
        return Optional.ofNullable(frame);
    }

    /**
     * @return calibration in effect, or null before a frame is loaded
     */
    public synchronized CalibrationParameters getParameters() {
        return parameters;
    }

    public void reset() {
        synchronized (this) {
            frame = null;
            parameters = null;
            field = null;
        }
        logger.info("Thermal engine reset");
        eventBus.post(EngineEvent.of(EngineEvent.Type.RESET));
    }

    public EventBus getEventBus() {
        return eventBus;
    }
}
