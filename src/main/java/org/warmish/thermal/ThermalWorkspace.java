package org.warmish.thermal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.controller.RoiController;
import org.warmish.thermal.controller.ThermalEngine;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.model.EventBus;
import org.warmish.thermal.model.RawThermalFrame;
import org.warmish.thermal.service.InvalidCalibrationException;
import org.warmish.thermal.utilities.CalibrationParameterReader;
import org.warmish.thermal.utilities.RawFrameDecoder;
import org.warmish.thermal.utilities.RoiRecord;
import org.warmish.thermal.utilities.RoiSettingsCodec;
import org.warmish.thermal.utilities.ThermalConfigManager;

import java.io.IOException;
import java.nio.ByteOrder;
import java.util.List;
import java.util.Map;

/**
 * Entry point tying the pieces together for a host application.
 *
 * <p>One workspace holds one thermal image at a time: its raw frame, calibration, temperature
 * field and ROIs. Every change to calibration recomputes the field and refreshes all ROIs:</p>
 * <pre>
 * calibration + raw frame -> converter -> field -> (geometry -> mask) x each ROI -> statistics
 * </pre>
 *
 * <pre>{@code
 * ThermalWorkspace workspace = new ThermalWorkspace();
 * workspace.loadFrame(payload, 640, 480, ByteOrder.LITTLE_ENDIAN, metadata);
 * Roi spot = workspace.getRoiController().createSpot(320, 240, 10);
 * spot.getStatistics().getMean();
 * }</pre>
 */
public class ThermalWorkspace {
    private static final Logger logger = LoggerFactory.getLogger(ThermalWorkspace.class);

    private final EventBus eventBus;
    private final ThermalEngine engine;
    private final RoiController roiController;
    private final CalibrationParameterReader parameterReader;
    private final RoiSettingsCodec codec;

    public ThermalWorkspace() {
        this(ThermalConfigManager.getDefault());
    }

    public ThermalWorkspace(ThermalConfigManager config) {
        this.eventBus = new EventBus();
        this.engine = new ThermalEngine(eventBus, config.createConverter());
        this.roiController = new RoiController(engine, config);
        this.parameterReader = new CalibrationParameterReader(config);
        this.codec = new RoiSettingsCodec();
        logger.info("Thermal workspace created with configuration from {}", config.getSource());
    }

    /**
     * Decodes a raw 16-bit payload and loads it; see {@link #loadFrame(RawThermalFrame, Map)}.
     */
    public void loadFrame(byte[] payload, int width, int height, ByteOrder byteOrder, Map<String, ?> metadata)
            throws InvalidCalibrationException {
        loadFrame(RawFrameDecoder.decode(payload, width, height, byteOrder), metadata);
    }

    /**
     * Loads a frame with calibration read from camera metadata, computes temperatures and
     * refreshes every existing ROI.
     *
     * @throws InvalidCalibrationException if the metadata lacks usable calibration; the frame
     *                                     stays loaded and ROI statistics are empty
     */
    public void loadFrame(RawThermalFrame frame, Map<String, ?> metadata) throws InvalidCalibrationException {
        CalibrationParameters parameters = parameterReader.read(metadata, engine.getParameters());
        synchronized (roiController) {
            engine.loadFrame(frame, parameters);
            applyCalibration(parameters);
        }
    }

    /**
     * Recomputes the field with new calibration and refreshes every ROI.
     *
     * @throws InvalidCalibrationException if any parameter is missing or not finite
     */
    public void applyCalibration(CalibrationParameters parameters) throws InvalidCalibrationException {
        if (!roiController.recalculate(parameters)) {
            List<String> invalid = parameters.findInvalidParameters();
            if (!invalid.isEmpty()) {
                throw new InvalidCalibrationException(invalid);
            }
            logger.warn("Calibration stored but no frame is loaded");
        }
    }

    /**
     * Applies user edits given as a flat key to value map on top of the current calibration.
     *
     * @throws InvalidCalibrationException if an edited value is not a finite number, in which
     *                                     case nothing is applied, or if the resulting
     *                                     calibration is still incomplete
     */
    public void updateCalibration(Map<String, ?> edits) throws InvalidCalibrationException {
        applyCalibration(parameterReader.readEdits(edits, engine.getParameters()));
    }

    public String exportRoisJson() {
        return codec.toJson(roiController.exportRois());
    }

    /**
     * Adds the ROIs of an exported list to the current ones.
     *
     * @return number of ROIs created
     * @throws IOException if the text is not a JSON ROI list
     */
    public int importRoisJson(String json) throws IOException {
        List<RoiRecord> records = codec.fromJson(json);
        return roiController.importRois(records);
    }

    public String exportDetailedJson() {
        return codec.toReportJson(roiController.exportDetailed());
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public ThermalEngine getEngine() {
        return engine;
    }

    public RoiController getRoiController() {
        return roiController;
    }
}
