package org.warmish.thermal.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.model.CalibrationParameters;
import org.warmish.thermal.model.EventBus;
import org.warmish.thermal.model.RawThermalFrame;
import org.warmish.thermal.model.RoiEvent;
import org.warmish.thermal.model.StatisticsRecord;
import org.warmish.thermal.model.TemperatureField;
import org.warmish.thermal.roi.GeometryUpdate;
import org.warmish.thermal.roi.MaskComputationException;
import org.warmish.thermal.roi.PolygonRoi;
import org.warmish.thermal.roi.RectangleRoi;
import org.warmish.thermal.roi.Roi;
import org.warmish.thermal.roi.RoiMask;
import org.warmish.thermal.roi.RoiProperty;
import org.warmish.thermal.roi.RoiType;
import org.warmish.thermal.roi.SpotRoi;
import org.warmish.thermal.service.StatisticsAggregator;
import org.warmish.thermal.utilities.RoiColorGenerator;
import org.warmish.thermal.utilities.RoiRecord;
import org.warmish.thermal.utilities.RoiReport;
import org.warmish.thermal.utilities.ThermalConfigManager;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the live ROI collection and keeps each ROI's statistics in step with the temperature
 * field.
 *
 * <h3>Recompute protocol</h3>
 * <p>Statistics for one ROI are recomputed when it is created, when its geometry or
 * emissivity changes, or when {@link #requestRecompute(UUID)} is called. Each recompute posts
 * {@link RoiEvent.Type#STATISTICS_UPDATED} synchronously, and a subscriber may react by
 * requesting yet another recompute. To keep that from recursing:</p>
 * <ol>
 *   <li>While a recompute is running, further requests only add the ROI's id to a pending
 *       set.</li>
 *   <li>Once the running recompute has finished and cleared the flag, the pending ids are
 *       drained, each through the same protocol, skipping the ROI just computed.</li>
 *   <li>Within one top-level request (a batch) each ROI is computed at most once.</li>
 *   <li>Both skips are lifted for a ROI whose geometry or emissivity was edited during the
 *       batch, including an edit made by a subscriber reacting to that ROI's own update.</li>
 * </ol>
 * <p>A failure while computing one ROI leaves that ROI with empty statistics and is logged;
 * it never escapes to the caller.</p>
 *
 * <p>Public methods synchronize on the controller. The monitor is reentrant, so event
 * subscribers on the same thread can call back in and reach the guard above.</p>
 */
public class RoiController {
    private static final Logger logger = LoggerFactory.getLogger(RoiController.class);

    private static final List<Point2D> DEFAULT_IMPORT_POLYGON = List.of(
            new Point2D.Double(0, 0), new Point2D.Double(50, 0),
            new Point2D.Double(50, 50), new Point2D.Double(0, 50));

    private final ThermalEngine engine;
    private final EventBus eventBus;
    private final ThermalConfigManager config;
    private final RoiColorGenerator colorGenerator;
    private final double defaultEmissivity;

    private final List<Roi> rois = new ArrayList<>();
    private int nextNameIndex = 1;

    // Reentrancy guard state
    private boolean updating;
    private final Set<UUID> pending = new LinkedHashSet<>();
    private Set<UUID> batch;
    private final Set<UUID> dirty = new HashSet<>();

    public RoiController(ThermalEngine engine) {
        this(engine, ThermalConfigManager.getDefault());
    }

    public RoiController(ThermalEngine engine, ThermalConfigManager config) {
        if (engine == null || config == null) {
            throw new IllegalArgumentException("Thermal engine and configuration are required");
        }
        this.engine = engine;
        this.eventBus = engine.getEventBus();
        this.config = config;
        this.colorGenerator = RoiColorGenerator.fromConfig(config);
        this.defaultEmissivity = config.getDefaultRoiEmissivity();
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    public Roi createRectangle(double x, double y, double width, double height) {
        return createRectangle(x, y, width, height, null, null);
    }

    /**
     * @param name       display name, generated as {@code ROI_n} when null
     * @param emissivity emissivity override, the configured default when null
     */
    public synchronized Roi createRectangle(double x, double y, double width, double height,
                                            String name, Double emissivity) {
        RectangleRoi roi = new RectangleRoi(UUID.randomUUID(), nameOrNext(name, RoiType.RECTANGLE),
                emissivityOrDefault(emissivity), nextColor(), x, y, width, height);
        return register(roi, name == null);
    }

    public Roi createSpot(double centerX, double centerY, double radius) {
        return createSpot(centerX, centerY, radius, null, null);
    }

    public synchronized Roi createSpot(double centerX, double centerY, double radius,
                                       String name, Double emissivity) {
        SpotRoi roi = new SpotRoi(UUID.randomUUID(), nameOrNext(name, RoiType.SPOT),
                emissivityOrDefault(emissivity), nextColor(), centerX, centerY, radius);
        return register(roi, name == null);
    }

    public Roi createPolygon(List<? extends Point2D> vertices) {
        return createPolygon(vertices, null, null);
    }

    public synchronized Roi createPolygon(List<? extends Point2D> vertices, String name, Double emissivity) {
        PolygonRoi roi = new PolygonRoi(UUID.randomUUID(), nameOrNext(name, RoiType.POLYGON),
                emissivityOrDefault(emissivity), nextColor(), vertices);
        return register(roi, name == null);
    }

    private Roi register(Roi roi, boolean generatedName) {
        if (generatedName) {
            nextNameIndex++;
        }
        rois.add(roi);
        logger.info("Created {} '{}' ({})", roi.getType().getLabel(), roi.getName(), roi.getId());
        requestRecompute(roi.getId());
        eventBus.post(RoiEvent.of(RoiEvent.Type.ADDED, roi.getId()));
        return roi;
    }

    private String nameOrNext(String name, RoiType type) {
        return name != null ? name : type.getNamePrefix() + "_" + nextNameIndex;
    }

    private double emissivityOrDefault(Double emissivity) {
        return emissivity != null ? emissivity : defaultEmissivity;
    }

    private Color nextColor() {
        return colorGenerator.colorFor(rois.size());
    }

    // ------------------------------------------------------------------
    // Deletion
    // ------------------------------------------------------------------

    /**
     * Removes a ROI. Other ROIs are not recomputed.
     *
     * @return false if no ROI has this id
     */
    public synchronized boolean delete(UUID id) {
        Roi roi = findRoi(id);
        if (roi == null) {
            return false;
        }
        rois.remove(roi);
        pending.remove(id);
        logger.info("Deleted ROI '{}'", roi.getName());
        eventBus.post(RoiEvent.of(RoiEvent.Type.REMOVED, id));
        return true;
    }

    /**
     * @return number of ROIs actually removed
     */
    public synchronized int delete(Collection<UUID> ids) {
        int deleted = 0;
        for (UUID id : new ArrayList<>(ids)) {
            if (delete(id)) {
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * Removes every ROI and restarts automatic naming. The temperature field is untouched.
     *
     * @return number of ROIs removed
     */
    public synchronized int deleteAll() {
        int count = rois.size();
        rois.clear();
        pending.clear();
        nextNameIndex = 1;
        logger.info("Cleared {} ROIs", count);
        eventBus.post(RoiEvent.registryWide(RoiEvent.Type.CLEARED));
        return count;
    }

    // ------------------------------------------------------------------
    // Edits
    // ------------------------------------------------------------------

    /**
     * Edits a non-geometry field. Changing emissivity also recomputes the ROI's statistics.
     *
     * @return false if no ROI has this id
     * @throws IllegalArgumentException if the value has the wrong type or is out of range;
     *                                  the ROI is left unchanged
     */
    public synchronized boolean updateProperty(UUID id, RoiProperty property, Object value) {
        Roi roi = findRoi(id);
        if (roi == null) {
            return false;
        }
        switch (property) {
            case NAME -> {
                if (!(value instanceof String name)) {
                    throw new IllegalArgumentException("ROI name must be a String, got " + describe(value));
                }
                roi.setName(name);
            }
            case COLOR -> {
                if (!(value instanceof Color color)) {
                    throw new IllegalArgumentException("ROI colour must be a java.awt.Color, got " + describe(value));
                }
                roi.setColor(color);
            }
            case EMISSIVITY -> {
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("Emissivity must be a number, got " + describe(value));
                }
                roi.setEmissivity(number.doubleValue());
                invalidate(id);
                requestRecompute(id);
            }
        }
        logger.debug("Updated {} of '{}' to {}", property, roi.getName(), value);
        eventBus.post(RoiEvent.of(RoiEvent.Type.MODIFIED, id));
        return true;
    }

    /**
     * Moves, resizes or reshapes a ROI using only the fields of {@code update} that apply to
     * its shape, then recomputes its statistics.
     *
     * @return false, with no side effects, if the id is unknown or no applicable field was set
     * @throws IllegalArgumentException if an applicable value is invalid; the ROI is left unchanged
     */
    public synchronized boolean updateGeometry(UUID id, GeometryUpdate update) {
        Roi roi = findRoi(id);
        if (roi == null || update == null) {
            return false;
        }
        if (!roi.applyGeometry(update)) {
            logger.debug("No geometry field in {} applies to {} '{}'", update, roi.getType(), roi.getName());
            return false;
        }
        invalidate(id);
        requestRecompute(id);
        eventBus.post(RoiEvent.of(RoiEvent.Type.MODIFIED, id));
        return true;
    }

    // ------------------------------------------------------------------
    // Recompute
    // ------------------------------------------------------------------

    /**
     * Recomputes one ROI's statistics following the protocol described on the class. Unknown
     * ids are ignored.
     */
    public synchronized void requestRecompute(UUID id) {
        Roi roi = findRoi(id);
        if (roi == null) {
            logger.debug("Ignoring recompute request for unknown ROI {}", id);
            return;
        }
        if (updating) {
            pending.add(id);
            logger.debug("Recompute of '{}' deferred, another recompute is running", roi.getName());
            return;
        }

        boolean batchOwner = batch == null;
        if (batchOwner) {
            batch = new HashSet<>();
        }
        try {
            updating = true;
            try {
                dirty.remove(id);
                roi.setStatistics(computeStatistics(roi));
                batch.add(id);
                eventBus.post(RoiEvent.of(RoiEvent.Type.STATISTICS_UPDATED, id));
            } finally {
                updating = false;
            }
            drainPending(id);
        } finally {
            if (batchOwner) {
                batch = null;
                dirty.clear();
            }
        }
    }

    private void drainPending(UUID currentId) {
        while (!pending.isEmpty()) {
            List<UUID> snapshot = new ArrayList<>(pending);
            pending.clear();
            for (UUID next : snapshot) {
                if (!dirty.contains(next) && (next.equals(currentId) || batch.contains(next))) {
                    logger.debug("Skipping pending recompute of {}, already computed in this batch", next);
                    continue;
                }
                requestRecompute(next);
            }
        }
    }

    /**
     * Marks a ROI as edited during the running batch, so an edit made by an event subscriber
     * is not lost to de-duplication or to the skip of the ROI just computed.
     */
    private void invalidate(UUID id) {
        if (batch != null) {
            batch.remove(id);
            dirty.add(id);
        }
    }

    /**
     * Recomputes every ROI once, in list order, without the deferral machinery, then posts a
     * single {@link RoiEvent.Type#ANALYSIS_UPDATED}. Used after the temperature field changed.
     */
    public synchronized void recomputeAll() {
        for (Roi roi : new ArrayList<>(rois)) {
            roi.setStatistics(computeStatistics(roi));
        }
        pending.clear();
        logger.debug("Recomputed statistics for {} ROIs", rois.size());
        eventBus.post(RoiEvent.registryWide(RoiEvent.Type.ANALYSIS_UPDATED));
    }

    /**
     * Recalculates the temperature field with new calibration and refreshes every ROI, as one
     * step under the controller's lock.
     *
     * @return the engine's result: false if no frame is loaded or the calibration is invalid
     */
    public synchronized boolean recalculate(CalibrationParameters parameters) {
        boolean calculated = engine.calculateTemperatures(parameters);
        recomputeAll();
        return calculated;
    }

    private StatisticsRecord computeStatistics(Roi roi) {
        Optional<TemperatureField> current = engine.getTemperatureField();
        if (current.isEmpty()) {
            logger.debug("No temperature field, statistics of '{}' are empty", roi.getName());
            return StatisticsRecord.empty();
        }
        TemperatureField field = current.get();
        if (field.isCalibrationFailure()) {
            logger.debug("Temperature field is a calibration failure, statistics of '{}' are empty", roi.getName());
            return StatisticsRecord.empty();
        }

        try {
            RoiMask mask = roi.mask(field.getWidth(), field.getHeight());
            if (mask.getCoverage() == RoiMask.Coverage.OUTSIDE_IMAGE) {
                logger.info("ROI '{}' lies entirely outside the {}x{} image", roi.getName(),
                        field.getWidth(), field.getHeight());
                return StatisticsRecord.empty();
            }
            if (mask.isEmpty()) {
                logger.debug("ROI '{}' covers no pixels", roi.getName());
                return StatisticsRecord.empty();
            }
            double[] temperatures = engine.computeRoiTemperatures(mask, roi.getEmissivity());
            StatisticsRecord stats = StatisticsAggregator.aggregate(temperatures);
            if (!stats.isPresent()) {
                logger.debug("All {} pixels of '{}' have missing temperatures", mask.getPixelCount(), roi.getName());
            }
            return stats;
        } catch (MaskComputationException e) {
            logger.warn("Could not build mask for ROI '{}': {}", roi.getName(), e.getMessage());
            return StatisticsRecord.empty();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure computing statistics for ROI '{}'", roi.getName(), e);
            return StatisticsRecord.empty();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public synchronized Optional<Roi> getRoi(UUID id) {
        return Optional.ofNullable(findRoi(id));
    }

    /**
     * @return snapshot of the ROIs in display order
     */
    public synchronized List<Roi> getRois() {
        return Collections.unmodifiableList(new ArrayList<>(rois));
    }

    public synchronized int size() {
        return rois.size();
    }

    /**
     * Number of pixels in the ROI's mask over the loaded frame.
     *
     * @return 0 for an unknown id, when no frame is loaded or when the mask cannot be built
     */
    public synchronized int getPixelCount(UUID id) {
        Roi roi = findRoi(id);
        Optional<RawThermalFrame> frame = engine.getFrame();
        if (roi == null || frame.isEmpty()) {
            return 0;
        }
        try {
            return roi.mask(frame.get().getWidth(), frame.get().getHeight()).getPixelCount();
        } catch (MaskComputationException e) {
            logger.warn("Could not count pixels of ROI '{}': {}", roi.getName(), e.getMessage());
            return 0;
        }
    }

    synchronized boolean isUpdating() {
        return updating;
    }

    synchronized Set<UUID> getPendingIds() {
        return Set.copyOf(pending);
    }

    private Roi findRoi(UUID id) {
        if (id == null) {
            return null;
        }
        for (Roi roi : rois) {
            if (roi.getId().equals(id)) {
                return roi;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Export / import
    // ------------------------------------------------------------------

    /**
     * @return one record per ROI, in display order
     */
    public synchronized List<RoiRecord> exportRois() {
        List<RoiRecord> records = new ArrayList<>(rois.size());
        for (Roi roi : rois) {
            records.add(RoiRecord.from(roi));
        }
        return records;
    }

    /**
     * Creates a ROI for each record, adding to the existing ones. Records with an unknown
     * type or invalid values are logged and skipped.
     *
     * @return number of ROIs created
     */
    public synchronized int importRois(List<RoiRecord> records) {
        if (records == null) {
            return 0;
        }
        int imported = 0;
        for (RoiRecord record : records) {
            if (record == null) {
                continue;
            }
            RoiType type = RoiType.fromLabel(record.getType());
            if (type == null) {
                logger.warn("Skipping ROI '{}' with unknown type '{}'", record.getName(), record.getType());
                continue;
            }
            try {
                createFromRecord(type, record);
                imported++;
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping invalid {} ROI '{}': {}", type.getLabel(), record.getName(), e.getMessage());
            }
        }
        logger.info("Imported {} of {} ROIs", imported, records.size());
        return imported;
    }

    private void createFromRecord(RoiType type, RoiRecord record) {
        double x = valueOr(record.getX(), "x", 0);
        double y = valueOr(record.getY(), "y", 0);
        switch (type) {
            case RECTANGLE -> createRectangle(x, y,
                    valueOr(record.getWidth(), "width", 50),
                    valueOr(record.getHeight(), "height", 50),
                    record.getName(), record.getEmissivity());
            case SPOT -> createSpot(x, y,
                    valueOr(record.getRadius(), "radius", 5),
                    record.getName(), record.getEmissivity());
            case POLYGON -> createPolygon(
                    record.getPoints() != null ? record.getPoints() : DEFAULT_IMPORT_POLYGON,
                    record.getName(), record.getEmissivity());
        }
    }

    private double valueOr(Double value, String field, double fallback) {
        if (value != null) {
            return value;
        }
        return config.getDoubleOrDefault(fallback, "roi", "import_defaults", field);
    }

    /**
     * @return one report row per ROI with its cached statistics and current pixel count
     */
    public synchronized List<RoiReport> exportDetailed() {
        List<RoiReport> reports = new ArrayList<>(rois.size());
        for (Roi roi : rois) {
            reports.add(new RoiReport(roi, getPixelCount(roi.getId())));
        }
        return reports;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
