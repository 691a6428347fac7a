package org.warmish.thermal.roi;

import org.warmish.thermal.model.StatisticsRecord;
import org.warmish.thermal.utilities.BoundingBox;

import java.awt.Color;
import java.util.Objects;
import java.util.UUID;

/**
 * A user-defined region of interest over the temperature field.
 *
 * <p>The hierarchy is closed: the only shapes are {@link RectangleRoi}, {@link SpotRoi} and
 * {@link PolygonRoi}, identified by {@link #getType()}. Identity ({@link #getId()}) is fixed
 * at creation; name, emissivity, colour and geometry are edited in place, normally through
 * {@link org.warmish.thermal.controller.RoiController} so that statistics stay current.</p>
 *
 * <p>The cached {@link StatisticsRecord} is replaced as a whole, so it is never partially
 * populated.</p>
 */
public abstract class Roi {
    public static final double DEFAULT_EMISSIVITY = 0.95;

    private final UUID id;
    private String name;
    private double emissivity;
    private Color color;
    private StatisticsRecord statistics = StatisticsRecord.empty();

    Roi(UUID id, String name, double emissivity, Color color) {
        this.id = Objects.requireNonNull(id, "id");
        setName(name);
        setEmissivity(emissivity);
        setColor(color);
    }

    public abstract RoiType getType();

    /**
     * @return axis-aligned extent of the shape in image coordinates
     */
    public abstract BoundingBox bounds();

    /**
     * Point-containment test in image coordinates. Boundaries count as inside for rectangles
     * and spots; polygons use the even-odd rule.
     */
    public abstract boolean contains(double x, double y);

    /**
     * Applies the fields of {@code update} that this shape understands.
     *
     * @return true if at least one field was applied
     * @throws IllegalArgumentException if an applicable value is invalid; nothing is changed
     */
    public abstract boolean applyGeometry(GeometryUpdate update);

    /**
     * Pixel mask of this shape over a {@code gridWidth x gridHeight} image.
     *
     * @throws MaskComputationException if no mask can be computed for this geometry
     */
    public RoiMask mask(int gridWidth, int gridHeight) throws MaskComputationException {
        return RoiMaskBuilder.build(this, gridWidth, gridHeight);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("ROI name must not be blank");
        }
        this.name = name;
    }

    public double getEmissivity() {
        return emissivity;
    }

    public void setEmissivity(double emissivity) {
        this.emissivity = checkEmissivity(emissivity);
    }

    public Color getColor() {
        return color;
    }

    public void setColor(Color color) {
        this.color = Objects.requireNonNull(color, "color");
    }

    public StatisticsRecord getStatistics() {
        return statistics;
    }

    public void setStatistics(StatisticsRecord statistics) {
        this.statistics = statistics == null ? StatisticsRecord.empty() : statistics;
    }

    static double checkEmissivity(double emissivity) {
        if (!(emissivity >= 0.0 && emissivity <= 1.0)) {
            throw new IllegalArgumentException("Emissivity must be in [0, 1]: " + emissivity);
        }
        return emissivity;
    }

    static double checkFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format("%s[%s '%s', e=%.2f, %s]", getClass().getSimpleName(), id, name, emissivity, bounds());
    }
}
