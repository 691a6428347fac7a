package org.warmish.thermal.roi;

import org.warmish.thermal.utilities.BoundingBox;

import java.awt.Color;
import java.util.UUID;

/**
 * Axis-aligned rectangle given by its top-left corner and size.
 */
public final class RectangleRoi extends Roi {
    private double x;
    private double y;
    private double width;
    private double height;

    public RectangleRoi(UUID id, String name, double emissivity, Color color,
                        double x, double y, double width, double height) {
        super(id, name, emissivity, color);
        this.x = checkFinite("x", x);
        this.y = checkFinite("y", y);
        this.width = checkSize("width", width);
        this.height = checkSize("height", height);
    }

    @Override
    public RoiType getType() {
        return RoiType.RECTANGLE;
    }

    @Override
    public BoundingBox bounds() {
        return new BoundingBox(x, y, x + width, y + height);
    }

    @Override
    public boolean contains(double px, double py) {
        return px >= x && px <= x + width && py >= y && py <= y + height;
    }

    @Override
    public boolean applyGeometry(GeometryUpdate update) {
        if (update == null) {
            return false;
        }
        // Validate everything first so a bad value leaves the ROI untouched
        Double nx = update.getX() == null ? null : checkFinite("x", update.getX());
        Double ny = update.getY() == null ? null : checkFinite("y", update.getY());
        Double nw = update.getWidth() == null ? null : checkSize("width", update.getWidth());
        Double nh = update.getHeight() == null ? null : checkSize("height", update.getHeight());

        boolean applied = false;
        if (nx != null) { x = nx; applied = true; }
        if (ny != null) { y = ny; applied = true; }
        if (nw != null) { width = nw; applied = true; }
        if (nh != null) { height = nh; applied = true; }
        return applied;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getWidth() { return width; }
    public double getHeight() { return height; }

    private static double checkSize(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException("Rectangle " + field + " must be a finite value >= 0: " + value);
        }
        return value;
    }
}
