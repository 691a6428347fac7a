package org.warmish.thermal.roi;

import org.warmish.thermal.utilities.BoundingBox;

import java.awt.Color;
import java.util.UUID;

/**
 * Circular spot given by its centre and radius. The circle's edge is part of the spot.
 */
public final class SpotRoi extends Roi {
    private double centerX;
    private double centerY;
    private double radius;

    public SpotRoi(UUID id, String name, double emissivity, Color color,
                   double centerX, double centerY, double radius) {
        super(id, name, emissivity, color);
        this.centerX = checkFinite("x", centerX);
        this.centerY = checkFinite("y", centerY);
        this.radius = checkRadius(radius);
    }

    @Override
    public RoiType getType() {
        return RoiType.SPOT;
    }

    @Override
    public BoundingBox bounds() {
        return new BoundingBox(centerX - radius, centerY - radius, centerX + radius, centerY + radius);
    }

    @Override
    public boolean contains(double x, double y) {
        return covers(x, y);
    }

    /**
     * Squared-distance test shared with the mask builder so both agree on boundary pixels.
     */
    boolean covers(double x, double y) {
        double dx = x - centerX;
        double dy = y - centerY;
        return dx * dx + dy * dy <= radius * radius;
    }

    @Override
    public boolean applyGeometry(GeometryUpdate update) {
        if (update == null) {
            return false;
        }
        Double nx = update.getX() == null ? null : checkFinite("x", update.getX());
        Double ny = update.getY() == null ? null : checkFinite("y", update.getY());
        Double nr = update.getRadius() == null ? null : checkRadius(update.getRadius());

        boolean applied = false;
        if (nx != null) { centerX = nx; applied = true; }
        if (ny != null) { centerY = ny; applied = true; }
        if (nr != null) { radius = nr; applied = true; }
        return applied;
    }

    public double getCenterX() { return centerX; }
    public double getCenterY() { return centerY; }
    public double getRadius() { return radius; }

    private static double checkRadius(double radius) {
        if (!Double.isFinite(radius) || radius <= 0) {
            throw new IllegalArgumentException("Spot radius must be a finite value > 0: " + radius);
        }
        return radius;
    }
}
