package org.warmish.thermal.utilities;

/**
 * Represents a rectangular bounding box defined by two corner points, in image pixel
 * coordinates.
 *
 * <p>This immutable data class is what every ROI reports from {@code bounds()} and what the
 * mask builder clips against the image grid. Corner order does not matter; use the
 * min/max accessors.</p>
 *
 * <h3>Usage Examples</h3>
 * <pre>{@code
 * // Rectangle ROI at (-5,-5), 10 x 10
 * BoundingBox bbox = new BoundingBox(-5, -5, 5, 5);
 *
 * double left = bbox.getMinX();     // -5.0
 * double width = bbox.getWidth();   // 10.0
 *
 * // Fully outside a 20 x 20 frame?
 * boolean outside = !bbox.intersects(20, 20);   // false
 * }</pre>
 *
 * <h3>Constraints</h3>
 * <ul>
 *   <li><strong>No validation:</strong> coordinates may be negative or beyond the image;
 *       clipping is the caller's job</li>
 *   <li><strong>Immutable:</strong> all coordinate values are final</li>
 *   <li><strong>Order independent:</strong> corner points can be specified in any order</li>
 * </ul>
 */
public class BoundingBox {
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;

    public BoundingBox(double x1, double y1, double x2, double y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public double getMinX() { return Math.min(x1, x2); }
    public double getMaxX() { return Math.max(x1, x2); }
    public double getMinY() { return Math.min(y1, y2); }
    public double getMaxY() { return Math.max(y1, y2); }

    public double getWidth() { return Math.abs(x2 - x1); }
    public double getHeight() { return Math.abs(y2 - y1); }

    /**
     * @return true if all four coordinates are finite numbers
     */
    public boolean isFinite() {
        return Double.isFinite(x1) && Double.isFinite(y1) && Double.isFinite(x2) && Double.isFinite(y2);
    }

    /**
     * Tests whether this box reaches into the pixel area {@code [0,width) x [0,height)}.
     *
     * @param width  grid width in pixels
     * @param height grid height in pixels
     * @return false when the box lies entirely to one side of the grid
     */
    public boolean intersects(int width, int height) {
        return getMaxX() > 0 && getMaxY() > 0 && getMinX() < width && getMinY() < height;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[(%.2f, %.2f) - (%.2f, %.2f)]", getMinX(), getMinY(), getMaxX(), getMaxY());
    }
}
