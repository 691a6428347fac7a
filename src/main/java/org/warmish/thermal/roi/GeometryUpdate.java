package org.warmish.thermal.roi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partial geometry edit for a ROI (move, resize or reshape).
 *
 * <p>Every field is optional. Each ROI shape applies only the fields it understands and
 * ignores the rest:</p>
 * <ul>
 *   <li>Rectangle: {@code x}, {@code y} (top-left), {@code width}, {@code height}</li>
 *   <li>Spot: {@code x}, {@code y} (centre), {@code radius}</li>
 *   <li>Polygon: {@code points}</li>
 * </ul>
 *
 * <pre>{@code
 * GeometryUpdate move = new GeometryUpdate.Builder().x(40).y(12).build();
 * controller.updateGeometry(roiId, move);
 * }</pre>
 */
public final class GeometryUpdate {
    private final Double x;
    private final Double y;
    private final Double width;
    private final Double height;
    private final Double radius;
    private final List<Point2D> points;

    private GeometryUpdate(Builder builder) {
        this.x = builder.x;
        this.y = builder.y;
        this.width = builder.width;
        this.height = builder.height;
        this.radius = builder.radius;
        this.points = builder.points == null ? null : Collections.unmodifiableList(builder.points);
    }

    public Double getX() { return x; }
    public Double getY() { return y; }
    public Double getWidth() { return width; }
    public Double getHeight() { return height; }
    public Double getRadius() { return radius; }

    /**
     * @return replacement vertex list, or null when the vertices are not being edited
     */
    public List<Point2D> getPoints() { return points; }

    public boolean isEmpty() {
        return x == null && y == null && width == null && height == null && radius == null && points == null;
    }

    @Override
    public String toString() {
        return String.format("GeometryUpdate[x=%s, y=%s, width=%s, height=%s, radius=%s, points=%s]",
                x, y, width, height, radius, points == null ? null : points.size());
    }

    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private Double x;
        private Double y;
        private Double width;
        private Double height;
        private Double radius;
        private List<Point2D> points;

        public Builder x(double x) {
            this.x = x;
            return this;
        }

        public Builder y(double y) {
            this.y = y;
            return this;
        }

        public Builder width(double width) {
            this.width = width;
            return this;
        }

        public Builder height(double height) {
            this.height = height;
            return this;
        }

        public Builder radius(double radius) {
            this.radius = radius;
            return this;
        }

        /**
         * Replaces the polygon vertices. The list is copied.
         */
        public Builder points(List<? extends Point2D> points) {
            if (points == null) {
                logger.warn("Ignoring null vertex list in geometry update");
                return this;
            }
            this.points = new ArrayList<>();
            for (Point2D p : points) {
                this.points.add(new Point2D.Double(p.getX(), p.getY()));
            }
            return this;
        }

        public GeometryUpdate build() {
            GeometryUpdate update = new GeometryUpdate(this);
            if (update.isEmpty()) {
                logger.debug("Built an empty geometry update");
            }
            return update;
        }
    }
}
