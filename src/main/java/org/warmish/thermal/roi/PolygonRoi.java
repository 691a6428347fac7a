package org.warmish.thermal.roi;

import org.warmish.thermal.utilities.BoundingBox;

import java.awt.Color;
import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Polygon over an ordered vertex list. The ring is closed implicitly (last vertex joins the
 * first). With fewer than three vertices the polygon contains nothing.
 *
 * <p>Containment follows the even-odd rule: a horizontal ray to the right of the test point
 * toggles "inside" at each edge it crosses. Horizontal edges never count as a crossing.</p>
 */
public final class PolygonRoi extends Roi {
    private List<Point2D> vertices;

    public PolygonRoi(UUID id, String name, double emissivity, Color color, List<? extends Point2D> vertices) {
        super(id, name, emissivity, color);
        this.vertices = copyVertices(vertices);
    }

    @Override
    public RoiType getType() {
        return RoiType.POLYGON;
    }

    @Override
    public BoundingBox bounds() {
        if (vertices.isEmpty()) {
            return new BoundingBox(0, 0, 0, 0);
        }
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (Point2D p : vertices) {
            minX = Math.min(minX, p.getX());
            maxX = Math.max(maxX, p.getX());
            minY = Math.min(minY, p.getY());
            maxY = Math.max(maxY, p.getY());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    @Override
    public boolean contains(double x, double y) {
        if (vertices.size() < 3) {
            return false;
        }
        boolean inside = false;
        for (double crossing : crossings(y)) {
            if (x < crossing) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * X positions where the horizontal line at {@code y} crosses an edge, for edges whose
     * endpoints straddle {@code y}. The mask builder reuses this once per row.
     */
    double[] crossings(double y) {
        int n = vertices.size();
        double[] xs = new double[n];
        int count = 0;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = vertices.get(i).getX();
            double yi = vertices.get(i).getY();
            double xj = vertices.get(j).getX();
            double yj = vertices.get(j).getY();
            if (yi == yj) {
                continue;
            }
            if ((yi > y) != (yj > y)) {
                xs[count++] = (xj - xi) * (y - yi) / (yj - yi) + xi;
            }
        }
        double[] result = new double[count];
        System.arraycopy(xs, 0, result, 0, count);
        return result;
    }

    @Override
    public boolean applyGeometry(GeometryUpdate update) {
        if (update == null || update.getPoints() == null) {
            return false;
        }
        vertices = copyVertices(update.getPoints());
        return true;
    }

    /**
     * @return unmodifiable copy of the vertices in insertion order
     */
    public List<Point2D> getVertices() {
        List<Point2D> copy = new ArrayList<>(vertices.size());
        for (Point2D p : vertices) {
            copy.add(new Point2D.Double(p.getX(), p.getY()));
        }
        return Collections.unmodifiableList(copy);
    }

    public int getVertexCount() {
        return vertices.size();
    }

    private static List<Point2D> copyVertices(List<? extends Point2D> source) {
        if (source == null) {
            throw new IllegalArgumentException("Polygon vertices must not be null");
        }
        List<Point2D> copy = new ArrayList<>(source.size());
        for (Point2D p : source) {
            if (p == null) {
                throw new IllegalArgumentException("Polygon vertex must not be null");
            }
            copy.add(new Point2D.Double(checkFinite("vertex x", p.getX()), checkFinite("vertex y", p.getY())));
        }
        return copy;
    }
}
