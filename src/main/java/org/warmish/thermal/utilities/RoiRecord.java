package org.warmish.thermal.utilities;

import org.warmish.thermal.roi.PolygonRoi;
import org.warmish.thermal.roi.RectangleRoi;
import org.warmish.thermal.roi.Roi;
import org.warmish.thermal.roi.SpotRoi;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the exported ROI list:
 * {@code {type, name, emissivity, <geometry fields for that type>}}.
 *
 * <p>Rectangles carry {@code x, y, width, height}; spots carry {@code x, y} (centre) and
 * {@code radius}; polygons carry {@code points}. Fields that do not apply are null and are
 * left out of the JSON.</p>
 */
public class RoiRecord {
    private String type;
    private String name;
    private Double emissivity;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Double radius;
    private List<Point2D> points;

    public RoiRecord() {
    }

    public static RoiRecord rectangle(String name, double emissivity, double x, double y, double width, double height) {
        RoiRecord r = new RoiRecord();
        r.type = "Rectangle";
        r.name = name;
        r.emissivity = emissivity;
        r.x = x;
        r.y = y;
        r.width = width;
        r.height = height;
        return r;
    }

    public static RoiRecord spot(String name, double emissivity, double x, double y, double radius) {
        RoiRecord r = new RoiRecord();
        r.type = "Spot";
        r.name = name;
        r.emissivity = emissivity;
        r.x = x;
        r.y = y;
        r.radius = radius;
        return r;
    }

    public static RoiRecord polygon(String name, double emissivity, List<? extends Point2D> points) {
        RoiRecord r = new RoiRecord();
        r.type = "Polygon";
        r.name = name;
        r.emissivity = emissivity;
        r.points = new ArrayList<>(points);
        return r;
    }

    /**
     * Snapshot of a live ROI's identity-free fields.
     */
    public static RoiRecord from(Roi roi) {
        return switch (roi.getType()) {
            case RECTANGLE -> {
                RectangleRoi rect = (RectangleRoi) roi;
                yield rectangle(rect.getName(), rect.getEmissivity(),
                        rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight());
            }
            case SPOT -> {
                SpotRoi spot = (SpotRoi) roi;
                yield spot(spot.getName(), spot.getEmissivity(),
                        spot.getCenterX(), spot.getCenterY(), spot.getRadius());
            }
            case POLYGON -> {
                PolygonRoi polygon = (PolygonRoi) roi;
                yield polygon(polygon.getName(), polygon.getEmissivity(), polygon.getVertices());
            }
        };
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Double getEmissivity() { return emissivity; }
    public void setEmissivity(Double emissivity) { this.emissivity = emissivity; }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public Double getWidth() { return width; }
    public void setWidth(Double width) { this.width = width; }

    public Double getHeight() { return height; }
    public void setHeight(Double height) { this.height = height; }

    public Double getRadius() { return radius; }
    public void setRadius(Double radius) { this.radius = radius; }

    public List<Point2D> getPoints() { return points; }
    public void setPoints(List<Point2D> points) { this.points = points; }

    @Override
    public String toString() {
        return "RoiRecord[" + type + " '" + name + "']";
    }
}
