package org.warmish.thermal.roi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.warmish.thermal.utilities.BoundingBox;

import java.util.BitSet;

/**
 * Builds {@link RoiMask}s for every ROI shape.
 *
 * <p>Pixel {@code (x, y)} is the cell {@code [x, x+1) x [y, y+1)} of the image.</p>
 * <ul>
 *   <li><strong>Rectangle:</strong> every cell touched by the rectangle's area. Bounds are
 *       clipped to {@code [0, width) x [0, height)} with floor on the low edge and ceil on the
 *       high edge; a clipped window with {@code x1 >= x2} or {@code y1 >= y2} selects nothing.</li>
 *   <li><strong>Spot and polygon:</strong> the shape's containment test evaluated at each
 *       integer coordinate inside the clipped bounds, endpoints included.</li>
 * </ul>
 *
 * <p>Polygons are rasterised row by row: edge crossings are computed once per row and
 * applied to every column, which gives the same answer as {@link PolygonRoi#contains}.</p>
 */
public final class RoiMaskBuilder {
    private static final Logger logger = LoggerFactory.getLogger(RoiMaskBuilder.class);

    private RoiMaskBuilder() {
    }

    /**
     * @throws MaskComputationException if the grid is not positive-sized or the ROI's bounds
     *                                  are not finite
     */
    public static RoiMask build(Roi roi, int gridWidth, int gridHeight) throws MaskComputationException {
        if (roi == null) {
            throw new MaskComputationException("Cannot build a mask for a null ROI");
        }
        if (gridWidth <= 0 || gridHeight <= 0) {
            throw new MaskComputationException(
                    String.format("Invalid grid %dx%d for ROI '%s'", gridWidth, gridHeight, roi.getName()));
        }
        BoundingBox bounds = roi.bounds();
        if (!bounds.isFinite()) {
            throw new MaskComputationException("Non-finite bounds " + bounds + " for ROI '" + roi.getName() + "'");
        }

        RoiMask mask = switch (roi.getType()) {
            case RECTANGLE -> rectangle(bounds, gridWidth, gridHeight);
            case SPOT -> spot((SpotRoi) roi, bounds, gridWidth, gridHeight);
            case POLYGON -> polygon((PolygonRoi) roi, bounds, gridWidth, gridHeight);
        };
        logger.trace("Mask for '{}': {}", roi.getName(), mask);
        return mask;
    }

    private static RoiMask rectangle(BoundingBox bounds, int w, int h) {
        int x1 = (int) Math.max(0, Math.floor(bounds.getMinX()));
        int y1 = (int) Math.max(0, Math.floor(bounds.getMinY()));
        int x2 = (int) Math.min(w, Math.ceil(bounds.getMaxX()));
        int y2 = (int) Math.min(h, Math.ceil(bounds.getMaxY()));
        if (x1 >= x2 || y1 >= y2) {
            return emptyFor(bounds, w, h);
        }
        BitSet bits = new BitSet(w * h);
        for (int y = y1; y < y2; y++) {
            bits.set(y * w + x1, y * w + x2);
        }
        return new RoiMask(w, h, bits);
    }

    private static RoiMask spot(SpotRoi spot, BoundingBox bounds, int w, int h) {
        Window win = Window.closed(bounds, w, h);
        if (win == null) {
            return emptyFor(bounds, w, h);
        }
        BitSet bits = new BitSet(w * h);
        for (int y = win.y1; y <= win.y2; y++) {
            for (int x = win.x1; x <= win.x2; x++) {
                if (spot.covers(x, y)) {
                    bits.set(y * w + x);
                }
            }
        }
        return new RoiMask(w, h, bits);
    }

    private static RoiMask polygon(PolygonRoi polygon, BoundingBox bounds, int w, int h) {
        if (polygon.getVertexCount() < 3) {
            return RoiMask.empty(w, h, RoiMask.Coverage.DEGENERATE);
        }
        Window win = Window.closed(bounds, w, h);
        if (win == null) {
            return emptyFor(bounds, w, h);
        }
        BitSet bits = new BitSet(w * h);
        for (int y = win.y1; y <= win.y2; y++) {
            double[] crossings = polygon.crossings(y);
            if (crossings.length == 0) {
                continue;
            }
            for (int x = win.x1; x <= win.x2; x++) {
                boolean inside = false;
                for (double c : crossings) {
                    if (x < c) {
                        inside = !inside;
                    }
                }
                if (inside) {
                    bits.set(y * w + x);
                }
            }
        }
        return new RoiMask(w, h, bits);
    }

    private static RoiMask emptyFor(BoundingBox bounds, int w, int h) {
        RoiMask.Coverage coverage = bounds.intersects(w, h)
                ? RoiMask.Coverage.DEGENERATE
                : RoiMask.Coverage.OUTSIDE_IMAGE;
        return RoiMask.empty(w, h, coverage);
    }

    /**
     * Inclusive integer window of grid coordinates inside closed bounds.
     */
    private record Window(int x1, int y1, int x2, int y2) {
        static Window closed(BoundingBox bounds, int w, int h) {
            int x1 = (int) Math.ceil(Math.max(0, bounds.getMinX()));
            int y1 = (int) Math.ceil(Math.max(0, bounds.getMinY()));
            int x2 = (int) Math.floor(Math.min(w - 1, bounds.getMaxX()));
            int y2 = (int) Math.floor(Math.min(h - 1, bounds.getMaxY()));
            if (x1 > x2 || y1 > y2) {
                return null;
            }
            return new Window(x1, y1, x2, y2);
        }
    }
}
