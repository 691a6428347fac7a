package org.warmish.thermal.roi;

import java.util.BitSet;

/**
 * Boolean pixel mask of a ROI over an image grid, stored as a bit set of row-major indices.
 *
 * <p>An empty mask is a normal result, not an error. {@link #getCoverage()} tells the two
 * empty cases apart: the ROI lies entirely outside the image, or it clips to no pixels
 * (zero area, fewer than three polygon vertices, a spot between pixel centres).</p>
 */
public final class RoiMask {

    public enum Coverage {
        /** At least one pixel is set. */
        PIXELS,
        /** The ROI's bounds do not overlap the image at all. */
        OUTSIDE_IMAGE,
        /** The ROI overlaps the image but selects no pixel. */
        DEGENERATE
    }

    private final int width;
    private final int height;
    private final BitSet bits;
    private final Coverage coverage;

    RoiMask(int width, int height, BitSet bits) {
        this.width = width;
        this.height = height;
        this.bits = bits;
        this.coverage = bits.isEmpty() ? Coverage.DEGENERATE : Coverage.PIXELS;
    }

    private RoiMask(int width, int height, Coverage coverage) {
        this.width = width;
        this.height = height;
        this.bits = new BitSet();
        this.coverage = coverage;
    }

    static RoiMask empty(int width, int height, Coverage coverage) {
        return new RoiMask(width, height, coverage);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Coverage getCoverage() {
        return coverage;
    }

    public boolean isEmpty() {
        return coverage != Coverage.PIXELS;
    }

    public int getPixelCount() {
        return bits.cardinality();
    }

    public boolean isSet(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            return false;
        }
        return bits.get(y * width + x);
    }

    /**
     * @return row-major indices of the selected pixels, ascending
     */
    public int[] getIndices() {
        return bits.stream().toArray();
    }

    @Override
    public String toString() {
        return String.format("RoiMask[%dx%d, %s, pixels=%d]", width, height, coverage, getPixelCount());
    }
}
