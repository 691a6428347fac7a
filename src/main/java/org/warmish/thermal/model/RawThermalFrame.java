package org.warmish.thermal.model;

import java.util.Arrays;

/**
 * Grid of uncalibrated sensor counts for one thermal image, stored row-major.
 *
 * <p>Counts are non-negative and already in native order; decoding from a camera payload
 * with a foreign byte order is done by
 * {@link org.warmish.thermal.utilities.RawFrameDecoder}. Instances are immutable.</p>
 */
public final class RawThermalFrame {
    private final int width;
    private final int height;
    private final int[] counts;

    private RawThermalFrame(int width, int height, int[] counts) {
        this.width = width;
        this.height = height;
        this.counts = counts;
    }

    /**
     * Creates a frame from row-major counts. The array is copied.
     *
     * @throws IllegalArgumentException if the dimensions are not positive, the array length does
     *                                  not match, or any count is negative
     */
    public static RawThermalFrame of(int width, int height, int[] counts) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        if (counts == null || counts.length != width * height) {
            throw new IllegalArgumentException(String.format("Expected %d counts for a %dx%d frame, got %s",
                    width * height, width, height, counts == null ? "null" : String.valueOf(counts.length)));
        }
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] < 0) {
                throw new IllegalArgumentException("Negative sensor count " + counts[i] + " at index " + i);
            }
        }
        return new RawThermalFrame(width, height, counts.clone());
    }

    /**
     * Creates a frame from a {@code [row][column]} array. All rows must have the same length.
     */
    public static RawThermalFrame of(int[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null) {
            throw new IllegalArgumentException("Frame rows must not be empty");
        }
        int h = rows.length;
        int w = rows[0].length;
        int[] flat = new int[w * h];
        for (int y = 0; y < h; y++) {
            if (rows[y] == null || rows[y].length != w) {
                throw new IllegalArgumentException("Row " + y + " does not have " + w + " columns");
            }
            System.arraycopy(rows[y], 0, flat, y * w, w);
        }
        return of(w, h, flat);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getCount(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return counts[y * width + x];
    }

    /**
     * Counts at the given flat indices, in index order, as doubles ready for conversion.
     */
    public double[] samplesAt(int[] indices) {
        double[] samples = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            samples[i] = counts[indices[i]];
        }
        return samples;
    }

    /**
     * @return a copy of the row-major counts
     */
    public int[] getCounts() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawThermalFrame other)) return false;
        return width == other.width && height == other.height && Arrays.equals(counts, other.counts);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return String.format("RawThermalFrame[%dx%d]", width, height);
    }
}
