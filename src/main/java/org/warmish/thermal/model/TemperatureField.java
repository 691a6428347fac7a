package org.warmish.thermal.model;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Per-pixel temperatures in degrees Celsius, row-major, the same shape as the
 * {@link RawThermalFrame} they were computed from.
 *
 * <p>Entries are {@link Double#NaN} where the inversion is undefined. A field is never
 * modified after construction; a new calibration produces a new field.</p>
 *
 * <p>A field produced from an invalid calibration is flagged by
 * {@link #isCalibrationFailure()}: every entry is missing and {@link #getFailureReason()}
 * names the offending parameters. Such a field must not be read as "all temperatures
 * unknown for physical reasons".</p>
 */
public final class TemperatureField {
    private final int width;
    private final int height;
    private final double[] celsius;
    private final String failureReason;

    // Cached over non-missing entries; NaN when none
    private final double min;
    private final double max;
    private final int validCount;

    private TemperatureField(int width, int height, double[] celsius, String failureReason) {
        this.width = width;
        this.height = height;
        this.celsius = celsius;
        this.failureReason = failureReason;

        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        int valid = 0;
        for (double v : celsius) {
            if (Double.isNaN(v)) {
                continue;
            }
            valid++;
            if (v < lo) lo = v;
            if (v > hi) hi = v;
        }
        this.validCount = valid;
        this.min = valid > 0 ? lo : Double.NaN;
        this.max = valid > 0 ? hi : Double.NaN;
    }

    /**
     * Wraps freshly computed values. The array is taken over, not copied; callers must not keep
     * a reference to it.
     */
    public static TemperatureField of(int width, int height, double[] celsius) {
        if (celsius == null || celsius.length != width * height) {
            throw new IllegalArgumentException("Temperature array does not match " + width + "x" + height);
        }
        return new TemperatureField(width, height, celsius, null);
    }

    /**
     * All-missing field marking a conversion aborted because of invalid calibration.
     */
    public static TemperatureField calibrationFailure(int width, int height, String reason) {
        double[] values = new double[width * height];
        Arrays.fill(values, Double.NaN);
        return new TemperatureField(width, height, values,
                reason == null || reason.isBlank() ? "invalid calibration" : reason);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return celsius[y * width + x];
    }

    /**
     * Temperature under a pixel, or NaN outside the grid or where the value is missing.
     */
    public double valueAt(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            return Double.NaN;
        }
        return celsius[y * width + x];
    }

    /**
     * Values at the given flat indices, in index order.
     */
    public double[] valuesAt(int[] indices) {
        double[] out = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            out[i] = celsius[indices[i]];
        }
        return out;
    }

    /**
     * @return minimum over non-missing entries, empty if every entry is missing
     */
    public OptionalDouble getMin() {
        return validCount > 0 ? OptionalDouble.of(min) : OptionalDouble.empty();
    }

    /**
     * @return maximum over non-missing entries, empty if every entry is missing
     */
    public OptionalDouble getMax() {
        return validCount > 0 ? OptionalDouble.of(max) : OptionalDouble.empty();
    }

    /**
     * {min, max} for presentation code. Falls back to the {0, 0} sentinel when the range is
     * undefined; engine code should use {@link #getMin()} and {@link #getMax()} instead.
     */
    public double[] getDisplayRange() {
        return validCount > 0 ? new double[]{min, max} : new double[]{0.0, 0.0};
    }

    public int getValidCount() {
        return validCount;
    }

    public boolean isCalibrationFailure() {
        return failureReason != null;
    }

    /**
     * @return why the conversion was aborted, or null for a normal field
     */
    public String getFailureReason() {
        return failureReason;
    }

    /**
     * Returns a new field with {@code offset} added to every non-missing entry.
     */
    public TemperatureField shifted(double offset) {
        if (offset == 0.0 || isCalibrationFailure()) {
            return this;
        }
        double[] copy = new double[celsius.length];
        for (int i = 0; i < celsius.length; i++) {
            copy[i] = celsius[i] + offset;
        }
        return new TemperatureField(width, height, copy, null);
    }

    /**
     * @return a copy of the row-major values
     */
    public double[] toArray() {
        return celsius.clone();
    }

    @Override
    public String toString() {
        if (isCalibrationFailure()) {
            return String.format("TemperatureField[%dx%d, calibration failure: %s]", width, height, failureReason);
        }
        return String.format("TemperatureField[%dx%d, valid=%d]", width, height, validCount);
    }
}
