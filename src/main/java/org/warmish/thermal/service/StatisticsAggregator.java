package org.warmish.thermal.service;

import org.warmish.thermal.model.StatisticsRecord;
import org.warmish.thermal.model.TemperatureField;
import org.warmish.thermal.roi.RoiMask;

import java.util.Arrays;

/**
 * Summary statistics over the non-missing temperatures selected by a mask.
 *
 * <p>Missing (NaN) and non-finite samples are dropped first. If nothing remains the result is
 * {@link StatisticsRecord#empty()}; otherwise min, max, arithmetic mean, population standard
 * deviation (divisor N) and median (mean of the two middle values for even N) are all
 * reported.</p>
 */
public final class StatisticsAggregator {

    private StatisticsAggregator() {
    }

    /**
     * @throws IllegalArgumentException if the mask and field have different shapes
     */
    public static StatisticsRecord aggregate(TemperatureField field, RoiMask mask) {
        if (field.getWidth() != mask.getWidth() || field.getHeight() != mask.getHeight()) {
            throw new IllegalArgumentException(String.format("Mask %dx%d does not match field %dx%d",
                    mask.getWidth(), mask.getHeight(), field.getWidth(), field.getHeight()));
        }
        if (mask.isEmpty()) {
            return StatisticsRecord.empty();
        }
        return aggregate(field.valuesAt(mask.getIndices()));
    }

    /**
     * Aggregates an already-selected sample. The array is not modified.
     */
    public static StatisticsRecord aggregate(double[] samples) {
        if (samples == null || samples.length == 0) {
            return StatisticsRecord.empty();
        }
        double[] valid = Arrays.stream(samples).filter(Double::isFinite).toArray();
        int n = valid.length;
        if (n == 0) {
            return StatisticsRecord.empty();
        }

        Arrays.sort(valid);
        double sum = 0.0;
        for (double v : valid) {
            sum += v;
        }
        double mean = sum / n;

        double squares = 0.0;
        for (double v : valid) {
            double d = v - mean;
            squares += d * d;
        }
        double std = Math.sqrt(squares / n);

        double median = n % 2 == 1
                ? valid[n / 2]
                : (valid[n / 2 - 1] + valid[n / 2]) / 2.0;

        return StatisticsRecord.of(valid[0], valid[n - 1], mean, std, median, n);
    }
}
