package org.warmish.thermal.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Temperature statistics for one region.
 *
 * <p>A record is either complete (all five values finite) or empty (all absent); there is no
 * way to build a partially filled one. "Absent" is never reported as zero.</p>
 */
public final class StatisticsRecord {

    private static final StatisticsRecord EMPTY =
            new StatisticsRecord(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 0);

    private final double min;
    private final double max;
    private final double mean;
    private final double std;
    private final double median;
    private final int sampleCount;

    private StatisticsRecord(double min, double max, double mean, double std, double median, int sampleCount) {
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.std = std;
        this.median = median;
        this.sampleCount = sampleCount;
    }

    public static StatisticsRecord empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if any value is not finite or the count is not positive
     */
    public static StatisticsRecord of(double min, double max, double mean, double std, double median,
                                      int sampleCount) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || !Double.isFinite(mean)
                || !Double.isFinite(std) || !Double.isFinite(median)) {
            throw new IllegalArgumentException(String.format(
                    "Statistics must be all finite: min=%s max=%s mean=%s std=%s median=%s",
                    min, max, mean, std, median));
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("Sample count must be positive: " + sampleCount);
        }
        return new StatisticsRecord(min, max, mean, std, median, sampleCount);
    }

    public boolean isPresent() {
        return sampleCount > 0;
    }

    public OptionalDouble getMin() { return opt(min); }
    public OptionalDouble getMax() { return opt(max); }
    public OptionalDouble getMean() { return opt(mean); }
    public OptionalDouble getStd() { return opt(std); }
    public OptionalDouble getMedian() { return opt(median); }

    /**
     * @return number of non-missing samples the values were computed from, 0 when empty
     */
    public int getSampleCount() {
        return sampleCount;
    }

    private OptionalDouble opt(double v) {
        return isPresent() ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatisticsRecord other)) return false;
        return sampleCount == other.sampleCount
                && Double.compare(min, other.min) == 0
                && Double.compare(max, other.max) == 0
                && Double.compare(mean, other.mean) == 0
                && Double.compare(std, other.std) == 0
                && Double.compare(median, other.median) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, mean, std, median, sampleCount);
    }

    @Override
    public String toString() {
        if (!isPresent()) {
            return "StatisticsRecord[empty]";
        }
        return String.format("StatisticsRecord[min=%.2f, max=%.2f, mean=%.2f, std=%.3f, median=%.2f, n=%d]",
                min, max, mean, std, median, sampleCount);
    }
}
