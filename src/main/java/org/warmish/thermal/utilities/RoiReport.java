package org.warmish.thermal.utilities;

import com.google.gson.annotations.SerializedName;
import org.warmish.thermal.model.StatisticsRecord;
import org.warmish.thermal.roi.Roi;

/**
 * Row of the detailed ROI export: identity, emissivity, computed statistics and the number
 * of pixels in the ROI's mask. Absent statistics are written as JSON {@code null}.
 */
public class RoiReport {
    private final String name;
    private final String type;
    private final double emissivity;
    @SerializedName("temp_min")
    private final Double tempMin;
    @SerializedName("temp_max")
    private final Double tempMax;
    @SerializedName("temp_mean")
    private final Double tempMean;
    @SerializedName("temp_median")
    private final Double tempMedian;
    @SerializedName("temp_std")
    private final Double tempStd;
    @SerializedName("pixel_count")
    private final int pixelCount;

    public RoiReport(Roi roi, int pixelCount) {
        StatisticsRecord stats = roi.getStatistics();
        this.name = roi.getName();
        this.type = roi.getType().getLabel();
        this.emissivity = roi.getEmissivity();
        this.tempMin = stats.isPresent() ? stats.getMin().getAsDouble() : null;
        this.tempMax = stats.isPresent() ? stats.getMax().getAsDouble() : null;
        this.tempMean = stats.isPresent() ? stats.getMean().getAsDouble() : null;
        this.tempMedian = stats.isPresent() ? stats.getMedian().getAsDouble() : null;
        this.tempStd = stats.isPresent() ? stats.getStd().getAsDouble() : null;
        this.pixelCount = pixelCount;
    }

    public String getName() { return name; }
    public String getType() { return type; }
    public double getEmissivity() { return emissivity; }
    public Double getTempMin() { return tempMin; }
    public Double getTempMax() { return tempMax; }
    public Double getTempMean() { return tempMean; }
    public Double getTempMedian() { return tempMedian; }
    public Double getTempStd() { return tempStd; }
    public int getPixelCount() { return pixelCount; }
}
