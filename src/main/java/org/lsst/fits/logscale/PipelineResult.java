package org.lsst.fits.logscale;

import org.lsst.fits.logscale.raster.QuantizedRaster;
import org.lsst.fits.logscale.raster.ValidityMask;
import org.lsst.fits.logscale.stage.DataCondition;
import org.lsst.fits.logscale.stats.StatsCollector;

/**
 * Everything a completed run hands to the rendering and reporting code.
 */
public class PipelineResult {

    private final PipelineConfig config;
    private final MemoryEstimate memoryEstimate;
    private final QuantizedRaster output;
    private final ValidityMask validityMask;
    private final StatsCollector statistics;
    private final long rescaledCount;
    private final double normalizedRangeMinimum;
    private final double normalizedRangeMaximum;
    private final DataCondition condition;

    PipelineResult(PipelineConfig config, MemoryEstimate memoryEstimate, QuantizedRaster output, ValidityMask validityMask,
            StatsCollector statistics, long rescaledCount, double normalizedRangeMinimum, double normalizedRangeMaximum, DataCondition condition) {
        this.config = config;
        this.memoryEstimate = memoryEstimate;
        this.output = output;
        this.validityMask = validityMask;
        this.statistics = statistics;
        this.rescaledCount = rescaledCount;
        this.normalizedRangeMinimum = normalizedRangeMinimum;
        this.normalizedRangeMaximum = normalizedRangeMaximum;
        this.condition = condition;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public MemoryEstimate getMemoryEstimate() {
        return memoryEstimate;
    }

    public QuantizedRaster getOutput() {
        return output;
    }

    public ValidityMask getValidityMask() {
        return validityMask;
    }

    public StatsCollector getStatistics() {
        return statistics;
    }

    public long getRescaledCount() {
        return rescaledCount;
    }

    /**
     * @return The scaled value mapped to level 0, NaN if there was no valid data
     */
    public double getNormalizedRangeMinimum() {
        return normalizedRangeMinimum;
    }

    /**
     * @return The scaled value mapped to level 255, NaN if there was no valid data
     */
    public double getNormalizedRangeMaximum() {
        return normalizedRangeMaximum;
    }

    public DataCondition getCondition() {
        return condition;
    }
}
