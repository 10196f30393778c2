package org.lsst.fits.logscale.stage;

import org.lsst.fits.logscale.raster.QuantizedRaster;
import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Output of the {@link NormalizeStage}. The statistics describe the output
 * levels, while the input minimum and maximum give the range that was mapped
 * onto them (NaN if there was no valid input).
 */
public class NormalizeResult {

    private final QuantizedRaster raster;
    private final StageStatistics statistics;
    private final double inputMinimum;
    private final double inputMaximum;
    private final DataCondition condition;

    NormalizeResult(QuantizedRaster raster, StageStatistics statistics, double inputMinimum, double inputMaximum, DataCondition condition) {
        this.raster = raster;
        this.statistics = statistics;
        this.inputMinimum = inputMinimum;
        this.inputMaximum = inputMaximum;
        this.condition = condition;
    }

    public QuantizedRaster getRaster() {
        return raster;
    }

    public StageStatistics getStatistics() {
        return statistics;
    }

    public double getInputMinimum() {
        return inputMinimum;
    }

    public double getInputMaximum() {
        return inputMaximum;
    }

    public DataCondition getCondition() {
        return condition;
    }

    public int getOutputMinimum() {
        return (int) statistics.getMinimum();
    }

    public int getOutputMaximum() {
        return (int) statistics.getMaximum();
    }
}
