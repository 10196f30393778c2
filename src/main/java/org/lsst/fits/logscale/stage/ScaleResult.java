package org.lsst.fits.logscale.stage;

import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Output of the {@link ConditionalScaleStage}.
 */
public class ScaleResult {

    private final WorkingRaster raster;
    private final StageStatistics statistics;
    private final long rescaledCount;

    ScaleResult(WorkingRaster raster, StageStatistics statistics, long rescaledCount) {
        this.raster = raster;
        this.statistics = statistics;
        this.rescaledCount = rescaledCount;
    }

    public WorkingRaster getRaster() {
        return raster;
    }

    public StageStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return The number of elements which were below the threshold
     */
    public long getRescaledCount() {
        return rescaledCount;
    }
}
