package org.lsst.fits.logscale.stage;

import org.lsst.fits.logscale.raster.ValidityMask;
import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Output of the {@link LogTransformStage}.
 */
public class LogTransformResult {

    private final WorkingRaster raster;
    private final ValidityMask mask;
    private final StageStatistics statistics;

    LogTransformResult(WorkingRaster raster, ValidityMask mask, StageStatistics statistics) {
        this.raster = raster;
        this.mask = mask;
        this.statistics = statistics;
    }

    public WorkingRaster getRaster() {
        return raster;
    }

    public ValidityMask getMask() {
        return mask;
    }

    public StageStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return <code>true</code> if no sample was positive
     */
    public boolean isAllInvalid() {
        return !statistics.hasValidData();
    }
}
