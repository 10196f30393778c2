package org.lsst.fits.logscale;

import org.lsst.fits.logscale.raster.Precision;

/**
 * Estimates the memory a run will need before any raster is allocated.
 */
public class MemoryEstimator {

    private static final int SOURCE_BYTES = Short.BYTES;
    private static final int OUTPUT_BYTES = Byte.BYTES;

    private MemoryEstimator() {
    }

    public static MemoryEstimate estimate(PipelineConfig config) {
        return estimate(config.getSize(), config.getPrecision());
    }

    static MemoryEstimate estimate(long elements, Precision precision) {
        return new MemoryEstimate(elements * SOURCE_BYTES, elements * precision.getBytes(), elements * OUTPUT_BYTES);
    }
}
