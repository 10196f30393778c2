package org.lsst.fits.logscale;

import org.lsst.fits.logscale.raster.SourceRaster;

/**
 * Supplies the raw samples for a run. Implementations must be deterministic
 * for a given seed.
 */
public interface RasterGenerator {

    SourceRaster generate(int width, int height, long seed);

    default SourceRaster generate(PipelineConfig config) {
        return generate(config.getWidth(), config.getHeight(), config.getSeed());
    }
}
