package org.lsst.fits.logscale;

import java.nio.ShortBuffer;
import java.util.Random;
import org.lsst.fits.logscale.raster.SourceRaster;

/**
 * Simulated sensor data, uniformly distributed over the full unsigned 16 bit
 * range.
 */
public class UniformRasterGenerator implements RasterGenerator {

    @Override
    public SourceRaster generate(int width, int height, long seed) {
        Random random = new Random(seed);
        ShortBuffer buffer = ShortBuffer.allocate(width * height);
        while (buffer.hasRemaining()) {
            buffer.put((short) random.nextInt(SourceRaster.MAX_VALUE + 1));
        }
        buffer.flip();
        return new SourceRaster(width, height, buffer);
    }
}
