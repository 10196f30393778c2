package org.lsst.fits.logscale.raster;

import java.nio.ShortBuffer;

/**
 * Unsigned 16 bit sensor samples, as produced by a generator or read from a
 * FITS file. Samples are stored in a short buffer and read back as unsigned.
 * The raster holds a read-only view of the buffer it is given.
 */
public class SourceRaster extends Raster<ShortBuffer> {

    public static final int MAX_VALUE = 0xffff;

    public SourceRaster(int width, int height, ShortBuffer buffer) {
        super(width, height, buffer.asReadOnlyBuffer());
    }

    /**
     * Wrap an array of unsigned samples, each in the range [0, 65535].
     *
     * @param width The raster width
     * @param height The raster height
     * @param samples The samples in row-major order
     * @return The new raster
     */
    public static SourceRaster of(int width, int height, int... samples) {
        if ((long) width * height != samples.length) {
            throw new ShapeMismatchException(String.format("%d samples do not fill shape %dx%d", samples.length, width, height));
        }
        short[] data = new short[samples.length];
        for (int i = 0; i < samples.length; i++) {
            int s = samples[i];
            if (s < 0 || s > MAX_VALUE) {
                throw new IllegalArgumentException("Sample out of unsigned 16 bit range: " + s);
            }
            data[i] = (short) s;
        }
        return new SourceRaster(width, height, ShortBuffer.wrap(data));
    }

    /**
     * @param index Row-major element index
     * @return The unsigned sample value
     */
    public int getSample(int index) {
        return getBuffer().get(index) & MAX_VALUE;
    }

    public int getSample(int x, int y) {
        return getSample(index(x, y));
    }
}
