package org.lsst.fits.logscale.raster;

import java.nio.ByteBuffer;

/**
 * The 8 bit display raster produced by normalization.
 */
public class QuantizedRaster extends Raster<ByteBuffer> {

    public static final int MAX_LEVEL = 0xff;

    QuantizedRaster(int width, int height, ByteBuffer buffer) {
        super(width, height, buffer);
    }

    public static QuantizedRaster allocate(int width, int height) {
        return new QuantizedRaster(width, height, ByteBuffer.allocate(width * height));
    }

    public int getLevel(int index) {
        return getBuffer().get(index) & MAX_LEVEL;
    }

    public int getLevel(int x, int y) {
        return getLevel(index(x, y));
    }

    public void setLevel(int index, int level) {
        if (level < 0 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Level out of 8 bit range: " + level);
        }
        getBuffer().put(index, (byte) level);
    }

    /**
     * @return A copy of the levels as a byte array, suitable for a gray scale
     * image raster.
     */
    public byte[] toByteArray() {
        byte[] result = new byte[getSize()];
        getBuffer().duplicate().clear().get(result);
        return result;
    }
}
