package org.lsst.fits.logscale.raster;

import java.nio.ReadOnlyBufferException;
import java.nio.ShortBuffer;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class SourceRasterTest {

    @Test
    public void testUnsignedSamples() {
        SourceRaster raster = SourceRaster.of(3, 1, 0, 32768, 65535);
        assertEquals(0, raster.getSample(0));
        assertEquals(32768, raster.getSample(1));
        assertEquals(65535, raster.getSample(2, 0));
    }

    @Test
    public void testRowMajorIndexing() {
        SourceRaster raster = SourceRaster.of(2, 3, 1, 2, 3, 4, 5, 6);
        assertEquals(2, raster.getWidth());
        assertEquals(3, raster.getHeight());
        assertEquals(6, raster.getSize());
        assertEquals(4, raster.getSample(1, 1));
        assertEquals(5, raster.getSample(0, 2));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testWrongSampleCount() {
        SourceRaster.of(2, 2, 1, 2, 3);
    }

    @Test(expected = ShapeMismatchException.class)
    public void testBufferCapacityMismatch() {
        new SourceRaster(4, 4, ShortBuffer.allocate(15));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testNonPositiveShape() {
        new SourceRaster(0, 4, ShortBuffer.allocate(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSampleOutOfRange() {
        SourceRaster.of(1, 1, 65536);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOutsideRaster() {
        SourceRaster.of(2, 2, 1, 2, 3, 4).getSample(2, 0);
    }

    @Test
    public void testCheckShape() {
        SourceRaster raster = SourceRaster.of(2, 1, 1, 2);
        assertTrue(raster.hasShape(2, 1));
        assertFalse(raster.hasShape(1, 2));
        raster.checkShape(2, 1);
        try {
            raster.checkShape(1, 2);
        } catch (ShapeMismatchException x) {
            assertTrue(x.getMessage().contains("1x2"));
            return;
        }
        throw new AssertionError("Shape mismatch not detected");
    }

    @Test(expected = ReadOnlyBufferException.class)
    public void testBufferIsReadOnly() {
        SourceRaster raster = new SourceRaster(2, 1, ShortBuffer.wrap(new short[]{1, 2}));
        assertTrue(raster.getBuffer().isReadOnly());
        raster.getBuffer().put(0, (short) 5);
    }
}
