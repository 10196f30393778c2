package org.lsst.fits.logscale.raster;

import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.util.BitSet;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class WorkingRasterTest {

    @Test
    public void testBufferTypeFollowsPrecision() {
        assertTrue(WorkingRaster.allocate(2, 2, Precision.FLOAT32).getBuffer() instanceof FloatBuffer);
        assertTrue(WorkingRaster.allocate(2, 2, Precision.FLOAT64).getBuffer() instanceof DoubleBuffer);
    }

    @Test
    public void testFloat32RoundsStoredValues() {
        WorkingRaster raster = WorkingRaster.of(1, 1, Precision.FLOAT32, 0.1);
        assertEquals((double) 0.1f, raster.getValue(0), 0);
        assertEquals(Precision.FLOAT32.round(0.1), raster.getValue(0), 0);
        WorkingRaster exact = WorkingRaster.of(1, 1, Precision.FLOAT64, 0.1);
        assertEquals(0.1, exact.getValue(0), 0);
    }

    @Test
    public void testNaNIsStored() {
        for (Precision precision : Precision.values()) {
            WorkingRaster raster = WorkingRaster.of(2, 1, precision, Double.NaN, 1.0);
            assertTrue(Double.isNaN(raster.getValue(0, 0)));
            assertEquals(1.0, raster.getValue(1, 0), 0);
        }
    }

    @Test
    public void testCopyIsIndependent() {
        WorkingRaster raster = WorkingRaster.of(2, 1, Precision.FLOAT64, 1, 2);
        WorkingRaster copy = raster.copy();
        assertTrue(copy.sameValues(raster));
        copy.setValue(0, 5);
        assertEquals(1, raster.getValue(0), 0);
        assertFalse(copy.sameValues(raster));
    }

    @Test
    public void testSameValuesTreatsNaNAsEqual() {
        WorkingRaster a = WorkingRaster.of(2, 1, Precision.FLOAT64, Double.NaN, 3);
        WorkingRaster b = WorkingRaster.of(2, 1, Precision.FLOAT64, Double.NaN, 3);
        assertTrue(a.sameValues(b));
        assertFalse(a.sameValues(WorkingRaster.of(1, 2, Precision.FLOAT64, Double.NaN, 3)));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testWrongValueCount() {
        WorkingRaster.of(2, 2, Precision.FLOAT64, 1, 2, 3);
    }

    @Test
    public void testParsePrecision() {
        assertEquals(Precision.FLOAT32, Precision.parse("float32"));
        assertEquals(Precision.FLOAT32, Precision.parse(" 32 "));
        assertEquals(Precision.FLOAT64, Precision.parse("FLOAT64"));
        assertEquals(Precision.FLOAT64, Precision.parse("double"));
        assertEquals(4, Precision.FLOAT32.getBytes());
        assertEquals(8, Precision.FLOAT64.getBytes());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPrecision() {
        Precision.parse("float16");
    }

    @Test
    public void testValidityMask() {
        BitSet bits = new BitSet();
        bits.set(0);
        bits.set(3);
        ValidityMask mask = new ValidityMask(2, 2, bits);
        bits.clear();
        assertTrue(mask.isValid(0, 0));
        assertFalse(mask.isValid(1, 0));
        assertTrue(mask.isValid(1, 1));
        assertEquals(2, mask.getValidCount());
        assertEquals(2, mask.getInvalidCount());
    }
}
