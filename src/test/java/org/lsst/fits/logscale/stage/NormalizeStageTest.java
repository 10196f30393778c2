package org.lsst.fits.logscale.stage;

import org.lsst.fits.logscale.raster.Precision;
import org.lsst.fits.logscale.raster.QuantizedRaster;
import org.lsst.fits.logscale.raster.ShapeMismatchException;
import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.Stage;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class NormalizeStageTest {

    @Test
    public void testUniformInputIsMidLevel() {
        WorkingRaster input = WorkingRaster.of(3, 2, Precision.FLOAT64, 7, 7, 7, 7, 7, 7);
        NormalizeResult result = new NormalizeStage(3, 2).apply(input);
        assertEquals(DataCondition.FLAT_RANGE, result.getCondition());
        for (int i = 0; i < 6; i++) {
            assertEquals(127, result.getRaster().getLevel(i));
        }
        assertEquals(7.0, result.getInputMinimum(), 0);
        assertEquals(7.0, result.getInputMaximum(), 0);
    }

    @Test
    public void testFlatRangeKeepsNaNAtZero() {
        WorkingRaster input = WorkingRaster.of(3, 1, Precision.FLOAT64, 20, Double.NaN, 20);
        NormalizeResult result = new NormalizeStage(3, 1).apply(input);
        assertEquals(DataCondition.FLAT_RANGE, result.getCondition());
        assertEquals(127, result.getRaster().getLevel(0));
        assertEquals(0, result.getRaster().getLevel(1));
        assertEquals(127, result.getRaster().getLevel(2));
        assertEquals(127.0, result.getStatistics().getMinimum(), 0);
        assertEquals(127.0, result.getStatistics().getMean(), 0);
        assertEquals(1, result.getStatistics().getInvalidCount());
    }

    @Test
    public void testNoValidData() {
        WorkingRaster input = WorkingRaster.of(2, 1, Precision.FLOAT64, Double.NaN, Double.NaN);
        NormalizeResult result = new NormalizeStage(2, 1).apply(input);
        assertEquals(DataCondition.NO_VALID_DATA, result.getCondition());
        assertEquals(0, result.getRaster().getLevel(0));
        assertEquals(0, result.getRaster().getLevel(1));
        assertTrue(Double.isNaN(result.getInputMinimum()));
        assertTrue(Double.isNaN(result.getInputMaximum()));
        assertEquals(0, result.getStatistics().getValidCount());
        assertEquals(2, result.getStatistics().getInvalidCount());
        assertFalse(result.getStatistics().hasValidData());
    }

    @Test
    public void testExtremesMapToFullRange() {
        WorkingRaster input = WorkingRaster.of(5, 1, Precision.FLOAT64, -4, 6, 1, 6, -4);
        NormalizeResult result = new NormalizeStage(5, 1).apply(input);
        QuantizedRaster output = result.getRaster();
        assertEquals(DataCondition.NORMAL, result.getCondition());
        assertEquals(0, output.getLevel(0));
        assertEquals(255, output.getLevel(1));
        assertEquals(128, output.getLevel(2));
        assertEquals(255, output.getLevel(3));
        assertEquals(0, output.getLevel(4));
        assertEquals(0, result.getOutputMinimum());
        assertEquals(255, result.getOutputMaximum());
        assertEquals(-4.0, result.getInputMinimum(), 0);
        assertEquals(6.0, result.getInputMaximum(), 0);
    }

    @Test
    public void testNaNMapsToZero() {
        WorkingRaster input = WorkingRaster.of(3, 1, Precision.FLOAT32, 10, Double.NaN, 20);
        NormalizeResult result = new NormalizeStage(3, 1).apply(input);
        assertEquals(0, result.getRaster().getLevel(0));
        assertEquals(0, result.getRaster().getLevel(1));
        assertEquals(255, result.getRaster().getLevel(2));
        assertEquals(Stage.NORMALIZED, result.getStatistics().getStage());
        assertEquals(2, result.getStatistics().getValidCount());
        assertEquals(1, result.getStatistics().getInvalidCount());
        assertEquals(127.5, result.getStatistics().getMean(), 0);
    }

    @Test
    public void testRangeIsGlobalNotPerRow() {
        WorkingRaster input = WorkingRaster.of(2, 2, Precision.FLOAT64, 0, 10, 10, 20);
        QuantizedRaster output = new NormalizeStage(2, 2).apply(input).getRaster();
        assertEquals(0, output.getLevel(0, 0));
        assertEquals(128, output.getLevel(1, 0));
        assertEquals(128, output.getLevel(0, 1));
        assertEquals(255, output.getLevel(1, 1));
    }

    @Test
    public void testQuantizeClamps() {
        assertEquals(0, NormalizeStage.quantize(-1e-12, 0, 1));
        assertEquals(255, NormalizeStage.quantize(1 + 1e-12, 0, 1));
        assertEquals(0, NormalizeStage.quantize(Double.NaN, 0, 1));
        assertEquals(170, NormalizeStage.quantize(20, 0, 30));
    }

    @Test(expected = ShapeMismatchException.class)
    public void testShapeMismatch() {
        new NormalizeStage(1, 2).apply(WorkingRaster.of(2, 1, Precision.FLOAT64, 1, 2));
    }
}
