package org.lsst.fits.logscale;

import org.lsst.fits.logscale.raster.Precision;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class MemoryEstimatorTest {

    @Test
    public void testDoublePrecision() {
        MemoryEstimate estimate = MemoryEstimator.estimate(new PipelineConfig(10000, 1000, 42, 13, 2, Precision.FLOAT64));
        assertEquals(20_000_000L, estimate.getInputBytes());
        assertEquals(80_000_000L, estimate.getWorkingBytes());
        assertEquals(10_000_000L, estimate.getOutputBytes());
        assertEquals(110_000_000L, estimate.getPeakBytes());
    }

    @Test
    public void testSinglePrecision() {
        MemoryEstimate estimate = MemoryEstimator.estimate(new PipelineConfig(4, 4, 0, 13, 2, Precision.FLOAT32));
        assertEquals(32, estimate.getInputBytes());
        assertEquals(64, estimate.getWorkingBytes());
        assertEquals(16, estimate.getOutputBytes());
        assertEquals(112, estimate.getPeakBytes());
    }

    @Test
    public void testNoOverflow() {
        MemoryEstimate estimate = MemoryEstimator.estimate(1L << 31, Precision.FLOAT64);
        assertEquals((1L << 31) * 11, estimate.getPeakBytes());
        assertTrue(estimate.toString().contains("peak="));
    }
}
