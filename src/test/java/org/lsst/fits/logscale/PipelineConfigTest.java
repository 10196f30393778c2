package org.lsst.fits.logscale;

import java.util.Properties;
import org.lsst.fits.logscale.raster.Precision;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

public class PipelineConfigTest {

    @Test
    public void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();
        assertEquals(10000, config.getWidth());
        assertEquals(1000, config.getHeight());
        assertEquals(42, config.getSeed());
        assertEquals(13.0, config.getLogThreshold(), 0);
        assertEquals(2.0, config.getLogMultiplier(), 0);
        assertEquals(Precision.FLOAT64, config.getPrecision());
        assertEquals(256, config.getQuantizationLevels());
        assertEquals(10_000_000L, config.getSize());
    }

    @Test
    public void testPropertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.WIDTH, "4");
        props.setProperty(PipelineConfig.HEIGHT, " 3 ");
        props.setProperty(PipelineConfig.PRECISION, "float32");
        PipelineConfig config = PipelineConfig.fromProperties(props);
        assertEquals(new PipelineConfig(4, 3, 42, 13, 2, Precision.FLOAT32), config);
    }

    @Test
    public void testRejectsNonPositiveShape() {
        assertInvalid(() -> new PipelineConfig(0, 1, 0, 13, 2, Precision.FLOAT64), "width");
        assertInvalid(() -> new PipelineConfig(1, -1, 0, 13, 2, Precision.FLOAT64), "height");
    }

    @Test
    public void testRejectsBadThreshold() {
        assertInvalid(() -> new PipelineConfig(1, 1, 0, 0, 2, Precision.FLOAT64), "threshold");
        assertInvalid(() -> new PipelineConfig(1, 1, 0, -5, 2, Precision.FLOAT64), "threshold");
        assertInvalid(() -> new PipelineConfig(1, 1, 0, Double.NaN, 2, Precision.FLOAT64), "threshold");
        assertInvalid(() -> new PipelineConfig(1, 1, 0, Double.POSITIVE_INFINITY, 2, Precision.FLOAT64), "threshold");
    }

    @Test
    public void testRejectsBadMultiplier() {
        assertInvalid(() -> new PipelineConfig(1, 1, 0, 13, Double.NaN, Precision.FLOAT64), "multiplier");
    }

    @Test
    public void testNegativeMultiplierAllowed() {
        assertEquals(-1.0, new PipelineConfig(1, 1, 0, 13, -1, Precision.FLOAT64).getLogMultiplier(), 0);
    }

    @Test
    public void testRejectsHugeShape() {
        assertInvalid(() -> new PipelineConfig(100000, 100000, 0, 13, 2, Precision.FLOAT64), "too large");
    }

    @Test
    public void testUnparsableProperty() {
        Properties props = new Properties();
        props.setProperty(PipelineConfig.WIDTH, "wide");
        assertInvalid(() -> PipelineConfig.fromProperties(props), "width");
        Properties precision = new Properties();
        precision.setProperty(PipelineConfig.PRECISION, "half");
        assertInvalid(() -> PipelineConfig.fromProperties(precision), "precision");
    }

    private static void assertInvalid(Runnable construction, String messagePart) {
        try {
            construction.run();
            fail("Configuration should have been rejected");
        } catch (InvalidConfigurationException x) {
            assertTrue(x.getMessage(), x.getMessage().contains(messagePart));
        }
    }
}
