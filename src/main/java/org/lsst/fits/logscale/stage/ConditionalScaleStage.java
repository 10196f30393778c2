package org.lsst.fits.logscale.stage;

import java.util.logging.Logger;
import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.Stage;
import org.lsst.fits.logscale.stats.StatisticsAccumulator;

/**
 * Multiplies log domain values strictly below a threshold by a fixed
 * multiplier. Values equal to or above the threshold are kept, and NaN stays
 * NaN.
 * <p>
 * This stage takes ownership of its input and rewrites it in place. Callers
 * wanting to keep the log raster should pass a {@link WorkingRaster#copy()}.
 */
public class ConditionalScaleStage {

    private static final Logger LOG = Logger.getLogger(ConditionalScaleStage.class.getName());

    private final int width;
    private final int height;
    private final double threshold;
    private final double multiplier;

    public ConditionalScaleStage(int width, int height, double threshold, double multiplier) {
        this.width = width;
        this.height = height;
        this.threshold = threshold;
        this.multiplier = multiplier;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * @param value A log domain value, possibly NaN
     * @return <code>true</code> if the value will be multiplied
     */
    public boolean isRescaled(double value) {
        // NaN compares false, but be explicit
        return !Double.isNaN(value) && value < threshold;
    }

    public double scale(double value) {
        return isRescaled(value) ? value * multiplier : value;
    }

    public ScaleResult apply(WorkingRaster input) {
        input.checkShape(width, height);
        StatisticsAccumulator stats = new StatisticsAccumulator(Stage.SCALED);
        long rescaled = 0;
        for (int i = 0; i < input.getSize(); i++) {
            double value = input.getValue(i);
            if (isRescaled(value)) {
                input.setValue(i, value * multiplier);
                rescaled++;
            }
            stats.add(input.getValue(i));
        }
        final long count = rescaled;
        LOG.fine(() -> String.format("Rescaled %,d values below %g by %g", count, threshold, multiplier));
        return new ScaleResult(input, stats.build(), rescaled);
    }
}
