package org.lsst.fits.logscale.stage;

import java.util.BitSet;
import java.util.logging.Logger;
import org.lsst.fits.logscale.raster.Precision;
import org.lsst.fits.logscale.raster.SourceRaster;
import org.lsst.fits.logscale.raster.ValidityMask;
import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.Stage;
import org.lsst.fits.logscale.stats.StatisticsAccumulator;

/**
 * Converts raw samples to decibels, 10*log10(sample). Non-positive samples
 * have no logarithm and become NaN, which keeps them out of every later
 * statistic. The input is left untouched and a new working raster is
 * allocated.
 */
public class LogTransformStage {

    private static final Logger LOG = Logger.getLogger(LogTransformStage.class.getName());

    // Every possible unsigned 16 bit sample, precomputed. Entry 0 is NaN.
    private static final double[] DECIBELS = new double[SourceRaster.MAX_VALUE + 1];

    static {
        DECIBELS[0] = Double.NaN;
        for (int i = 1; i < DECIBELS.length; i++) {
            DECIBELS[i] = toDecibels(i);
        }
    }

    private final int width;
    private final int height;
    private final Precision precision;

    public LogTransformStage(int width, int height, Precision precision) {
        this.width = width;
        this.height = height;
        this.precision = precision;
    }

    /**
     * @param sample A raw sample value
     * @return 10*log10(sample), or NaN if the sample is not positive
     */
    public static double toDecibels(double sample) {
        return sample > 0 ? 10 * Math.log10(sample) : Double.NaN;
    }

    public LogTransformResult apply(SourceRaster input) {
        input.checkShape(width, height);
        WorkingRaster output = WorkingRaster.allocate(width, height, precision);
        BitSet valid = new BitSet(input.getSize());
        StatisticsAccumulator stats = new StatisticsAccumulator(Stage.LOG);
        for (int i = 0; i < input.getSize(); i++) {
            int sample = input.getSample(i);
            if (sample > 0) {
                valid.set(i);
            }
            output.setValue(i, DECIBELS[sample]);
            // Accumulate the stored value so statistics agree with the raster at either precision
            stats.add(output.getValue(i));
        }
        LogTransformResult result = new LogTransformResult(output, new ValidityMask(width, height, valid), stats.build());
        LOG.fine(() -> String.format("Log transform of %dx%d raster, %,d invalid samples", width, height, result.getMask().getInvalidCount()));
        return result;
    }
}
