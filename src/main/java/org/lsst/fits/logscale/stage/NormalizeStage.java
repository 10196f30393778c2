package org.lsst.fits.logscale.stage;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.logscale.raster.QuantizedRaster;
import org.lsst.fits.logscale.raster.WorkingRaster;
import org.lsst.fits.logscale.stats.Stage;
import org.lsst.fits.logscale.stats.StatisticsAccumulator;

/**
 * Maps the global (whole raster) range of valid values linearly onto the
 * 8 bit output range. NaN elements always map to {@link #NAN_LEVEL}. When all
 * valid values are equal they map to {@link #MID_LEVEL}, and a raster with no
 * valid values maps to all zeros. Output statistics count the elements that
 * came from NaN as invalid.
 */
public class NormalizeStage {

    private static final Logger LOG = Logger.getLogger(NormalizeStage.class.getName());

    public static final int MAX_LEVEL = QuantizedRaster.MAX_LEVEL;
    public static final int MID_LEVEL = MAX_LEVEL / 2;
    public static final int NAN_LEVEL = 0;

    private final int width;
    private final int height;

    public NormalizeStage(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public NormalizeResult apply(WorkingRaster input) {
        input.checkShape(width, height);
        double vmin = Double.POSITIVE_INFINITY;
        double vmax = Double.NEGATIVE_INFINITY;
        long valid = 0;
        for (int i = 0; i < input.getSize(); i++) {
            double value = input.getValue(i);
            if (Double.isNaN(value)) {
                continue;
            }
            vmin = Math.min(vmin, value);
            vmax = Math.max(vmax, value);
            valid++;
        }

        QuantizedRaster output = QuantizedRaster.allocate(width, height);
        DataCondition condition;
        if (valid == 0) {
            condition = DataCondition.NO_VALID_DATA;
            vmin = Double.NaN;
            vmax = Double.NaN;
            fill(output, NAN_LEVEL);
        } else if (vmax == vmin) {
            condition = DataCondition.FLAT_RANGE;
            for (int i = 0; i < input.getSize(); i++) {
                output.setLevel(i, Double.isNaN(input.getValue(i)) ? NAN_LEVEL : MID_LEVEL);
            }
        } else {
            condition = DataCondition.NORMAL;
            double range = vmax - vmin;
            for (int i = 0; i < input.getSize(); i++) {
                output.setLevel(i, quantize(input.getValue(i), vmin, range));
            }
        }
        if (condition != DataCondition.NORMAL) {
            LOG.log(Level.FINE, "Normalization of {0}x{1} raster has degenerate range: {2}", new Object[]{width, height, condition});
        }

        // levels written for NaN inputs are placeholders, not data
        StatisticsAccumulator stats = new StatisticsAccumulator(Stage.NORMALIZED);
        for (int i = 0; i < output.getSize(); i++) {
            if (Double.isNaN(input.getValue(i))) {
                stats.addInvalid();
            } else {
                stats.add(output.getLevel(i));
            }
        }
        return new NormalizeResult(output, stats.build(), vmin, vmax, condition);
    }

    static int quantize(double value, double vmin, double range) {
        if (Double.isNaN(value)) {
            return NAN_LEVEL;
        }
        long level = Math.round(MAX_LEVEL * (value - vmin) / range);
        return (int) Math.max(0, Math.min(MAX_LEVEL, level));
    }

    private static void fill(QuantizedRaster raster, int level) {
        for (int i = 0; i < raster.getSize(); i++) {
            raster.setLevel(i, level);
        }
    }
}
