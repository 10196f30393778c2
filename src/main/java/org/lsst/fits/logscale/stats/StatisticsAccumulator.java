package org.lsst.fits.logscale.stats;

/**
 * Single pass accumulator for {@link StageStatistics}. NaN values are counted
 * as invalid and otherwise ignored.
 */
public class StatisticsAccumulator {

    private final Stage stage;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;
    private long valid;
    private long invalid;

    public StatisticsAccumulator(Stage stage) {
        this.stage = stage;
    }

    public void add(double value) {
        if (Double.isNaN(value)) {
            invalid++;
            return;
        }
        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
        sum += value;
        valid++;
    }

    public void addInvalid() {
        invalid++;
    }

    public StageStatistics build() {
        if (valid == 0) {
            return new StageStatistics(stage, Double.NaN, Double.NaN, Double.NaN, 0, invalid);
        }
        return new StageStatistics(stage, min, max, sum / valid, valid, invalid);
    }
}
