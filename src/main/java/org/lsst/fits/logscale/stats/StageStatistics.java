package org.lsst.fits.logscale.stats;

import java.util.Objects;

/**
 * Descriptive statistics of one stage's output, computed over valid
 * elements only. When a stage has no valid element the minimum, maximum and
 * mean are NaN.
 */
public final class StageStatistics {

    private final Stage stage;
    private final double minimum;
    private final double maximum;
    private final double mean;
    private final long validCount;
    private final long invalidCount;

    public StageStatistics(Stage stage, double minimum, double maximum, double mean, long validCount, long invalidCount) {
        this.stage = Objects.requireNonNull(stage);
        this.minimum = minimum;
        this.maximum = maximum;
        this.mean = mean;
        this.validCount = validCount;
        this.invalidCount = invalidCount;
    }

    public Stage getStage() {
        return stage;
    }

    public double getMinimum() {
        return minimum;
    }

    public double getMaximum() {
        return maximum;
    }

    public double getMean() {
        return mean;
    }

    public long getValidCount() {
        return validCount;
    }

    public long getInvalidCount() {
        return invalidCount;
    }

    public long getTotalCount() {
        return validCount + invalidCount;
    }

    public boolean hasValidData() {
        return validCount > 0;
    }

    public boolean isFlat() {
        return hasValidData() && minimum == maximum;
    }

    @Override
    public String toString() {
        return String.format("StageStatistics{stage=%s, min=%g, max=%g, mean=%g, valid=%,d, invalid=%,d}",
                stage.getKey(), minimum, maximum, mean, validCount, invalidCount);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + Objects.hashCode(this.stage);
        hash = 53 * hash + Double.hashCode(this.minimum);
        hash = 53 * hash + Double.hashCode(this.maximum);
        hash = 53 * hash + Double.hashCode(this.mean);
        hash = 53 * hash + Long.hashCode(this.validCount);
        hash = 53 * hash + Long.hashCode(this.invalidCount);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final StageStatistics other = (StageStatistics) obj;
        return this.stage == other.stage
                && Double.compare(this.minimum, other.minimum) == 0
                && Double.compare(this.maximum, other.maximum) == 0
                && Double.compare(this.mean, other.mean) == 0
                && this.validCount == other.validCount
                && this.invalidCount == other.invalidCount;
    }
}
