package org.lsst.fits.logscale.stats;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the statistics recorded at each stage of one pipeline run and
 * exposes them, in pipeline order, to reporting code.
 */
public class StatsCollector {

    private final Map<Stage, StageStatistics> statistics = new EnumMap<>(Stage.class);

    /**
     * Record the statistics for a stage.
     *
     * @param stats The statistics, keyed by their own stage
     * @throws IllegalStateException if the stage has already been recorded
     */
    public void record(StageStatistics stats) {
        StageStatistics previous = statistics.putIfAbsent(stats.getStage(), stats);
        if (previous != null) {
            throw new IllegalStateException("Statistics already recorded for stage " + stats.getStage().getKey());
        }
    }

    /**
     * @param stage The stage of interest
     * @return The statistics, or empty if the stage has not run
     */
    public Optional<StageStatistics> get(Stage stage) {
        return Optional.ofNullable(statistics.get(stage));
    }

    public boolean hasRun(Stage stage) {
        return statistics.containsKey(stage);
    }

    /**
     * @return Read only view of all recorded statistics in stage order
     */
    public Map<Stage, StageStatistics> getAll() {
        return Collections.unmodifiableMap(statistics);
    }

    @Override
    public String toString() {
        return "StatsCollector{" + "stages=" + statistics.keySet() + '}';
    }
}
