package org.lsst.fits.logscale;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.logscale.stage.DataCondition;
import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Reports pipeline progress through java.util.logging.
 */
public class LoggingPipelineListener implements PipelineListener {

    private static final Logger LOG = Logger.getLogger(LoggingPipelineListener.class.getName());

    @Override
    public void pipelineStarted(PipelineConfig config, MemoryEstimate estimate) {
        LOG.log(Level.INFO, "Processing {0}x{1} raster at {2}, estimated memory {3}",
                new Object[]{config.getWidth(), config.getHeight(), config.getPrecision(), estimate});
    }

    @Override
    public void stageCompleted(StageStatistics statistics, long elapsedMillis) {
        if (!statistics.hasValidData()) {
            LOG.log(Level.WARNING, "Stage {0} produced no valid values ({1} invalid)",
                    new Object[]{statistics.getStage().getKey(), statistics.getInvalidCount()});
        }
        LOG.fine(() -> String.format("%s took %dms", statistics, elapsedMillis));
    }

    @Override
    public void pipelineCompleted(PipelineResult result) {
        if (result.getCondition() != DataCondition.NORMAL) {
            LOG.log(Level.WARNING, "Normalization condition {0}", result.getCondition());
        }
        LOG.info(() -> String.format("Pipeline complete, %,d values rescaled, normalized range [%g, %g]",
                result.getRescaledCount(), result.getNormalizedRangeMinimum(), result.getNormalizedRangeMaximum()));
    }
}
