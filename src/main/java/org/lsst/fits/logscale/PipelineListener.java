package org.lsst.fits.logscale;

import org.lsst.fits.logscale.stats.StageStatistics;

/**
 * Receives progress events from a {@link LogScalePipeline}. Listeners are
 * called on the pipeline's thread, in stage order.
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    default void pipelineStarted(PipelineConfig config, MemoryEstimate estimate) {
    }

    default void stageCompleted(StageStatistics statistics, long elapsedMillis) {
    }

    default void pipelineCompleted(PipelineResult result) {
    }
}
