package org.lsst.fits.logscale;

import org.lsst.fits.logscale.raster.SourceRaster;
import org.lsst.fits.logscale.stage.ConditionalScaleStage;
import org.lsst.fits.logscale.stage.LogTransformResult;
import org.lsst.fits.logscale.stage.LogTransformStage;
import org.lsst.fits.logscale.stage.NormalizeResult;
import org.lsst.fits.logscale.stage.NormalizeStage;
import org.lsst.fits.logscale.stage.ScaleResult;
import org.lsst.fits.logscale.stats.Stage;
import org.lsst.fits.logscale.stats.StageStatistics;
import org.lsst.fits.logscale.stats.StatisticsAccumulator;
import org.lsst.fits.logscale.stats.StatsCollector;

/**
 * Runs source samples through log transform, conditional scaling and
 * normalization, collecting statistics after each step.
 * <p>
 * Buffer ownership: the log and normalize stages allocate new rasters, the
 * scale stage rewrites the log raster in place. At most the source, one
 * working raster and the output are live at once, matching
 * {@link MemoryEstimator}.
 */
public class LogScalePipeline {

    private final PipelineConfig config;
    private final PipelineListener listener;
    private final LogTransformStage logStage;
    private final ConditionalScaleStage scaleStage;
    private final NormalizeStage normalizeStage;

    public LogScalePipeline(PipelineConfig config) {
        this(config, PipelineListener.NONE);
    }

    public LogScalePipeline(PipelineConfig config, PipelineListener listener) {
        this.config = config;
        this.listener = listener;
        int width = config.getWidth();
        int height = config.getHeight();
        this.logStage = new LogTransformStage(width, height, config.getPrecision());
        this.scaleStage = new ConditionalScaleStage(width, height, config.getLogThreshold(), config.getLogMultiplier());
        this.normalizeStage = new NormalizeStage(width, height);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    /**
     * Process one source raster.
     *
     * @param source The raw samples, must match the configured shape
     * @return The normalized raster and statistics
     * @throws org.lsst.fits.logscale.raster.ShapeMismatchException if the
     * source has the wrong shape, before any processing is done
     */
    public PipelineResult run(SourceRaster source) {
        source.checkShape(config.getWidth(), config.getHeight());
        MemoryEstimate estimate = MemoryEstimator.estimate(config);
        listener.pipelineStarted(config, estimate);
        StatsCollector collector = new StatsCollector();

        Timed<StageStatistics> original = Timed.measure(() -> sourceStatistics(source));
        record(collector, original.getValue(), original.getElapsedMillis());

        Timed<LogTransformResult> logged = Timed.measure(() -> logStage.apply(source));
        record(collector, logged.getValue().getStatistics(), logged.getElapsedMillis());

        Timed<ScaleResult> scaled = Timed.measure(() -> scaleStage.apply(logged.getValue().getRaster()));
        record(collector, scaled.getValue().getStatistics(), scaled.getElapsedMillis());

        Timed<NormalizeResult> normalized = Timed.measure(() -> normalizeStage.apply(scaled.getValue().getRaster()));
        NormalizeResult norm = normalized.getValue();
        record(collector, norm.getStatistics(), normalized.getElapsedMillis());

        PipelineResult result = new PipelineResult(config, estimate, norm.getRaster(), logged.getValue().getMask(), collector,
                scaled.getValue().getRescaledCount(), norm.getInputMinimum(), norm.getInputMaximum(), norm.getCondition());
        listener.pipelineCompleted(result);
        return result;
    }

    private void record(StatsCollector collector, StageStatistics stats, long elapsedMillis) {
        collector.record(stats);
        listener.stageCompleted(stats, elapsedMillis);
    }

    static StageStatistics sourceStatistics(SourceRaster source) {
        StatisticsAccumulator stats = new StatisticsAccumulator(Stage.ORIGINAL);
        for (int i = 0; i < source.getSize(); i++) {
            stats.add(source.getSample(i));
        }
        return stats.build();
    }
}
