package in.latentsource.application.service;

import in.latentsource.config.PipelineConfig;
import in.latentsource.domain.common.LatentSourceException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;
import in.latentsource.infrastructure.metrics.NoOpPipelineMetrics;
import in.latentsource.infrastructure.metrics.PipelineMetrics;
import in.latentsource.service.blend.BlendModelTrainer;
import in.latentsource.service.blend.EnsemblePredictor;
import in.latentsource.service.cluster.PatternClusterer;
import in.latentsource.service.kernel.ScalePredictionEngine;
import in.latentsource.service.trading.TradingSimulator;
import in.latentsource.util.Tasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Latent source pipeline: libraries -> blend -> signal -> backtest.
 *
 * Data flow:
 * 1. Cluster period: one pattern library per scale (scales built concurrently)
 * 2. Blend period: per-scale kernel predictions vs realized changes, SVD fit
 * 3. Test period: per-scale kernel predictions, blended into the signal
 * 4. Test period: bounded and unbounded backtests of the signal
 *
 * Each stage only reads its own period and artifacts of earlier stages.
 * The pipeline holds no state between runs; the executor is owned by the caller.
 */
public final class LatentSourcePipeline {
    private static final Logger log = LoggerFactory.getLogger(LatentSourcePipeline.class);

    private final PipelineConfig config;
    private final ExecutorService executor;
    private final PipelineMetrics metrics;

    private final PatternClusterer clusterer;
    private final BlendModelTrainer trainer;
    private final EnsemblePredictor ensemble;

    /**
     * Sequential pipeline without metrics.
     */
    public LatentSourcePipeline(PipelineConfig config) {
        this(config, null, NoOpPipelineMetrics.INSTANCE);
    }

    /**
     * @param config   Validated configuration
     * @param executor Worker pool sized to config.parallelism(), or null for sequential runs
     * @param metrics  Metrics sink
     */
    public LatentSourcePipeline(PipelineConfig config, ExecutorService executor, PipelineMetrics metrics) {
        this.config = config.validate();
        this.executor = executor;
        this.metrics = metrics;

        ScalePredictionEngine engine = new ScalePredictionEngine(
            executor, executor == null ? 1 : config.parallelism(), metrics);
        this.clusterer = new PatternClusterer(config.clustering());
        this.trainer = new BlendModelTrainer(engine);
        this.ensemble = new EnsemblePredictor(engine);
    }

    public PipelineResult run(PipelinePeriods periods) {
        log.info("Latent source pipeline starting ({})", periods.getSummary());
        long start = System.nanoTime();

        ScaleLibraries libraries = buildLibraries(periods.clusterPeriod());
        BlendModel model = trainBlend(periods.blendPeriod(), libraries);
        Signal signal = predictSignal(periods.testPeriod(), libraries, model);

        BoundedRunResult bounded = timed(PipelineStage.TRADING_SIMULATION,
            () -> TradingSimulator.simulateBounded(signal, periods.testPeriod(), config.trading()));
        InventoryRunResult inventory = timed(PipelineStage.TRADING_SIMULATION,
            () -> TradingSimulator.simulateUnbounded(signal, periods.testPeriod(), config.trading()));
        metrics.recordBacktest(bounded, inventory);

        log.info("Latent source pipeline finished in {} ms", (System.nanoTime() - start) / 1_000_000);
        return new PipelineResult(libraries, model, signal, bounded, inventory);
    }

    /**
     * Build the SHORT, MEDIUM and LONG libraries from the clustering period.
     */
    public ScaleLibraries buildLibraries(PriceSeries clusterPeriod) {
        return timed(PipelineStage.CLUSTERING, () -> {
            Map<TimeScale, PatternLibrary> libraries = new EnumMap<>(TimeScale.class);
            if (executor == null) {
                for (TimeScale scale : TimeScale.values()) {
                    libraries.put(scale, clusterer.buildLibrary(scale, clusterPeriod, config.scale(scale)));
                }
            } else {
                List<Future<PatternLibrary>> futures = new ArrayList<>();
                for (TimeScale scale : TimeScale.values()) {
                    futures.add(executor.submit(
                        () -> clusterer.buildLibrary(scale, clusterPeriod, config.scale(scale))));
                }
                for (PatternLibrary library : Tasks.awaitAll(futures)) {
                    libraries.put(library.scale(), library);
                }
            }
            return ScaleLibraries.of(libraries);
        });
    }

    public BlendModel trainBlend(PriceSeries blendPeriod, ScaleLibraries libraries) {
        BlendModel model = timed(PipelineStage.BLEND_TRAINING, () -> trainer.train(blendPeriod, libraries));
        metrics.recordBlendFit(model);
        return model;
    }

    public Signal predictSignal(PriceSeries testPeriod, ScaleLibraries libraries, BlendModel model) {
        return timed(PipelineStage.ENSEMBLE_PREDICTION, () -> ensemble.predict(testPeriod, libraries, model));
    }

    private <T> T timed(PipelineStage stage, Supplier<T> work) {
        long start = System.nanoTime();
        try {
            T result = work.get();
            metrics.recordStageSuccess(stage, Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (LatentSourceException | IllegalArgumentException e) {
            metrics.recordStageFailure(stage, e.getClass().getSimpleName(), Duration.ofNanos(System.nanoTime() - start));
            log.error("Stage {} failed: {}", stage, e.getMessage());
            throw e;
        }
    }
}
