package in.latentsource.infrastructure.metrics;

import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of PipelineMetrics.
 *
 * Key Metrics:
 * - latent_source_stage_duration_seconds{stage} - Stage wall time
 * - latent_source_stage_failures_total{stage, error} - Typed failures per stage
 * - latent_source_kernel_evaluations_total{scale} - Kernel predictions computed
 * - latent_source_degenerate_kernels_total{scale} - Evaluations with vanishing weights
 * - latent_source_blend_coefficient{coefficient} - Last fitted w0..w3
 * - latent_source_blend_r_squared - Last in-sample R²
 * - latent_source_backtest_balance{policy} - Final balance per policy
 * - latent_source_backtest_inventory - Net inventory of the unbounded policy
 */
public class PrometheusPipelineMetrics implements PipelineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusPipelineMetrics.class);

    private final CollectorRegistry registry;

    private final Histogram stageDuration;
    private final Counter stageFailures;
    private final Counter kernelEvaluations;
    private final Counter degenerateKernels;
    private final Gauge blendCoefficient;
    private final Gauge blendRSquared;
    private final Gauge backtestBalance;
    private final Gauge backtestInventory;

    public PrometheusPipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.stageDuration = Histogram.build()
            .name("latent_source_stage_duration_seconds")
            .help("Pipeline stage duration in seconds")
            .labelNames("stage")
            .buckets(0.01, 0.1, 0.5, 1.0, 5.0, 30.0, 120.0, 600.0)
            .register(registry);

        this.stageFailures = Counter.build()
            .name("latent_source_stage_failures_total")
            .help("Total number of pipeline stage failures")
            .labelNames("stage", "error")
            .register(registry);

        this.kernelEvaluations = Counter.build()
            .name("latent_source_kernel_evaluations_total")
            .help("Total number of kernel predictions evaluated")
            .labelNames("scale")
            .register(registry);

        this.degenerateKernels = Counter.build()
            .name("latent_source_degenerate_kernels_total")
            .help("Kernel evaluations whose weights vanished after stabilization")
            .labelNames("scale")
            .register(registry);

        this.blendCoefficient = Gauge.build()
            .name("latent_source_blend_coefficient")
            .help("Fitted blend coefficients (w0 bias, w1 short, w2 medium, w3 long)")
            .labelNames("coefficient")
            .register(registry);

        this.blendRSquared = Gauge.build()
            .name("latent_source_blend_r_squared")
            .help("In-sample R squared of the last blend fit")
            .register(registry);

        this.backtestBalance = Gauge.build()
            .name("latent_source_backtest_balance")
            .help("Final balance of the last backtest")
            .labelNames("policy")
            .register(registry);

        this.backtestInventory = Gauge.build()
            .name("latent_source_backtest_inventory")
            .help("Net inventory left by the unbounded policy")
            .register(registry);

        log.info("Prometheus pipeline metrics initialized");
    }

    @Override
    public void recordStageSuccess(PipelineStage stage, Duration duration) {
        stageDuration.labels(stage.getMetricLabel()).observe(toSeconds(duration));
    }

    @Override
    public void recordStageFailure(PipelineStage stage, String errorType, Duration duration) {
        stageFailures.labels(stage.getMetricLabel(), errorType).inc();
        stageDuration.labels(stage.getMetricLabel()).observe(toSeconds(duration));
    }

    @Override
    public void recordKernelEvaluations(TimeScale scale, long count) {
        kernelEvaluations.labels(scale.name().toLowerCase()).inc(count);
    }

    @Override
    public void recordDegenerateKernel(TimeScale scale) {
        degenerateKernels.labels(scale.name().toLowerCase()).inc();
    }

    @Override
    public void recordBlendFit(BlendModel model) {
        blendCoefficient.labels("w0").set(model.bias());
        blendCoefficient.labels("w1").set(model.shortWeight());
        blendCoefficient.labels("w2").set(model.mediumWeight());
        blendCoefficient.labels("w3").set(model.longWeight());
        blendRSquared.set(model.rSquared());
    }

    @Override
    public void recordBacktest(BoundedRunResult bounded, InventoryRunResult inventory) {
        backtestBalance.labels("bounded").set(bounded.finalBalance());
        backtestBalance.labels("inventory").set(inventory.finalBalance());
        backtestInventory.set(inventory.netInventory());
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
