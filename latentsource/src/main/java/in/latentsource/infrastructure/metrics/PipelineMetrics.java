package in.latentsource.infrastructure.metrics;

import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;

import java.time.Duration;

/**
 * Pipeline metrics interface.
 *
 * Implementations can publish to Prometheus or drop everything.
 *
 * Key metrics:
 * - Stage durations and failures
 * - Kernel evaluation volume per scale
 * - Degenerate kernel weight occurrences
 * - Blend fit quality
 * - Backtest outcomes per policy
 */
public interface PipelineMetrics {

    /**
     * Record a stage that completed.
     *
     * @param stage    Pipeline stage
     * @param duration Wall time of the stage
     */
    void recordStageSuccess(PipelineStage stage, Duration duration);

    /**
     * Record a stage that failed.
     *
     * @param stage     Pipeline stage
     * @param errorType Simple class name of the failure
     * @param duration  Time to failure
     */
    void recordStageFailure(PipelineStage stage, String errorType, Duration duration);

    /**
     * Record kernel predictions evaluated for a scale.
     */
    void recordKernelEvaluations(TimeScale scale, long count);

    /**
     * Record a kernel evaluation whose weights vanished.
     */
    void recordDegenerateKernel(TimeScale scale);

    /**
     * Record the fitted blend coefficients and R².
     */
    void recordBlendFit(BlendModel model);

    /**
     * Record both backtest outcomes.
     */
    void recordBacktest(BoundedRunResult bounded, InventoryRunResult inventory);
}
