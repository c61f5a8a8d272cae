package in.latentsource.infrastructure.metrics;

import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;

import java.time.Duration;

/**
 * Metrics sink that records nothing.
 */
public final class NoOpPipelineMetrics implements PipelineMetrics {

    public static final NoOpPipelineMetrics INSTANCE = new NoOpPipelineMetrics();

    private NoOpPipelineMetrics() {}

    @Override
    public void recordStageSuccess(PipelineStage stage, Duration duration) {}

    @Override
    public void recordStageFailure(PipelineStage stage, String errorType, Duration duration) {}

    @Override
    public void recordKernelEvaluations(TimeScale scale, long count) {}

    @Override
    public void recordDegenerateKernel(TimeScale scale) {}

    @Override
    public void recordBlendFit(BlendModel model) {}

    @Override
    public void recordBacktest(BoundedRunResult bounded, InventoryRunResult inventory) {}
}
