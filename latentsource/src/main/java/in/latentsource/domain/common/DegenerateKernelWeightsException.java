package in.latentsource.domain.common;

import in.latentsource.domain.series.TimeScale;

/**
 * Exception thrown when every kernel weight vanishes even after log-domain normalization.
 *
 * Callers that prefer a nearest-neighbour fallback can catch this and use
 * {@link #getNearestLabel()}, the label of the closest center.
 */
public class DegenerateKernelWeightsException extends LatentSourceException {

    private final TimeScale scale;
    private final double nearestLabel;

    public DegenerateKernelWeightsException(TimeScale scale, double weightSum, double nearestLabel) {
        super(PipelineStage.KERNEL_PREDICTION,
            String.format("Kernel weights for scale %s are degenerate (stabilized sum=%s)", scale, weightSum));
        this.scale = scale;
        this.nearestLabel = nearestLabel;
    }

    public TimeScale getScale() {
        return scale;
    }

    public double getNearestLabel() {
        return nearestLabel;
    }
}
