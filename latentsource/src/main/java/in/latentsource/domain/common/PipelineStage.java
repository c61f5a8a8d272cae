package in.latentsource.domain.common;

/**
 * Stages of the latent source pipeline, used to attribute failures and metrics.
 */
public enum PipelineStage {
    WINDOW_EXTRACTION("window_extraction"),
    CLUSTERING("clustering"),
    KERNEL_PREDICTION("kernel_prediction"),
    BLEND_TRAINING("blend_training"),
    ENSEMBLE_PREDICTION("ensemble_prediction"),
    TRADING_SIMULATION("trading_simulation");

    private final String metricLabel;

    PipelineStage(String metricLabel) {
        this.metricLabel = metricLabel;
    }

    public String getMetricLabel() {
        return metricLabel;
    }
}
