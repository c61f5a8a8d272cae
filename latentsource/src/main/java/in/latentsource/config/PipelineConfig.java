package in.latentsource.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.latentsource.domain.series.TimeScale;

/**
 * Full configuration for one pipeline run.
 *
 * Defaults reproduce the reference setup: windows of 180/360/720 prices,
 * 100 centroids per scale of which the 20 widest are kept, threshold 1e-4,
 * a trading decision at every step.
 */
public record PipelineConfig(
    @JsonProperty("shortScale")
    ScaleConfig shortScale,

    @JsonProperty("mediumScale")
    ScaleConfig mediumScale,

    @JsonProperty("longScale")
    ScaleConfig longScale,

    @JsonProperty("clustering")
    ClusteringConfig clustering,

    @JsonProperty("trading")
    TradingConfig trading,

    @JsonProperty("parallelism")
    int parallelism         // worker threads for kernel evaluation (1 = sequential)
) {
    public static PipelineConfig defaults() {
        return new PipelineConfig(
            ScaleConfig.of(TimeScale.SHORT.getDefaultWindowLength()),
            ScaleConfig.of(TimeScale.MEDIUM.getDefaultWindowLength()),
            ScaleConfig.of(TimeScale.LONG.getDefaultWindowLength()),
            ClusteringConfig.defaults(),
            TradingConfig.defaults(),
            Math.max(1, Runtime.getRuntime().availableProcessors())
        );
    }

    public ScaleConfig scale(TimeScale scale) {
        return switch (scale) {
            case SHORT -> shortScale;
            case MEDIUM -> mediumScale;
            case LONG -> longScale;
        };
    }

    /**
     * Longest window across the three scales; the first eligible timestep of a period.
     */
    @JsonIgnore
    public int longestWindow() {
        return Math.max(shortScale.windowLength(), Math.max(mediumScale.windowLength(), longScale.windowLength()));
    }

    public PipelineConfig withClustering(ClusteringConfig newClustering) {
        return new PipelineConfig(shortScale, mediumScale, longScale, newClustering, trading, parallelism);
    }

    public PipelineConfig withTrading(TradingConfig newTrading) {
        return new PipelineConfig(shortScale, mediumScale, longScale, clustering, newTrading, parallelism);
    }

    public PipelineConfig withParallelism(int newParallelism) {
        return new PipelineConfig(shortScale, mediumScale, longScale, clustering, trading, newParallelism);
    }

    /**
     * Validate configuration values.
     *
     * @throws IllegalArgumentException naming the first invalid section
     */
    public PipelineConfig validate() {
        for (TimeScale scale : TimeScale.values()) {
            ScaleConfig sc = scale(scale);
            if (sc == null || !sc.isValid()) {
                throw new IllegalArgumentException("Invalid scale config for " + scale + ": " + sc);
            }
        }
        if (clustering == null || !clustering.isValid()) {
            throw new IllegalArgumentException("Invalid clustering config: " + clustering);
        }
        if (trading == null || !trading.isValid()) {
            throw new IllegalArgumentException("Invalid trading config: " + trading);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        return this;
    }
}
