package in.latentsource.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * K-means settings shared by every scale.
 */
public record ClusteringConfig(
    @JsonProperty("seed")
    long seed,              // pins centroid initialization

    @JsonProperty("maxIterations")
    int maxIterations,      // Lloyd iterations per restart

    @JsonProperty("restarts")
    int restarts,           // independent initializations, lowest inertia wins

    @JsonProperty("tolerance")
    double tolerance        // centroid shift, relative to mean data variance
) {
    public static ClusteringConfig defaults() {
        return new ClusteringConfig(
            42L,
            300,
            10,
            1e-4
        );
    }

    public ClusteringConfig withSeed(long newSeed) {
        return new ClusteringConfig(newSeed, maxIterations, restarts, tolerance);
    }

    @JsonIgnore
    public boolean isValid() {
        return maxIterations > 0 && restarts > 0 && tolerance >= 0 && Double.isFinite(tolerance);
    }
}
