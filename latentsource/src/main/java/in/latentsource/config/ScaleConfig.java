package in.latentsource.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pattern library sizing for one time scale.
 */
public record ScaleConfig(
    @JsonProperty("windowLength")
    int windowLength,       // trailing prices per window (e.g., 180)

    @JsonProperty("clusterCount")
    int clusterCount,       // k-means centroids (e.g., 100)

    @JsonProperty("effectiveCount")
    int effectiveCount      // centers kept by largest feature range (e.g., 20)
) {
    public static ScaleConfig of(int windowLength) {
        return new ScaleConfig(windowLength, 100, 20);
    }

    @JsonIgnore
    public boolean isValid() {
        return windowLength > 0
            && clusterCount > 0
            && effectiveCount > 0
            && effectiveCount <= clusterCount;
    }
}
