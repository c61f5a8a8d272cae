package in.latentsource.domain.model;

import in.latentsource.domain.series.TimeScale;

import java.util.List;

/**
 * Effective cluster centers for one time scale, ordered by ascending feature range.
 */
public record PatternLibrary(
    TimeScale scale,
    int windowLength,
    int clusterCount,       // k used when clustering
    int windowCount,        // windows available to the clusterer
    List<ClusterCenter> centers
) {
    public PatternLibrary {
        centers = List.copyOf(centers);
        for (ClusterCenter center : centers) {
            if (center.featureLength() != windowLength) {
                throw new IllegalArgumentException(String.format(
                    "Center has %d features but library %s uses windows of %d",
                    center.featureLength(), scale, windowLength));
            }
        }
        if (centers.size() > clusterCount || clusterCount > windowCount) {
            throw new IllegalArgumentException(String.format(
                "Library %s violates size <= clusterCount <= windowCount (%d, %d, %d)",
                scale, centers.size(), clusterCount, windowCount));
        }
    }

    public int size() {
        return centers.size();
    }

    public boolean isEmpty() {
        return centers.isEmpty();
    }

    public String getSummary() {
        return String.format("%s library: %d/%d centers, n=%d, windows=%d",
            scale, centers.size(), clusterCount, windowLength, windowCount);
    }
}
