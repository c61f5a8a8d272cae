package in.latentsource.service.cluster;

import in.latentsource.domain.model.ClusterCenter;

import java.util.List;

/**
 * Outcome of one k-means run: the winning restart's centroids in output order.
 */
public record ClusteringResult(
    List<ClusterCenter> centroids,
    double inertia,         // total within-cluster squared distance
    int iterations,         // Lloyd iterations of the winning restart
    int restart             // index of the winning restart
) {
    public ClusteringResult {
        centroids = List.copyOf(centroids);
    }

    public int size() {
        return centroids.size();
    }
}
