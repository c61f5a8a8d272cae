package in.latentsource.domain.model;

import in.latentsource.domain.series.PriceSeries;

import java.util.Arrays;

/**
 * Centroid in feature+label space.
 *
 * The first n coordinates are the price pattern, the last one is the
 * average next-step change of the windows in the cluster. A centroid is not
 * necessarily an observed window.
 */
public record ClusterCenter(
    double[] coordinates
) {
    public ClusterCenter {
        if (coordinates == null || coordinates.length < 2) {
            throw new IllegalArgumentException("A cluster center needs at least one feature and a label");
        }
        coordinates = coordinates.clone();
    }

    @Override
    public double[] coordinates() {
        return coordinates.clone();
    }

    public int featureLength() {
        return coordinates.length - 1;
    }

    public double label() {
        return coordinates[coordinates.length - 1];
    }

    public double featureAt(int index) {
        if (index >= featureLength()) {
            throw new IndexOutOfBoundsException("Feature index " + index + " >= " + featureLength());
        }
        return coordinates[index];
    }

    /**
     * Peak-to-peak range over the feature coordinates only (label excluded).
     */
    public double featureRange() {
        double min = coordinates[0];
        double max = coordinates[0];
        for (int i = 1; i < featureLength(); i++) {
            min = Math.min(min, coordinates[i]);
            max = Math.max(max, coordinates[i]);
        }
        return max - min;
    }

    /**
     * Squared Euclidean distance between a query and this center's feature.
     */
    public double squaredFeatureDistance(double[] query) {
        int n = featureLength();
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double d = query[i] - coordinates[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Squared Euclidean distance between series[from, from + n) and this center's feature.
     */
    public double squaredFeatureDistance(PriceSeries series, int from) {
        int n = featureLength();
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double d = series.get(from + i) - coordinates[i];
            sum += d * d;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClusterCenter)) return false;
        return Arrays.equals(coordinates, ((ClusterCenter) o).coordinates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coordinates);
    }

    @Override
    public String toString() {
        return String.format("ClusterCenter[n=%d, label=%.6f, range=%.6f]",
            featureLength(), label(), featureRange());
    }
}
