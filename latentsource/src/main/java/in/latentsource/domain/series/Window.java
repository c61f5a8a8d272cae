package in.latentsource.domain.series;

import java.util.Arrays;

/**
 * A fixed-length slice of prices paired with the realized change right after it.
 *
 * label = price[end] - price[end - 1], where end is the first index past the slice.
 */
public record Window(
    double[] feature,
    double label
) {
    public Window {
        feature = feature.clone();
    }

    @Override
    public double[] feature() {
        return feature.clone();
    }

    public int length() {
        return feature.length;
    }

    /**
     * Flatten to an (n+1)-point: feature coordinates followed by the label.
     */
    public double[] toPoint() {
        double[] point = Arrays.copyOf(feature, feature.length + 1);
        point[feature.length] = label;
        return point;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Window)) return false;
        Window other = (Window) o;
        return Double.compare(label, other.label) == 0 && Arrays.equals(feature, other.feature);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(feature) + Double.hashCode(label);
    }

    @Override
    public String toString() {
        return "Window[feature=" + Arrays.toString(feature) + ", label=" + label + "]";
    }
}
