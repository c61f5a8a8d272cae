package in.latentsource.domain.model;

import java.util.Arrays;

/**
 * Ensemble predictions over a test period.
 *
 * Index 0 corresponds to absolute timestep {@code offset} of the period, the
 * first timestep with enough trailing history for every scale.
 */
public record Signal(
    int offset,
    double[] values
) {
    public Signal {
        if (offset < 0) {
            throw new IllegalArgumentException("Signal offset must be non-negative: " + offset);
        }
        values = values.clone();
        for (int t = 0; t < values.length; t++) {
            if (!Double.isFinite(values[t])) {
                throw new IllegalArgumentException("Signal value at " + t + " is not finite: " + values[t]);
            }
        }
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double get(int t) {
        return values[t];
    }

    /**
     * Absolute timestep in the test period for signal index t.
     */
    public int timestepOf(int t) {
        return offset + t;
    }

    public String getSummary() {
        if (values.length == 0) {
            return "Signal[empty, offset=" + offset + "]";
        }
        double min = Arrays.stream(values).min().orElse(0.0);
        double max = Arrays.stream(values).max().orElse(0.0);
        double mean = Arrays.stream(values).average().orElse(0.0);
        return String.format("Signal[size=%d, offset=%d, min=%.6g, mean=%.6g, max=%.6g]",
            values.length, offset, min, mean, max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signal)) return false;
        Signal other = (Signal) o;
        return offset == other.offset && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * offset + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return getSummary();
    }
}
