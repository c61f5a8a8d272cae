package in.latentsource.service.kernel;

/**
 * Per-scale kernel predictions for every eligible timestep of one period.
 *
 * Index t corresponds to timestep offset + t; each prediction uses the
 * trailing window that ends right before that timestep.
 */
public record ScalePredictions(
    int offset,
    double[] shortPredictions,
    double[] mediumPredictions,
    double[] longPredictions
) {
    public ScalePredictions {
        if (shortPredictions.length != mediumPredictions.length
            || mediumPredictions.length != longPredictions.length) {
            throw new IllegalArgumentException("Per-scale prediction arrays must be aligned");
        }
    }

    public int size() {
        return shortPredictions.length;
    }

    public int timestepOf(int t) {
        return offset + t;
    }

    /**
     * Predictor row (d1, d2, d3) for index t.
     */
    public double[] row(int t) {
        return new double[] {shortPredictions[t], mediumPredictions[t], longPredictions[t]};
    }
}
