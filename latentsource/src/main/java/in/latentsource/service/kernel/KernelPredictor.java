package in.latentsource.service.kernel;

import in.latentsource.domain.common.DegenerateKernelWeightsException;
import in.latentsource.domain.common.EmptyLibraryException;
import in.latentsource.domain.model.ClusterCenter;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.series.PriceSeries;

import java.util.List;

/**
 * Kernel Predictor - similarity-weighted estimate of the next price change.
 *
 * Nadaraya-Watson average over the library's centers:
 *   weight_j = exp(-0.25 * |x - feature_j|^2)
 *   estimate = sum(label_j * weight_j) / sum(weight_j)
 *
 * Exponents are shifted by their maximum before exponentiation, so the
 * closest center always has weight 1 and the ratio stays defined when every
 * raw weight would underflow to zero.
 */
public final class KernelPredictor {

    /**
     * Kernel bandwidth constant in the exponent.
     */
    public static final double BANDWIDTH = 0.25;

    /**
     * Predict from an explicit query window.
     *
     * @param query   Window of library.windowLength() prices
     * @param library Effective centers for the query's scale
     * @return Weighted average of center labels
     */
    public static double predict(double[] query, PatternLibrary library) {
        if (query.length != library.windowLength()) {
            throw new IllegalArgumentException(String.format(
                "Query has %d prices but %s library expects %d",
                query.length, library.scale(), library.windowLength()));
        }
        List<ClusterCenter> centers = requireCenters(library);
        double[] exponents = new double[centers.size()];
        for (int j = 0; j < exponents.length; j++) {
            exponents[j] = -BANDWIDTH * centers.get(j).squaredFeatureDistance(query);
        }
        return weightedAverage(centers, exponents, library);
    }

    /**
     * Predict from the trailing window series[end - n, end), read in place.
     *
     * @param series  Price period
     * @param end     Exclusive end of the window
     * @param library Effective centers for the scale
     */
    public static double predictTrailing(PriceSeries series, int end, PatternLibrary library) {
        int n = library.windowLength();
        int from = end - n;
        if (from < 0 || end > series.size()) {
            throw new IllegalArgumentException(String.format(
                "Trailing window [%d, %d) is outside a series of %d prices", from, end, series.size()));
        }
        List<ClusterCenter> centers = requireCenters(library);
        double[] exponents = new double[centers.size()];
        for (int j = 0; j < exponents.length; j++) {
            exponents[j] = -BANDWIDTH * centers.get(j).squaredFeatureDistance(series, from);
        }
        return weightedAverage(centers, exponents, library);
    }

    private static List<ClusterCenter> requireCenters(PatternLibrary library) {
        if (library.isEmpty()) {
            throw new EmptyLibraryException(library.scale());
        }
        return library.centers();
    }

    private static double weightedAverage(List<ClusterCenter> centers, double[] exponents, PatternLibrary library) {
        int nearest = 0;
        for (int j = 1; j < exponents.length; j++) {
            if (exponents[j] > exponents[nearest]) {
                nearest = j;
            }
        }
        double maxExponent = exponents[nearest];

        double numerator = 0.0;
        double denominator = 0.0;
        for (int j = 0; j < exponents.length; j++) {
            double weight = Math.exp(exponents[j] - maxExponent);
            numerator += centers.get(j).label() * weight;
            denominator += weight;
        }

        if (!(denominator > 0.0) || !Double.isFinite(denominator) || !Double.isFinite(numerator)) {
            throw new DegenerateKernelWeightsException(library.scale(), denominator, centers.get(nearest).label());
        }
        return numerator / denominator;
    }

    private KernelPredictor() {}
}
