package in.latentsource.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Linear blend of the three per-scale kernel predictions:
 * deltaP = bias + shortWeight*d1 + mediumWeight*d2 + longWeight*d3.
 */
public record BlendModel(
    double bias,            // w0
    double shortWeight,     // w1
    double mediumWeight,    // w2
    double longWeight,      // w3
    int trainingRows,       // rows used by the fit (informational)
    double rSquared         // in-sample coefficient of determination (informational)
) {
    public BlendModel {
        if (!Double.isFinite(bias) || !Double.isFinite(shortWeight)
            || !Double.isFinite(mediumWeight) || !Double.isFinite(longWeight)) {
            throw new IllegalArgumentException("Blend coefficients must be finite");
        }
    }

    public static BlendModel of(double bias, double shortWeight, double mediumWeight, double longWeight) {
        return new BlendModel(bias, shortWeight, mediumWeight, longWeight, 0, Double.NaN);
    }

    public double apply(double shortPrediction, double mediumPrediction, double longPrediction) {
        return bias + shortWeight * shortPrediction + mediumWeight * mediumPrediction + longWeight * longPrediction;
    }

    @JsonIgnore
    public double[] coefficients() {
        return new double[] {bias, shortWeight, mediumWeight, longWeight};
    }

    @JsonIgnore
    public String getSummary() {
        return String.format("w0=%.6g, w1=%.6g, w2=%.6g, w3=%.6g (rows=%d, R2=%.4f)",
            bias, shortWeight, mediumWeight, longWeight, trainingRows, rSquared);
    }
}
