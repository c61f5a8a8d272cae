package in.latentsource.service.blend;

import in.latentsource.domain.common.FitException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.service.kernel.ScalePredictionEngine;
import in.latentsource.service.kernel.ScalePredictions;
import org.ojalgo.matrix.decomposition.SingularValue;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.Primitive64Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blend Model Trainer - fits deltaP = w0 + w1*d1 + w2*d2 + w3*d3 on the blend period.
 *
 * Rows are the eligible timesteps i in [longest, L-2]; d1..d3 are the kernel
 * predictions on the trailing windows ending right before i and the target is
 * price[i+1] - price[i].
 *
 * The least-squares solve goes through a singular value decomposition of the
 * design matrix (leading column of ones), never through the normal equations.
 */
public final class BlendModelTrainer {
    private static final Logger log = LoggerFactory.getLogger(BlendModelTrainer.class);

    /**
     * Intercept plus one weight per scale.
     */
    public static final int COLUMNS = 4;

    private static final int MIN_COMFORTABLE_ROWS = 10 * COLUMNS;

    private final ScalePredictionEngine engine;

    public BlendModelTrainer() {
        this(new ScalePredictionEngine());
    }

    public BlendModelTrainer(ScalePredictionEngine engine) {
        this.engine = engine;
    }

    public BlendModel train(PriceSeries period, PatternLibrary shortLibrary,
                            PatternLibrary mediumLibrary, PatternLibrary longLibrary) {
        return train(period, new ScaleLibraries(shortLibrary, mediumLibrary, longLibrary));
    }

    /**
     * Fit blend weights on a period that was not used to build the libraries.
     *
     * @param period    Blend training period
     * @param libraries Libraries from the clustering period
     * @return Fitted blend model
     */
    public BlendModel train(PriceSeries period, ScaleLibraries libraries) {
        ScalePredictions predictions = engine.predict(period, libraries, PipelineStage.BLEND_TRAINING);

        int rows = predictions.size();
        double[][] predictors = new double[rows][];
        double[] labels = new double[rows];
        for (int t = 0; t < rows; t++) {
            predictors[t] = predictions.row(t);
            labels[t] = period.deltaAfter(predictions.timestepOf(t));
        }

        if (rows < MIN_COMFORTABLE_ROWS) {
            log.warn("Blend fit uses only {} rows for {} coefficients", rows, COLUMNS);
        }
        BlendModel model = fit(predictors, labels);
        log.info("Blend model fitted: {}", model.getSummary());
        return model;
    }

    /**
     * Ordinary least squares on explicit (d1, d2, d3) rows.
     *
     * @param predictors Rows of three per-scale predictions
     * @param labels     Realized changes, one per row
     * @return Coefficients with row count and R²
     * @throws FitException if rows < 4 or the design matrix is rank deficient
     */
    public static BlendModel fit(double[][] predictors, double[] labels) {
        int rows = labels.length;
        if (predictors.length != rows) {
            throw new IllegalArgumentException(String.format(
                "Predictor rows (%d) and labels (%d) differ", predictors.length, rows));
        }
        if (rows < COLUMNS) {
            throw new FitException(rows, COLUMNS, "fewer rows than columns");
        }

        double[][] design = new double[rows][COLUMNS];
        double[][] target = new double[rows][1];
        for (int r = 0; r < rows; r++) {
            double[] row = predictors[r];
            if (row.length != COLUMNS - 1) {
                throw new IllegalArgumentException(String.format(
                    "Row %d has %d predictors, expected %d", r, row.length, COLUMNS - 1));
            }
            design[r][0] = 1.0;
            for (int c = 0; c < row.length; c++) {
                if (!Double.isFinite(row[c])) {
                    throw new IllegalArgumentException("Non-finite predictor at row " + r + ", column " + c);
                }
                design[r][c + 1] = row[c];
            }
            if (!Double.isFinite(labels[r])) {
                throw new IllegalArgumentException("Non-finite label at row " + r);
            }
            target[r][0] = labels[r];
        }

        Primitive64Store a = Primitive64Store.FACTORY.rows(design);
        Primitive64Store b = Primitive64Store.FACTORY.rows(target);

        SingularValue<Double> svd = SingularValue.PRIMITIVE.make(a);
        if (!svd.decompose(a)) {
            throw new FitException(rows, COLUMNS, "singular value decomposition did not complete");
        }
        int rank = svd.getRank();
        if (rank < COLUMNS) {
            throw new FitException(rows, COLUMNS, "design matrix is rank deficient (rank " + rank + ")");
        }

        MatrixStore<Double> solution = svd.getSolution(b);
        double[] w = new double[COLUMNS];
        for (int c = 0; c < COLUMNS; c++) {
            w[c] = solution.doubleValue(c, 0);
            if (!Double.isFinite(w[c])) {
                throw new FitException(rows, COLUMNS, "solution is not finite");
            }
        }

        double rSquared = rSquared(design, labels, w);
        log.debug("SVD fit: rows={}, rank={}, R2={}", rows, rank, rSquared);
        return new BlendModel(w[0], w[1], w[2], w[3], rows, rSquared);
    }

    private static double rSquared(double[][] design, double[] labels, double[] w) {
        double mean = 0.0;
        for (double label : labels) {
            mean += label;
        }
        mean /= labels.length;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int r = 0; r < labels.length; r++) {
            double fitted = 0.0;
            for (int c = 0; c < COLUMNS; c++) {
                fitted += design[r][c] * w[c];
            }
            double residual = labels[r] - fitted;
            ssRes += residual * residual;
            double deviation = labels[r] - mean;
            ssTot += deviation * deviation;
        }
        if (ssTot == 0.0) {
            return ssRes == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - ssRes / ssTot;
    }
}
