package in.latentsource.service.blend;

import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.service.kernel.ScalePredictionEngine;
import in.latentsource.service.kernel.ScalePredictions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ensemble Predictor - applies a fitted blend to the test period.
 *
 * The signal covers timesteps [longest, L-2]; its index 0 is timestep
 * {@code longest}, so its length is L - longest - 1.
 */
public final class EnsemblePredictor {
    private static final Logger log = LoggerFactory.getLogger(EnsemblePredictor.class);

    private final ScalePredictionEngine engine;

    public EnsemblePredictor() {
        this(new ScalePredictionEngine());
    }

    public EnsemblePredictor(ScalePredictionEngine engine) {
        this.engine = engine;
    }

    public Signal predict(PriceSeries period, ScaleLibraries libraries, BlendModel model) {
        ScalePredictions predictions = engine.predict(period, libraries, PipelineStage.ENSEMBLE_PREDICTION);
        Signal signal = blend(predictions, model);
        log.info("Ensemble prediction produced {}", signal.getSummary());
        return signal;
    }

    /**
     * Blend precomputed per-scale predictions.
     */
    public static Signal blend(ScalePredictions predictions, BlendModel model) {
        double[] values = new double[predictions.size()];
        for (int t = 0; t < values.length; t++) {
            values[t] = model.apply(
                predictions.shortPredictions()[t],
                predictions.mediumPredictions()[t],
                predictions.longPredictions()[t]);
        }
        return new Signal(predictions.offset(), values);
    }
}
