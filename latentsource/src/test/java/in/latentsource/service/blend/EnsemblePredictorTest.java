package in.latentsource.service.blend;

import in.latentsource.domain.common.InsufficientDataException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.service.kernel.KernelPredictor;
import in.latentsource.service.kernel.ScalePredictions;
import org.junit.jupiter.api.Test;

import static in.latentsource.service.blend.BlendModelTrainerTest.libraries;
import static in.latentsource.service.blend.BlendModelTrainerTest.randomWalk;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EnsemblePredictor.
 */
class EnsemblePredictorTest {

    @Test
    void testSignalCoversEligibleTimesteps() {
        PriceSeries period = randomWalk(50, 4L);
        ScaleLibraries libraries = libraries();
        BlendModel model = BlendModel.of(0.001, 0.5, 0.3, 0.2);

        Signal signal = new EnsemblePredictor().predict(period, libraries, model);

        assertEquals(6, signal.offset());
        assertEquals(50 - 6 - 1, signal.size());

        int t = 10;
        int timestep = signal.timestepOf(t);
        double expected = model.apply(
            KernelPredictor.predictTrailing(period, timestep, libraries.shortLibrary()),
            KernelPredictor.predictTrailing(period, timestep, libraries.mediumLibrary()),
            KernelPredictor.predictTrailing(period, timestep, libraries.longLibrary()));
        assertEquals(expected, signal.get(t), 1e-15);
    }

    @Test
    void testBlendAppliesCoefficients() {
        ScalePredictions predictions = new ScalePredictions(3,
            new double[] {1.0, -1.0}, new double[] {2.0, 0.0}, new double[] {0.5, 4.0});
        BlendModel model = BlendModel.of(0.1, 1.0, -0.5, 2.0);

        Signal signal = EnsemblePredictor.blend(predictions, model);

        assertEquals(3, signal.offset());
        assertArrayEquals(new double[] {0.1 + 1.0 - 1.0 + 1.0, 0.1 - 1.0 + 0.0 + 8.0}, signal.values(), 1e-12);
    }

    @Test
    void testTestPeriodTooShort() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
            () -> new EnsemblePredictor().predict(randomWalk(6, 2L), libraries(), BlendModel.of(0, 1, 1, 1)));
        assertEquals(PipelineStage.ENSEMBLE_PREDICTION, e.getStage());
        assertEquals(8, e.getRequired());
    }
}
