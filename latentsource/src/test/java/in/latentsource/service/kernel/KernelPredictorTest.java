package in.latentsource.service.kernel;

import in.latentsource.domain.common.DegenerateKernelWeightsException;
import in.latentsource.domain.common.EmptyLibraryException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.ClusterCenter;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.TimeScale;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KernelPredictor.
 *
 * Tests:
 * - Exact matches and equal weights
 * - Stability when every raw weight underflows
 * - Empty and degenerate libraries
 * - Trailing window reads
 */
class KernelPredictorTest {

    @Test
    void testSingleExactMatchReturnsItsLabel() {
        PatternLibrary library = library(TimeScale.SHORT, center(0.37, 1, 2, 3));

        assertEquals(0.37, KernelPredictor.predict(new double[] {1, 2, 3}, library));
    }

    @Test
    void testTwoExactMatchesAverageTheirLabels() {
        PatternLibrary library = library(TimeScale.SHORT, center(1.5, 4, 5), center(-0.5, 4, 5));

        assertEquals(0.5, KernelPredictor.predict(new double[] {4, 5}, library));
    }

    @Test
    void testWeightsDecayWithDistance() {
        // distances 0 and 4 -> weights 1 and e^-1
        PatternLibrary library = library(TimeScale.SHORT, center(1.0, 0, 0), center(0.0, 2, 0));

        double expected = 1.0 / (1.0 + Math.exp(-1.0));
        assertEquals(expected, KernelPredictor.predict(new double[] {0, 0}, library), 1e-15);
    }

    @Test
    void testStaysDefinedWhenAllRawWeightsUnderflow() {
        // exp(-0.25 * 20000) and exp(-0.25 * 20201) are both 0.0 in double precision
        PatternLibrary library = library(TimeScale.LONG, center(2.0, 100, 100), center(4.0, 101, 100));
        assertEquals(0.0, Math.exp(-0.25 * 20000), "Precondition: raw weight underflows");

        double estimate = KernelPredictor.predict(new double[] {0, 0}, library);

        assertTrue(Double.isFinite(estimate));
        assertEquals(2.0, estimate, 1e-12, "Closest center dominates");
    }

    @Test
    void testEqualFarCentersStillAverage() {
        PatternLibrary library = library(TimeScale.MEDIUM, center(3.0, 1000, 0), center(5.0, -1000, 0));

        assertEquals(4.0, KernelPredictor.predict(new double[] {0, 0}, library), 1e-12);
    }

    @Test
    void testEmptyLibraryFails() {
        PatternLibrary empty = new PatternLibrary(TimeScale.MEDIUM, 2, 1, 1, List.of());

        EmptyLibraryException e = assertThrows(EmptyLibraryException.class,
            () -> KernelPredictor.predict(new double[] {1, 2}, empty));
        assertEquals(TimeScale.MEDIUM, e.getScale());
        assertEquals(PipelineStage.KERNEL_PREDICTION, e.getStage());
    }

    @Test
    void testInfiniteDistancesAreDegenerate() {
        PatternLibrary library = library(TimeScale.SHORT, center(0.25, 1e200, 1e200), center(0.75, 1e200, -1e200));

        DegenerateKernelWeightsException e = assertThrows(DegenerateKernelWeightsException.class,
            () -> KernelPredictor.predict(new double[] {-1e200, -1e200}, library));
        assertEquals(TimeScale.SHORT, e.getScale());
        assertEquals(PipelineStage.KERNEL_PREDICTION, e.getStage());
        assertEquals(0.25, e.getNearestLabel());
    }

    @Test
    void testQueryLengthMustMatchLibrary() {
        PatternLibrary library = library(TimeScale.SHORT, center(1.0, 1, 2, 3));

        assertThrows(IllegalArgumentException.class, () -> KernelPredictor.predict(new double[] {1, 2}, library));
    }

    @Test
    void testTrailingWindowMatchesExplicitQuery() {
        PriceSeries series = PriceSeries.of(1.0, 1.2, 0.9, 1.4, 1.1, 1.3);
        PatternLibrary library = library(TimeScale.SHORT,
            center(0.1, 1.0, 1.0, 1.0), center(-0.2, 0.9, 1.4, 1.1), center(0.3, 1.3, 1.0, 1.2));

        double trailing = KernelPredictor.predictTrailing(series, 5, library);
        double explicit = KernelPredictor.predict(series.slice(2, 5), library);

        assertEquals(explicit, trailing);
    }

    @Test
    void testTrailingWindowMustFitSeries() {
        PriceSeries series = PriceSeries.of(1, 2, 3);
        PatternLibrary library = library(TimeScale.SHORT, center(1.0, 1, 2, 3));

        assertThrows(IllegalArgumentException.class, () -> KernelPredictor.predictTrailing(series, 2, library));
        assertThrows(IllegalArgumentException.class, () -> KernelPredictor.predictTrailing(series, 4, library));
    }

    static ClusterCenter center(double label, double... feature) {
        double[] coordinates = new double[feature.length + 1];
        System.arraycopy(feature, 0, coordinates, 0, feature.length);
        coordinates[feature.length] = label;
        return new ClusterCenter(coordinates);
    }

    static PatternLibrary library(TimeScale scale, ClusterCenter... centers) {
        int n = centers[0].featureLength();
        return new PatternLibrary(scale, n, centers.length, centers.length, List.of(centers));
    }
}
