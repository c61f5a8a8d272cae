package in.latentsource.service.cluster;

import in.latentsource.config.ScaleConfig;
import in.latentsource.domain.common.InsufficientDataException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.ClusterCenter;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.series.Window;
import in.latentsource.service.window.WindowExtractor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatternClusterer.
 *
 * Tests:
 * - Seeded runs are reproducible
 * - Well separated groups are recovered
 * - Cluster count bounds
 * - Effective center selection (feature range only, stable ties)
 * - Library construction
 */
class PatternClustererTest {

    @Test
    void testSameSeedGivesIdenticalCentroidsAndSelection() {
        List<Window> windows = WindowExtractor.extract(noisyWave(400, 11L), 6);

        ClusteringResult first = new PatternClusterer(7L).cluster(windows, 8);
        ClusteringResult second = new PatternClusterer(7L).cluster(windows, 8);

        assertEquals(first.centroids(), second.centroids(), "Same seed must reproduce centroids in order");
        assertEquals(first.inertia(), second.inertia());
        assertEquals(
            PatternClusterer.selectEffective(first.centroids(), 3),
            PatternClusterer.selectEffective(second.centroids(), 3),
            "Same seed must reproduce the effective selection");
    }

    @Test
    void testRecoversWellSeparatedGroups() {
        List<Window> windows = new ArrayList<>();
        Random random = new Random(3L);
        for (int i = 0; i < 30; i++) {
            windows.add(new Window(new double[] {0 + jitter(random), 0 + jitter(random)}, 1.0));
            windows.add(new Window(new double[] {50 + jitter(random), 50 + jitter(random)}, -1.0));
        }

        ClusteringResult result = new PatternClusterer(1L).cluster(windows, 2);

        assertEquals(2, result.size());
        List<Double> labels = new ArrayList<>();
        for (ClusterCenter center : result.centroids()) {
            labels.add(center.label());
        }
        assertTrue(labels.contains(1.0), "One centroid should average the +1 labels: " + labels);
        assertTrue(labels.contains(-1.0), "One centroid should average the -1 labels: " + labels);
        assertTrue(result.inertia() < 60 * 2 * 0.01, "Inertia should only reflect jitter: " + result.inertia());
    }

    @Test
    void testClusterCountAboveWindowCountFails() {
        List<Window> windows = WindowExtractor.extract(PriceSeries.of(1, 2, 3, 4, 5), 2);

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
            () -> new PatternClusterer(1L).cluster(windows, 4));
        assertEquals(PipelineStage.CLUSTERING, e.getStage());
        assertEquals(4, e.getRequired());
        assertEquals(3, e.getAvailable());
    }

    @Test
    void testClusterCountEqualToWindowCountReturnsEveryPoint() {
        List<Window> windows = WindowExtractor.extract(PriceSeries.of(1, 4, 2, 8, 5), 2);

        ClusteringResult result = new PatternClusterer(5L).cluster(windows, 3);

        assertEquals(3, result.size());
        assertEquals(0.0, result.inertia(), 1e-12, "Each window should get its own centroid");
    }

    @Test
    void testNonPositiveClusterCountRejected() {
        List<Window> windows = WindowExtractor.extract(PriceSeries.of(1, 2, 3, 4, 5), 2);

        assertThrows(IllegalArgumentException.class, () -> new PatternClusterer(1L).cluster(windows, 0));
    }

    @Test
    void testSelectEffectiveUsesFeatureRangeOnly() {
        // Label 100 would dominate a range computed over every coordinate
        ClusterCenter flatWithHugeLabel = new ClusterCenter(new double[] {5, 5, 5, 100});
        ClusterCenter wide = new ClusterCenter(new double[] {0, 10, 5, 0});
        ClusterCenter medium = new ClusterCenter(new double[] {0, 3, 1, 0});

        List<ClusterCenter> selected = PatternClusterer.selectEffective(
            List.of(flatWithHugeLabel, wide, medium), 2);

        assertEquals(List.of(medium, wide), selected, "Top 2 by feature range, ascending");
    }

    @Test
    void testSelectEffectiveKeepsOriginalOrderOnTies() {
        ClusterCenter a = new ClusterCenter(new double[] {0, 2, 1.0});
        ClusterCenter b = new ClusterCenter(new double[] {1, 3, 2.0});
        ClusterCenter c = new ClusterCenter(new double[] {5, 7, 3.0});
        ClusterCenter narrow = new ClusterCenter(new double[] {0, 1, 4.0});

        List<ClusterCenter> selected = PatternClusterer.selectEffective(List.of(a, narrow, b, c), 2);

        // a, b and c share range 2; stable sort keeps a < b < c, the last two win
        assertEquals(List.of(b, c), selected);
    }

    @Test
    void testSelectEffectiveBounds() {
        List<ClusterCenter> centers = List.of(new ClusterCenter(new double[] {0, 1, 0}));

        assertThrows(IllegalArgumentException.class, () -> PatternClusterer.selectEffective(centers, 0));
        assertThrows(IllegalArgumentException.class, () -> PatternClusterer.selectEffective(centers, 2));
    }

    @Test
    void testBuildLibrary() {
        PriceSeries prices = noisyWave(300, 21L);

        PatternLibrary library = new PatternClusterer(9L, 100, 3, 1e-4)
            .buildLibrary(TimeScale.MEDIUM, prices, new ScaleConfig(10, 12, 4));

        assertEquals(TimeScale.MEDIUM, library.scale());
        assertEquals(10, library.windowLength());
        assertEquals(4, library.size());
        assertEquals(290, library.windowCount());
        for (int i = 1; i < library.size(); i++) {
            assertTrue(library.centers().get(i - 1).featureRange() <= library.centers().get(i).featureRange(),
                "Library is ordered by ascending feature range");
        }
        for (ClusterCenter center : library.centers()) {
            assertEquals(10, center.featureLength());
        }
    }

    private static PriceSeries noisyWave(int length, long seed) {
        Random random = new Random(seed);
        double[] prices = new double[length];
        for (int i = 0; i < length; i++) {
            prices[i] = 100 + 3 * Math.sin(i / 9.0) + 0.5 * random.nextGaussian();
        }
        return PriceSeries.of(prices);
    }

    private static double jitter(Random random) {
        return 0.05 * (random.nextDouble() - 0.5);
    }
}
