package in.latentsource.service.cluster;

import in.latentsource.config.ClusteringConfig;
import in.latentsource.config.ScaleConfig;
import in.latentsource.domain.common.InsufficientDataException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.ClusterCenter;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.series.Window;
import in.latentsource.service.window.WindowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Pattern Clusterer - groups labeled windows into k centroids and keeps the most informative ones.
 *
 * Clustering is k-means over (n+1)-points (n prices + label):
 * - k-means++ seeding drawn from a {@link Random} created from the caller's seed
 * - Lloyd relocation until no assignment changes, the centroid shift drops
 *   below tolerance * mean per-coordinate variance, or maxIterations is hit
 * - several restarts, keeping the lowest inertia (first one wins ties)
 * - a cluster left empty is moved onto the point farthest from its centroid
 *
 * The same windows, k and seed always produce the same centroids in the same order.
 */
public final class PatternClusterer {
    private static final Logger log = LoggerFactory.getLogger(PatternClusterer.class);

    private final long seed;
    private final int maxIterations;
    private final int restarts;
    private final double tolerance;

    public PatternClusterer(long seed) {
        this(seed, 300, 10, 1e-4);
    }

    public PatternClusterer(ClusteringConfig config) {
        this(config.seed(), config.maxIterations(), config.restarts(), config.tolerance());
    }

    public PatternClusterer(long seed, int maxIterations, int restarts, double tolerance) {
        if (maxIterations <= 0 || restarts <= 0 || tolerance < 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid clustering settings: maxIterations=%d, restarts=%d, tolerance=%s",
                maxIterations, restarts, tolerance));
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
        this.restarts = restarts;
        this.tolerance = tolerance;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Extract windows, cluster them and keep the effective centers.
     *
     * @param scale  Scale the library is built for
     * @param prices Clustering period
     * @param config Window length, k and m for this scale
     * @return Library of m centers ordered by ascending feature range
     */
    public PatternLibrary buildLibrary(TimeScale scale, PriceSeries prices, ScaleConfig config) {
        long start = System.nanoTime();
        List<Window> windows = WindowExtractor.extract(prices, config.windowLength());
        ClusteringResult result = cluster(windows, config.clusterCount());
        List<ClusterCenter> effective = selectEffective(result.centroids(), config.effectiveCount());

        PatternLibrary library = new PatternLibrary(
            scale,
            config.windowLength(),
            config.clusterCount(),
            windows.size(),
            effective
        );
        log.info("Built {} (inertia={}, iterations={}, restart={}) in {} ms",
            library.getSummary(), String.format("%.4g", result.inertia()), result.iterations(),
            result.restart(), (System.nanoTime() - start) / 1_000_000);
        return library;
    }

    /**
     * Cluster windows into k centroids.
     *
     * @param windows Windows of one common length
     * @param k       Number of centroids, 1 <= k <= windows.size()
     * @return Centroids of the best restart
     * @throws InsufficientDataException if k exceeds the number of windows
     */
    public ClusteringResult cluster(List<Window> windows, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("Cluster count must be positive: " + k);
        }
        if (k > windows.size()) {
            throw new InsufficientDataException(PipelineStage.CLUSTERING, "k-means clusters", k, windows.size());
        }

        double[][] points = toPoints(windows);
        double shiftThreshold = tolerance * meanVariance(points);
        Random random = new Random(seed);

        double[][] bestCentroids = null;
        double bestInertia = Double.POSITIVE_INFINITY;
        int bestIterations = 0;
        int bestRestart = 0;

        for (int restart = 0; restart < restarts; restart++) {
            double[][] centroids = seedCentroids(points, k, random);
            int[] labels = new int[points.length];
            double[] distances = new double[points.length];
            Arrays.fill(labels, -1);

            int iterations = 0;
            while (iterations < maxIterations) {
                iterations++;
                boolean changed = assign(points, centroids, labels, distances);
                if (!changed) {
                    break;
                }
                double shift = relocate(points, centroids, labels, distances);
                if (shift <= shiftThreshold) {
                    break;
                }
            }
            assign(points, centroids, labels, distances);
            double inertia = sum(distances);

            log.debug("k-means restart {}: k={}, iterations={}, inertia={}", restart, k, iterations, inertia);
            if (inertia < bestInertia) {
                bestInertia = inertia;
                bestCentroids = centroids;
                bestIterations = iterations;
                bestRestart = restart;
            }
        }

        List<ClusterCenter> centers = new ArrayList<>(k);
        for (double[] centroid : bestCentroids) {
            centers.add(new ClusterCenter(centroid));
        }
        return new ClusteringResult(centers, bestInertia, bestIterations, bestRestart);
    }

    /**
     * Keep the m centroids with the widest price swing.
     *
     * Range is max - min over feature coordinates only. Centroids are stably
     * sorted by ascending range and the last m are returned in that order, so
     * ties keep the clusterer's output order.
     *
     * @param centroids Clusterer output
     * @param m         Number to keep, 1 <= m <= centroids.size()
     * @return m centers, ascending by range
     */
    public static List<ClusterCenter> selectEffective(List<ClusterCenter> centroids, int m) {
        if (m <= 0 || m > centroids.size()) {
            throw new IllegalArgumentException(String.format(
                "Effective center count %d must be in [1, %d]", m, centroids.size()));
        }
        List<ClusterCenter> sorted = new ArrayList<>(centroids);
        sorted.sort(Comparator.comparingDouble(ClusterCenter::featureRange));
        return List.copyOf(sorted.subList(sorted.size() - m, sorted.size()));
    }

    private static double[][] toPoints(List<Window> windows) {
        int n = windows.get(0).length();
        double[][] points = new double[windows.size()][];
        for (int i = 0; i < points.length; i++) {
            Window window = windows.get(i);
            if (window.length() != n) {
                throw new IllegalArgumentException(String.format(
                    "Window %d has length %d, expected %d", i, window.length(), n));
            }
            points[i] = window.toPoint();
        }
        return points;
    }

    /**
     * k-means++ seeding: first centroid uniform, then proportional to squared distance.
     */
    private static double[][] seedCentroids(double[][] points, int k, Random random) {
        int dim = points[0].length;
        double[][] centroids = new double[k][];
        double[] closest = new double[points.length];

        centroids[0] = points[random.nextInt(points.length)].clone();
        for (int i = 0; i < points.length; i++) {
            closest[i] = squaredDistance(points[i], centroids[0]);
        }

        for (int c = 1; c < k; c++) {
            double total = sum(closest);
            int chosen;
            if (total <= 0.0) {
                // every point already sits on a centroid
                chosen = random.nextInt(points.length);
            } else {
                double target = random.nextDouble() * total;
                chosen = points.length - 1;
                double cumulative = 0.0;
                for (int i = 0; i < points.length; i++) {
                    cumulative += closest[i];
                    if (cumulative > target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = Arrays.copyOf(points[chosen], dim);
            for (int i = 0; i < points.length; i++) {
                closest[i] = Math.min(closest[i], squaredDistance(points[i], centroids[c]));
            }
        }
        return centroids;
    }

    private static boolean assign(double[][] points, double[][] centroids, int[] labels, double[] distances) {
        boolean changed = false;
        for (int i = 0; i < points.length; i++) {
            int best = 0;
            double bestDistance = squaredDistance(points[i], centroids[0]);
            for (int c = 1; c < centroids.length; c++) {
                double d = squaredDistance(points[i], centroids[c]);
                if (d < bestDistance) {
                    bestDistance = d;
                    best = c;
                }
            }
            if (labels[i] != best) {
                labels[i] = best;
                changed = true;
            }
            distances[i] = bestDistance;
        }
        return changed;
    }

    /**
     * Move each centroid to the mean of its points.
     *
     * @return Total squared centroid shift
     */
    private static double relocate(double[][] points, double[][] centroids, int[] labels, double[] distances) {
        int k = centroids.length;
        int dim = centroids[0].length;
        double[][] sums = new double[k][dim];
        int[] counts = new int[k];

        for (int i = 0; i < points.length; i++) {
            int c = labels[i];
            counts[c]++;
            double[] point = points[i];
            double[] s = sums[c];
            for (int j = 0; j < dim; j++) {
                s[j] += point[j];
            }
        }

        boolean[] taken = new boolean[points.length];
        double shift = 0.0;
        for (int c = 0; c < k; c++) {
            double[] next;
            if (counts[c] == 0) {
                int far = farthestPoint(distances, taken);
                taken[far] = true;
                distances[far] = 0.0;
                next = points[far].clone();
                log.debug("Empty cluster {} re-seeded at point {}", c, far);
            } else {
                next = sums[c];
                for (int j = 0; j < dim; j++) {
                    next[j] /= counts[c];
                }
            }
            shift += squaredDistance(centroids[c], next);
            centroids[c] = next;
        }
        return shift;
    }

    private static int farthestPoint(double[] distances, boolean[] taken) {
        int far = -1;
        for (int i = 0; i < distances.length; i++) {
            if (!taken[i] && (far < 0 || distances[i] > distances[far])) {
                far = i;
            }
        }
        return far;
    }

    private static double meanVariance(double[][] points) {
        int dim = points[0].length;
        double total = 0.0;
        for (int j = 0; j < dim; j++) {
            double mean = 0.0;
            for (double[] point : points) {
                mean += point[j];
            }
            mean /= points.length;
            double variance = 0.0;
            for (double[] point : points) {
                double d = point[j] - mean;
                variance += d * d;
            }
            total += variance / points.length;
        }
        return total / dim;
    }

    static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}
