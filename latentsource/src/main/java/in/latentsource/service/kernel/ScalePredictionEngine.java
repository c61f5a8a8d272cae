package in.latentsource.service.kernel;

import in.latentsource.domain.common.DegenerateKernelWeightsException;
import in.latentsource.domain.common.InsufficientDataException;
import in.latentsource.domain.common.PipelineStage;
import in.latentsource.domain.model.ScaleLibraries;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.infrastructure.metrics.NoOpPipelineMetrics;
import in.latentsource.infrastructure.metrics.PipelineMetrics;
import in.latentsource.util.Tasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Evaluates the kernel predictor at all three scales for every eligible timestep of a period.
 *
 * Eligible timesteps are i in [longest, L-2]: each has a full trailing window
 * for every scale and a realized next price. Timesteps are independent, so
 * the range is split into contiguous chunks run on the executor; each chunk
 * writes a disjoint slice of the output arrays.
 */
public final class ScalePredictionEngine {
    private static final Logger log = LoggerFactory.getLogger(ScalePredictionEngine.class);

    private static final int CHUNKS_PER_WORKER = 4;

    private final ExecutorService executor;
    private final int parallelism;
    private final PipelineMetrics metrics;

    /**
     * Sequential engine without metrics.
     */
    public ScalePredictionEngine() {
        this(null, 1, NoOpPipelineMetrics.INSTANCE);
    }

    /**
     * @param executor    Worker pool, or null to run on the calling thread
     * @param parallelism Number of workers the pool provides
     * @param metrics     Metrics sink
     */
    public ScalePredictionEngine(ExecutorService executor, int parallelism, PipelineMetrics metrics) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }
        this.executor = executor;
        this.parallelism = parallelism;
        this.metrics = metrics;
    }

    /**
     * Number of eligible timesteps in a period: L - longest - 1.
     *
     * @throws InsufficientDataException if the period has none
     */
    public static int eligibleCount(PriceSeries period, int longestWindow, PipelineStage stage) {
        int count = period.size() - longestWindow - 1;
        if (count < 1) {
            throw new InsufficientDataException(stage,
                "a period with trailing windows of " + longestWindow, longestWindow + 2, period.size());
        }
        return count;
    }

    /**
     * Compute (d1, d2, d3) for every eligible timestep.
     *
     * @param period    Price period the predictions are made on
     * @param libraries Libraries built from an earlier period
     * @param stage     Stage the caller is running, used to attribute failures
     */
    public ScalePredictions predict(PriceSeries period, ScaleLibraries libraries, PipelineStage stage) {
        int offset = libraries.longestWindow();
        int count = eligibleCount(period, offset, stage);

        double[] shortOut = new double[count];
        double[] mediumOut = new double[count];
        double[] longOut = new double[count];

        if (executor == null || parallelism == 1 || count < parallelism) {
            fill(period, libraries, offset, 0, count, shortOut, mediumOut, longOut);
        } else {
            int chunks = Math.min(count, parallelism * CHUNKS_PER_WORKER);
            int chunkSize = (count + chunks - 1) / chunks;
            List<Future<Void>> futures = new ArrayList<>(chunks);
            for (int from = 0; from < count; from += chunkSize) {
                int start = from;
                int end = Math.min(count, from + chunkSize);
                futures.add(executor.submit(() -> {
                    fill(period, libraries, offset, start, end, shortOut, mediumOut, longOut);
                    return null;
                }));
            }
            log.debug("Kernel evaluation split into {} chunks of {} timesteps", futures.size(), chunkSize);
            Tasks.awaitAll(futures);
        }

        for (TimeScale scale : TimeScale.values()) {
            metrics.recordKernelEvaluations(scale, count);
        }
        return new ScalePredictions(offset, shortOut, mediumOut, longOut);
    }

    private void fill(PriceSeries period, ScaleLibraries libraries, int offset, int from, int to,
                      double[] shortOut, double[] mediumOut, double[] longOut) {
        for (int t = from; t < to; t++) {
            int timestep = offset + t;
            shortOut[t] = evaluate(period, timestep, libraries, TimeScale.SHORT);
            mediumOut[t] = evaluate(period, timestep, libraries, TimeScale.MEDIUM);
            longOut[t] = evaluate(period, timestep, libraries, TimeScale.LONG);
        }
    }

    private double evaluate(PriceSeries period, int timestep, ScaleLibraries libraries, TimeScale scale) {
        try {
            return KernelPredictor.predictTrailing(period, timestep, libraries.get(scale));
        } catch (DegenerateKernelWeightsException e) {
            metrics.recordDegenerateKernel(scale);
            log.debug("Degenerate kernel weights at timestep {} for scale {}", timestep, scale);
            throw e;
        }
    }
}
