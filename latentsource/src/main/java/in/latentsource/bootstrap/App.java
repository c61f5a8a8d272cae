package in.latentsource.bootstrap;

import in.latentsource.application.service.LatentSourcePipeline;
import in.latentsource.application.service.PipelinePeriods;
import in.latentsource.application.service.PipelineResult;
import in.latentsource.config.PipelineConfig;
import in.latentsource.config.PipelineConfigLoader;
import in.latentsource.domain.common.LatentSourceException;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.infrastructure.feed.PeriodSplitter;
import in.latentsource.infrastructure.feed.PriceFeedReader;
import in.latentsource.infrastructure.metrics.PrometheusPipelineMetrics;
import in.latentsource.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Command-line entry point: read a price history, split it in three, run the backtest.
 *
 * Usage: App [prices-file]
 * - prices file: first argument or LATENT_SOURCE_PRICES
 * - config: LATENT_SOURCE_CONFIG or classpath latent-source.json
 * - JSON report: LATENT_SOURCE_REPORT (optional)
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static final String PRICES_KEY = "LATENT_SOURCE_PRICES";
    public static final String REPORT_KEY = "LATENT_SOURCE_REPORT";

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Latent Source Backtest Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        String pricesPath = args.length > 0 ? args[0] : Env.get(PRICES_KEY, null);
        if (pricesPath == null) {
            log.error("No price file given. Pass it as the first argument or set {}", PRICES_KEY);
            System.exit(2);
            return;
        }

        int exitCode = run(Path.of(pricesPath), Env.get(REPORT_KEY, null));
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(Path pricesPath, String reportPath) {
        PipelineConfig config = new PipelineConfigLoader().load();
        log.info("Config: scales={}/{}/{}, k={}, m={}, seed={}, threshold={}, stride={}, parallelism={}",
            config.shortScale().windowLength(), config.mediumScale().windowLength(),
            config.longScale().windowLength(), config.shortScale().clusterCount(),
            config.shortScale().effectiveCount(), config.clustering().seed(),
            config.trading().threshold(), config.trading().stride(), config.parallelism());

        PriceSeries prices = PriceFeedReader.read(pricesPath);
        List<PriceSeries> parts = PeriodSplitter.split(prices, 3);
        PipelinePeriods periods = new PipelinePeriods(parts.get(0), parts.get(1), parts.get(2));

        ExecutorService executor = config.parallelism() > 1 ? newWorkerPool(config.parallelism()) : null;
        try {
            LatentSourcePipeline pipeline = new LatentSourcePipeline(config, executor, new PrometheusPipelineMetrics());
            PipelineResult result = pipeline.run(periods);

            BacktestReporter reporter = new BacktestReporter();
            reporter.log(result);
            if (reportPath != null) {
                reporter.write(periods, config, result, Path.of(reportPath));
            }
            return 0;
        } catch (LatentSourceException e) {
            log.error("Backtest failed at stage {}: {}", e.getStage(), e.getMessage());
            return 1;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "latent-source-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private App() {}
}
