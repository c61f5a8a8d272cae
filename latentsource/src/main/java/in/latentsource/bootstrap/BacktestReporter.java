package in.latentsource.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import in.latentsource.application.service.PipelinePeriods;
import in.latentsource.application.service.PipelineResult;
import in.latentsource.config.PipelineConfig;
import in.latentsource.domain.series.TimeScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Presents pipeline results: a log summary and, on request, a JSON report file.
 */
public final class BacktestReporter {
    private static final Logger log = LoggerFactory.getLogger(BacktestReporter.class);

    private final ObjectMapper mapper;

    public BacktestReporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public BacktestReporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void log(PipelineResult result) {
        log.info("───────────────────────────────────────────────────────────────");
        for (TimeScale scale : TimeScale.values()) {
            log.info("{}", result.libraries().get(scale).getSummary());
        }
        log.info("Blend weights: {}", result.blendModel().getSummary());
        log.info("{}", result.signal().getSummary());
        log.info("{}", result.boundedRun().getSummary());
        log.info("{}", result.inventoryRun().getSummary());
        log.info("───────────────────────────────────────────────────────────────");
    }

    public String toJson(BacktestReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backtest report", e);
        }
    }

    public void write(PipelinePeriods periods, PipelineConfig config, PipelineResult result, Path path) {
        BacktestReport report = BacktestReport.of(Instant.now().toString(), periods, config, result);
        try {
            mapper.writeValue(path.toFile(), report);
            log.info("Backtest report written to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write backtest report " + path, e);
        }
    }
}
