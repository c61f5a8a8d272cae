package in.latentsource.bootstrap;

import in.latentsource.application.service.PipelinePeriods;
import in.latentsource.application.service.PipelineResult;
import in.latentsource.config.PipelineConfig;
import in.latentsource.domain.model.BlendModel;
import in.latentsource.domain.model.ClusterCenter;
import in.latentsource.domain.model.PatternLibrary;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.series.TimeScale;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * JSON-friendly snapshot of a pipeline run.
 */
public record BacktestReport(
    String generatedAt,
    int clusterPeriodSize,
    int blendPeriodSize,
    int testPeriodSize,
    PipelineConfig config,
    List<LibraryReport> libraries,
    BlendModel blendModel,
    SignalReport signal,
    BoundedRunResult boundedRun,
    InventoryRunResult inventoryRun
) {

    public record LibraryReport(
        TimeScale scale,
        int windowLength,
        int clusterCount,
        int windowCount,
        double[] centerLabels,      // ascending feature range order
        double[] centerRanges
    ) {
        static LibraryReport of(PatternLibrary library) {
            double[] labels = library.centers().stream().mapToDouble(ClusterCenter::label).toArray();
            double[] ranges = library.centers().stream().mapToDouble(ClusterCenter::featureRange).toArray();
            return new LibraryReport(library.scale(), library.windowLength(), library.clusterCount(),
                library.windowCount(), labels, ranges);
        }
    }

    public record SignalReport(
        int offset,
        int size,
        double min,
        double mean,
        double max
    ) {
        static SignalReport of(Signal signal) {
            double[] values = signal.values();
            return new SignalReport(
                signal.offset(),
                values.length,
                Arrays.stream(values).min().orElse(0.0),
                Arrays.stream(values).average().orElse(0.0),
                Arrays.stream(values).max().orElse(0.0));
        }
    }

    public static BacktestReport of(String generatedAt, PipelinePeriods periods,
                                    PipelineConfig config, PipelineResult result) {
        List<LibraryReport> libraries = new ArrayList<>();
        for (TimeScale scale : TimeScale.values()) {
            libraries.add(LibraryReport.of(result.libraries().get(scale)));
        }
        return new BacktestReport(
            generatedAt,
            periods.clusterPeriod().size(),
            periods.blendPeriod().size(),
            periods.testPeriod().size(),
            config,
            libraries,
            result.blendModel(),
            SignalReport.of(result.signal()),
            result.boundedRun(),
            result.inventoryRun()
        );
    }
}
