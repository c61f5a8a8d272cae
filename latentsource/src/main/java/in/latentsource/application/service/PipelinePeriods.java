package in.latentsource.application.service;

import in.latentsource.domain.series.PriceSeries;

/**
 * Three chronologically ordered, non-overlapping price periods.
 */
public record PipelinePeriods(
    PriceSeries clusterPeriod,  // builds the pattern libraries
    PriceSeries blendPeriod,    // fits the blend weights
    PriceSeries testPeriod      // produces the signal and the backtest
) {
    public PipelinePeriods {
        if (clusterPeriod == null || blendPeriod == null || testPeriod == null) {
            throw new IllegalArgumentException("All three periods are required");
        }
    }

    public String getSummary() {
        return String.format("periods: cluster=%d, blend=%d, test=%d",
            clusterPeriod.size(), blendPeriod.size(), testPeriod.size());
    }
}
