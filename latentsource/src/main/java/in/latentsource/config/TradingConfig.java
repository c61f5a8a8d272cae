package in.latentsource.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backtest decision rule parameters.
 */
public record TradingConfig(
    @JsonProperty("threshold")
    double threshold,       // |signal| must exceed this to trade (e.g., 0.0001)

    @JsonProperty("stride")
    int stride              // trade every stride-th signal index (1 = every step)
) {
    public static TradingConfig defaults() {
        return new TradingConfig(0.0001, 1);
    }

    @JsonIgnore
    public boolean isValid() {
        return Double.isFinite(threshold) && threshold >= 0 && stride >= 1;
    }
}
