package in.latentsource.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of a bounded single-unit backtest (position in {-1, 0, +1}).
 */
public record BoundedRunResult(
    double finalBalance,    // after the mandatory close-out
    int trades,             // buys + sells, excluding the close-out
    int decisions           // timesteps visited under the stride
) {
    @JsonIgnore
    public String getSummary() {
        return String.format("Bounded: balance=%.6f, trades=%d, decisions=%d",
            finalBalance, trades, decisions);
    }
}
