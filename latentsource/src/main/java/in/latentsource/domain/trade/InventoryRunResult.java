package in.latentsource.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of an unbounded-inventory backtest. Open inventory is not closed out.
 */
public record InventoryRunResult(
    double finalBalance,
    long netInventory,
    int trades,
    int decisions
) {
    @JsonIgnore
    public String getSummary() {
        return String.format("Inventory: balance=%.6f, inventory=%d, trades=%d, decisions=%d",
            finalBalance, netInventory, trades, decisions);
    }
}
