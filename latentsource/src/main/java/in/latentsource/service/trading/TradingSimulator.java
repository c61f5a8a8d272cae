package in.latentsource.service.trading;

import in.latentsource.config.TradingConfig;
import in.latentsource.domain.model.Signal;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.trade.BoundedRunResult;
import in.latentsource.domain.trade.InventoryRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trading Simulator - offline backtest of a signal over the test period.
 *
 * Decisions are taken at signal indices t = 0, stride, 2*stride, ... at
 * price[signal.offset + t]. Each decision point evaluates, in order:
 * - BUY  if signal[t] > threshold
 * - SELL if signal[t] < -threshold
 *
 * Bounded policy (position in {-1, 0, +1}):
 * - BUY only when position <= 0, SELL only when position >= 0
 * - a long is sold and a short covered at the last price of the period
 *
 * Unbounded policy:
 * - every qualifying signal trades one unit, no close-out
 */
public final class TradingSimulator {
    private static final Logger log = LoggerFactory.getLogger(TradingSimulator.class);

    public static BoundedRunResult simulateBounded(Signal signal, PriceSeries prices, TradingConfig config) {
        return simulateBounded(signal, prices, config.threshold(), config.stride());
    }

    public static InventoryRunResult simulateUnbounded(Signal signal, PriceSeries prices, TradingConfig config) {
        return simulateUnbounded(signal, prices, config.threshold(), config.stride());
    }

    /**
     * Bounded single-unit backtest.
     *
     * @param signal    Ensemble signal of the test period
     * @param prices    Full test period the signal was computed on
     * @param threshold Minimum |signal| to trade, >= 0
     * @param stride    Decision spacing in signal indices, >= 1
     * @return Balance after close-out
     */
    public static BoundedRunResult simulateBounded(Signal signal, PriceSeries prices, double threshold, int stride) {
        validate(signal, prices, threshold, stride);

        Ledger ledger = new Ledger();
        int decisions = 0;
        for (int t = 0; t < signal.size(); t += stride) {
            decisions++;
            double price = prices.get(signal.timestepOf(t));
            double value = signal.get(t);
            if (value > threshold && ledger.position() <= 0) {
                ledger.buy(price);
            }
            if (value < -threshold && ledger.position() >= 0) {
                ledger.sell(price);
            }
        }
        ledger.closeOut(prices.last());

        BoundedRunResult result = new BoundedRunResult(ledger.balance(), ledger.trades(), decisions);
        log.info("{} (threshold={}, stride={})", result.getSummary(), threshold, stride);
        return result;
    }

    /**
     * Unbounded inventory backtest.
     *
     * @return Balance and net inventory, open inventory left as is
     */
    public static InventoryRunResult simulateUnbounded(Signal signal, PriceSeries prices, double threshold, int stride) {
        validate(signal, prices, threshold, stride);

        Ledger ledger = new Ledger();
        int decisions = 0;
        for (int t = 0; t < signal.size(); t += stride) {
            decisions++;
            double price = prices.get(signal.timestepOf(t));
            double value = signal.get(t);
            if (value > threshold) {
                ledger.buy(price);
            }
            if (value < -threshold) {
                ledger.sell(price);
            }
        }

        InventoryRunResult result = new InventoryRunResult(
            ledger.balance(), ledger.position(), ledger.trades(), decisions);
        log.info("{} (threshold={}, stride={})", result.getSummary(), threshold, stride);
        return result;
    }

    private static void validate(Signal signal, PriceSeries prices, double threshold, int stride) {
        if (!Double.isFinite(threshold) || threshold < 0) {
            throw new IllegalArgumentException("Threshold must be finite and non-negative: " + threshold);
        }
        if (stride < 1) {
            throw new IllegalArgumentException("Stride must be at least 1: " + stride);
        }
        if (prices.isEmpty()) {
            throw new IllegalArgumentException("Price series is empty");
        }
        if (signal.offset() + signal.size() > prices.size()) {
            throw new IllegalArgumentException(String.format(
                "Signal (offset=%d, size=%d) does not fit a series of %d prices",
                signal.offset(), signal.size(), prices.size()));
        }
    }

    private TradingSimulator() {}
}
