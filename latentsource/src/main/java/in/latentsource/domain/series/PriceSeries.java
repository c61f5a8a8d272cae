package in.latentsource.domain.series;

import java.util.Arrays;

/**
 * Immutable, position-indexed sequence of prices.
 *
 * The backing array is copied on construction and never exposed, so a
 * series can be shared freely between threads.
 */
public final class PriceSeries {

    private final double[] prices;

    private PriceSeries(double[] prices) {
        this.prices = prices;
    }

    /**
     * Create a series from raw prices.
     *
     * @param prices Prices in chronological order (oldest first)
     * @return Immutable series
     * @throws IllegalArgumentException if any price is NaN or infinite
     */
    public static PriceSeries of(double... prices) {
        if (prices == null) {
            throw new IllegalArgumentException("Prices cannot be null");
        }
        double[] copy = prices.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw new IllegalArgumentException("Price at index " + i + " is not finite: " + copy[i]);
            }
        }
        return new PriceSeries(copy);
    }

    public int size() {
        return prices.length;
    }

    public boolean isEmpty() {
        return prices.length == 0;
    }

    public double get(int index) {
        return prices[index];
    }

    public double last() {
        if (prices.length == 0) {
            throw new IllegalStateException("Series is empty");
        }
        return prices[prices.length - 1];
    }

    /**
     * Copy of prices in [from, to).
     */
    public double[] slice(int from, int to) {
        return Arrays.copyOfRange(prices, from, to);
    }

    /**
     * Sub-series over [from, to).
     */
    public PriceSeries subSeries(int from, int to) {
        return new PriceSeries(Arrays.copyOfRange(prices, from, to));
    }

    /**
     * Realized next-step change after index i: price[i+1] - price[i].
     */
    public double deltaAfter(int index) {
        return prices[index + 1] - prices[index];
    }

    public double[] toArray() {
        return prices.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceSeries)) return false;
        return Arrays.equals(prices, ((PriceSeries) o).prices);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(prices);
    }

    @Override
    public String toString() {
        return "PriceSeries[size=" + prices.length + "]";
    }
}
