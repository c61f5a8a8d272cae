package in.latentsource.infrastructure.feed;

import in.latentsource.domain.series.PriceSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one price history into contiguous, non-overlapping periods.
 *
 * Part sizes differ by at most one; the first (L mod parts) parts get the extra price.
 */
public final class PeriodSplitter {

    public static List<PriceSeries> split(PriceSeries prices, int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("Parts must be at least 1: " + parts);
        }
        if (prices.size() < parts) {
            throw new IllegalArgumentException(String.format(
                "Cannot split %d prices into %d periods", prices.size(), parts));
        }

        int base = prices.size() / parts;
        int extra = prices.size() % parts;
        List<PriceSeries> periods = new ArrayList<>(parts);
        int from = 0;
        for (int p = 0; p < parts; p++) {
            int to = from + base + (p < extra ? 1 : 0);
            periods.add(prices.subSeries(from, to));
            from = to;
        }
        return periods;
    }

    private PeriodSplitter() {}
}
