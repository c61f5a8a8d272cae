package in.latentsource.service.window;

import in.latentsource.domain.common.InvalidWindowLengthException;
import in.latentsource.domain.series.PriceSeries;
import in.latentsource.domain.series.Window;

import java.util.ArrayList;
import java.util.List;

/**
 * Window Extractor - slices a price series into overlapping labeled windows.
 *
 * For a series of length L and window length n there are exactly L - n windows:
 * window i covers price[i .. i+n-1] and is labeled price[i+n] - price[i+n-1].
 */
public final class WindowExtractor {

    /**
     * Extract all labeled windows of length n.
     *
     * @param prices Price series (oldest first)
     * @param n      Window length, 0 < n < prices.size()
     * @return L - n windows in chronological order
     * @throws InvalidWindowLengthException if n is out of range
     */
    public static List<Window> extract(PriceSeries prices, int n) {
        int length = prices.size();
        if (n <= 0 || n >= length) {
            throw new InvalidWindowLengthException(n, length);
        }

        int count = length - n;
        List<Window> windows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            windows.add(new Window(prices.slice(i, i + n), prices.deltaAfter(i + n - 1)));
        }
        return windows;
    }

    /**
     * Number of windows {@link #extract} would produce, without materializing them.
     */
    public static int windowCount(PriceSeries prices, int n) {
        if (n <= 0 || n >= prices.size()) {
            throw new InvalidWindowLengthException(n, prices.size());
        }
        return prices.size() - n;
    }

    private WindowExtractor() {}
}
