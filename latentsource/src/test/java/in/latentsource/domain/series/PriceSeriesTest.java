package in.latentsource.domain.series;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceSeriesTest {

    @Test
    void testRejectsNonFinitePrices() {
        assertThrows(IllegalArgumentException.class, () -> PriceSeries.of(1.0, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> PriceSeries.of(Double.POSITIVE_INFINITY));
    }

    @Test
    void testCopiesInput() {
        double[] raw = {1.0, 2.0, 3.0};
        PriceSeries series = PriceSeries.of(raw);
        raw[0] = 99.0;

        assertEquals(1.0, series.get(0));
        series.toArray()[1] = 42.0;
        assertEquals(2.0, series.get(1));
    }

    @Test
    void testDeltaAndLast() {
        PriceSeries series = PriceSeries.of(10, 10.5, 9.5);

        assertEquals(0.5, series.deltaAfter(0));
        assertEquals(-1.0, series.deltaAfter(1));
        assertEquals(9.5, series.last());
        assertThrows(IllegalStateException.class, () -> PriceSeries.of().last());
    }

    @Test
    void testSubSeries() {
        PriceSeries series = PriceSeries.of(1, 2, 3, 4, 5);

        assertEquals(PriceSeries.of(2, 3, 4), series.subSeries(1, 4));
        assertArrayEquals(new double[] {4, 5}, series.slice(3, 5));
    }
}
