package in.latentsource.infrastructure.feed;

import in.latentsource.domain.series.PriceSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodSplitterTest {

    @Test
    void testEarlierPartsTakeTheRemainder() {
        PriceSeries prices = PriceSeries.of(1, 2, 3, 4, 5, 6, 7, 8);

        List<PriceSeries> parts = PeriodSplitter.split(prices, 3);

        assertEquals(PriceSeries.of(1, 2, 3), parts.get(0));
        assertEquals(PriceSeries.of(4, 5, 6), parts.get(1));
        assertEquals(PriceSeries.of(7, 8), parts.get(2));
    }

    @Test
    void testEvenSplit() {
        List<PriceSeries> parts = PeriodSplitter.split(PriceSeries.of(1, 2, 3, 4, 5, 6), 3);

        for (PriceSeries part : parts) {
            assertEquals(2, part.size());
        }
    }

    @Test
    void testRejectsImpossibleSplits() {
        assertThrows(IllegalArgumentException.class, () -> PeriodSplitter.split(PriceSeries.of(1, 2), 3));
        assertThrows(IllegalArgumentException.class, () -> PeriodSplitter.split(PriceSeries.of(1, 2), 0));
    }
}
