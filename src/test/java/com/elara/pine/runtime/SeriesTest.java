package com.elara.pine.runtime;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class SeriesTest {

    private static BarData fiveBars() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            // open = 10 + i, close = 11 + 2i, high = close + 1, low = open - 1
            double open = 10 + i;
            double close = 11 + 2 * i;
            bars.add(new Bar(1000L * i, open, close + 1, open - 1, close, 100 + i));
        }
        return new BarData(bars);
    }

    @Test
    void derivedSeries_isComputedOnce_untilSourceVersionMoves() {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        Series open = Series.fromBars(data, "open");
        Series range = close.sub(open);

        double[] first = range.toArray();
        double[] second = range.toArray();
        assertArrayEquals(first, second, 0.0);
        assertEquals(1, range.computations(), "second read must be a cache hit");

        data.push(new Bar(5000L, 20, 40, 19, 35, 0));
        double[] grown = range.toArray();
        assertEquals(6, grown.length);
        for (int i = 0; i < 5; i++) {
            assertEquals(first[i], grown[i], 0.0);
        }
        assertEquals(15.0, grown[5], 0.0);
        assertEquals(2, range.computations());
    }

    @Test
    void composition_doesNotComputeAnything() {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        Series chain = close.add(1).mul(2).div(close).offset(1);
        assertEquals(0, chain.computations());
        assertEquals(0, close.computations());
    }

    @Test
    void materialize_isDetachedFromLaterSourceChanges() {
        BarData data = fiveBars();
        Series a = Series.fromBars(data, "close");
        Series b = Series.fromBars(data, "open");
        Series derived = a.add(b);
        Series frozen = derived.materialize();

        double before = frozen.get(0);
        assertEquals(21.0, before, 0.0);

        data.set(0, new Bar(0L, 100, 200, 50, 150, 0));
        assertEquals(250.0, derived.get(0), 0.0);
        assertEquals(before, frozen.get(0), 0.0);
    }

    @Test
    void toArray_returnsDefensiveCopy() {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        double[] values = close.toArray();
        values[0] = -1;
        assertEquals(11.0, close.get(0), 0.0);
    }

    @Test
    void divisionAndModuloByZero_areNaN() {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        assertTrue(Double.isNaN(close.div(0).get(0)));
        assertTrue(Double.isNaN(close.mod(0).get(2)));
        assertTrue(Double.isNaN(close.div(Series.constant(data, 0)).last()));
        assertEquals(1.0, close.mod(2).get(0), 0.0);
    }

    @Test
    void offset_readsPriorBars_andNaNBeforeTheFirst() {
        BarData data = fiveBars();
        Series prev = Series.fromBars(data, "close").offset(1);
        assertTrue(Double.isNaN(prev.get(0)));
        assertEquals(11.0, prev.get(1), 0.0);
        assertEquals(17.0, prev.last(), 0.0);

        Series twoBack = Series.fromBars(data, "close").offset(1).offset(1);
        assertEquals(11.0, twoBack.get(2), 0.0);
        assertTrue(Double.isNaN(twoBack.get(1)));
    }

    @Test
    void comparisonsAndLogic_produceOneOrZero() {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        Series open = Series.fromBars(data, "open");

        assertEquals(1.0, close.gt(open).get(0), 0.0);
        assertEquals(0.0, close.lt(open).get(0), 0.0);
        assertEquals(1.0, close.gte(11).get(0), 0.0);
        assertEquals(1.0, close.lte(11).get(0), 0.0);
        assertEquals(1.0, close.eq(11).get(0), 0.0);
        assertEquals(0.0, close.neq(11).get(0), 0.0);

        Series up = close.gt(open);
        Series big = close.gt(14);
        assertEquals(0.0, up.and(big).get(0), 0.0);
        assertEquals(1.0, up.and(big).get(2), 0.0);
        assertEquals(1.0, up.or(big).get(0), 0.0);
        assertEquals(0.0, up.not().get(0), 0.0);

        // NaN is falsy
        Series nan = Series.constant(data, Double.NaN);
        assertEquals(0.0, nan.and(1).get(0), 0.0);
        assertEquals(1.0, nan.not().get(0), 0.0);
        assertEquals(0.0, nan.eq(nan).get(0), 0.0);
    }

    @Test
    void neg_flipsSign() {
        BarData data = fiveBars();
        assertEquals(-11.0, Series.fromBars(data, "close").neg().get(0), 0.0);
    }

    @Test
    void fromArray_padsWithNaN_andRejectsNegativeOffset() {
        BarData data = fiveBars();
        Series s = Series.fromArray(data, new double[] {1, 2, 3});
        assertEquals(3.0, s.get(2), 0.0);
        assertTrue(Double.isNaN(s.get(3)));
        assertTrue(Double.isNaN(s.get(-1)));

        Series shifted = Series.fromArray(data, new double[] {7, 8}, 2);
        assertTrue(Double.isNaN(shifted.get(1)));
        assertEquals(7.0, shifted.get(2), 0.0);

        assertThrows(IllegalArgumentException.class, () -> Series.fromArray(data, new double[] {1}, -1));
    }

    @Test
    void constructor_rejectsNullArguments() {
        BarData data = fiveBars();
        assertThrows(IllegalArgumentException.class, () -> new Series(null, (bar, i, bars) -> 0));
        assertThrows(IllegalArgumentException.class, () -> new Series(data, null));
        assertThrows(IllegalArgumentException.class, () -> Series.fromBars(data, "vwap"));
    }

    @Test
    void toTimeValuePairs_skipsNaN() {
        BarData data = fiveBars();
        List<TimeValue> points = Series.fromBars(data, "close").offset(2).toTimeValuePairs();
        assertEquals(3, points.size());
        assertEquals(2000L, points.get(0).time);
        assertEquals(11.0, points.get(0).value, 0.0);
    }

    @Test
    void volume_isNaNWhenBarHasNone() {
        BarData data = new BarData();
        data.push(new Bar(0L, 1, 2, 0.5, 1.5));
        assertTrue(Double.isNaN(Series.fromBars(data, "volume").last()));
        assertEquals(1, Series.fromBars(data, "close").length());
    }

    @Test
    void emptySource_readsNaN() {
        Series s = Series.fromBars(new BarData(), "close");
        assertEquals(0, s.toArray().length);
        assertTrue(Double.isNaN(s.last()));
        assertTrue(Double.isNaN(s.get(0)));
    }

    @Test
    void concurrentReaders_atStableVersion_seeCompleteValues() throws Exception {
        BarData data = fiveBars();
        Series close = Series.fromBars(data, "close");
        Series spread = close.sub(Series.fromBars(data, "open")).mul(2);
        double[] expected = {2, 4, 6, 8, 10};

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> readers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                readers.add(() -> {
                    for (int n = 0; n < 500; n++) {
                        double[] values = spread.toArray();
                        if (values.length != 5) return false;
                        for (int i = 0; i < 5; i++) {
                            if (values[i] != expected[i] || spread.get(i) != expected[i]) return false;
                        }
                        if (n % 50 == 0) spread.invalidate();
                    }
                    return true;
                });
            }
            for (Future<Boolean> f : pool.invokeAll(readers)) {
                assertTrue(f.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertTrue(spread.computations() >= 1);
        assertTrue(spread.toString().contains("cachedVersion="));
    }
}
