package com.elara.pine.runtime;

import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleBinaryOperator;

/**
 * Lazily computed per-bar values over a {@link BarData}.
 *
 * Operators return a new Series whose extractor closes over the operands;
 * nothing is evaluated until values are read. Reads go through a cache keyed by
 * the source version, so mutating the source recomputes on the next read.
 */
public final class Series {

    private static final String TAG = "Series";

    private final BarData source;
    private final BarExtractor extractor;

    private volatile Snapshot cached;
    private final AtomicInteger computations = new AtomicInteger();

    public Series(BarData source, BarExtractor extractor) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (extractor == null) throw new IllegalArgumentException("extractor must not be null");
        this.source = source;
        this.extractor = extractor;
    }

    // ===================== FACTORIES =====================

    /** Field is one of open, high, low, close, volume. */
    public static Series fromBars(BarData data, String field) {
        switch (field) {
            case "open": return new Series(data, (bar, i, bars) -> bar.open);
            case "high": return new Series(data, (bar, i, bars) -> bar.high);
            case "low": return new Series(data, (bar, i, bars) -> bar.low);
            case "close": return new Series(data, (bar, i, bars) -> bar.close);
            case "volume": return new Series(data, (bar, i, bars) -> bar.volume);
            default:
                throw new IllegalArgumentException("Unknown bar field: " + field);
        }
    }

    public static Series constant(BarData data, double value) {
        return new Series(data, (bar, i, bars) -> value);
    }

    /** Index i reads values[i]; bars past the end of the array read NaN. */
    public static Series fromArray(BarData data, double[] values) {
        return fromArray(data, values, 0);
    }

    /** Bar i reads values[i - offset], NaN outside the array. */
    public static Series fromArray(BarData data, double[] values, int offset) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        final double[] copy = values.clone();
        return new Series(data, (bar, i, bars) -> {
            int k = i - offset;
            return k >= 0 && k < copy.length ? copy[k] : Double.NaN;
        });
    }

    public BarData barData() {
        return source;
    }

    // ===================== ARITHMETIC =====================

    public Series add(Series other) { return combine(other, (a, b) -> a + b); }
    public Series add(double other) { return combine(other, (a, b) -> a + b); }

    public Series sub(Series other) { return combine(other, (a, b) -> a - b); }
    public Series sub(double other) { return combine(other, (a, b) -> a - b); }

    public Series mul(Series other) { return combine(other, (a, b) -> a * b); }
    public Series mul(double other) { return combine(other, (a, b) -> a * b); }

    public Series div(Series other) { return combine(other, Series::divide); }
    public Series div(double other) { return combine(other, Series::divide); }

    public Series mod(Series other) { return combine(other, Series::remainder); }
    public Series mod(double other) { return combine(other, Series::remainder); }

    public Series neg() {
        final BarExtractor self = extractor;
        return new Series(source, (bar, i, bars) -> -self.extract(bar, i, bars));
    }

    private static double divide(double a, double b) {
        return b != 0 ? a / b : Double.NaN;
    }

    private static double remainder(double a, double b) {
        return b != 0 ? a % b : Double.NaN;
    }

    // ===================== COMPARISON / LOGIC =====================

    public Series gt(Series other) { return combine(other, (a, b) -> flag(a > b)); }
    public Series gt(double other) { return combine(other, (a, b) -> flag(a > b)); }

    public Series gte(Series other) { return combine(other, (a, b) -> flag(a >= b)); }
    public Series gte(double other) { return combine(other, (a, b) -> flag(a >= b)); }

    public Series lt(Series other) { return combine(other, (a, b) -> flag(a < b)); }
    public Series lt(double other) { return combine(other, (a, b) -> flag(a < b)); }

    public Series lte(Series other) { return combine(other, (a, b) -> flag(a <= b)); }
    public Series lte(double other) { return combine(other, (a, b) -> flag(a <= b)); }

    public Series eq(Series other) { return combine(other, (a, b) -> flag(a == b)); }
    public Series eq(double other) { return combine(other, (a, b) -> flag(a == b)); }

    public Series neq(Series other) { return combine(other, (a, b) -> flag(a != b)); }
    public Series neq(double other) { return combine(other, (a, b) -> flag(a != b)); }

    public Series and(Series other) { return combine(other, (a, b) -> flag(truthy(a) && truthy(b))); }
    public Series and(double other) { return combine(other, (a, b) -> flag(truthy(a) && truthy(b))); }

    public Series or(Series other) { return combine(other, (a, b) -> flag(truthy(a) || truthy(b))); }
    public Series or(double other) { return combine(other, (a, b) -> flag(truthy(a) || truthy(b))); }

    public Series not() {
        final BarExtractor self = extractor;
        return new Series(source, (bar, i, bars) -> flag(!truthy(self.extract(bar, i, bars))));
    }

    // zero and NaN are false
    private static boolean truthy(double v) {
        return v != 0 && !Double.isNaN(v);
    }

    private static double flag(boolean b) {
        return b ? 1 : 0;
    }

    // ===================== HISTORY =====================

    /** Value n bars back; NaN when that bar does not exist. */
    public Series offset(int n) {
        final BarExtractor self = extractor;
        return new Series(source, (bar, i, bars) -> {
            int target = i - n;
            if (target < 0 || target >= bars.size()) return Double.NaN;
            return self.extract(bars.get(target), target, bars);
        });
    }

    // ===================== READS =====================

    /** Copy of the computed values, recomputed only if the source version moved. */
    public double[] toArray() {
        return compute().clone();
    }

    public double get(int index) {
        double[] values = compute();
        if (index < 0 || index >= values.length) return Double.NaN;
        return values[index];
    }

    public double last() {
        double[] values = compute();
        return values.length == 0 ? Double.NaN : values[values.length - 1];
    }

    public int length() {
        return source.length();
    }

    /** Time/value points for charting, NaN values dropped. */
    public List<TimeValue> toTimeValuePairs() {
        double[] values = compute();
        List<Bar> bars = source.rawBars();
        List<TimeValue> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) continue;
            out.add(new TimeValue(bars.get(i).time, values[i]));
        }
        return out;
    }

    /**
     * Computes now and returns a Series backed by a copy of the values.
     * The result keeps no reference to this Series or its operands.
     */
    public Series materialize() {
        return fromArray(source, compute());
    }

    /** Drops the cache so the next read recomputes even at the same version. */
    public void invalidate() {
        cached = null;
    }

    /** Number of full passes over the source so far. */
    public int computations() {
        return computations.get();
    }

    private double[] compute() {
        long live = source.version();
        Snapshot snap = cached;
        if (snap != null && snap.version == live) {
            return snap.values;
        }
        List<Bar> bars = source.rawBars();
        double[] values = new double[bars.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = extractor.extract(bars.get(i), i, bars);
        }
        cached = new Snapshot(values, live);
        computations.incrementAndGet();
        if (Debug.get().isLoggable(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "computed " + values.length + " values at version " + live);
        }
        return values;
    }

    /** Values and the source version they were computed at, published together. */
    private static final class Snapshot {
        final double[] values;
        final long version;

        Snapshot(double[] values, long version) {
            this.values = values;
            this.version = version;
        }
    }

    private Series combine(Series other, DoubleBinaryOperator op) {
        if (other == null) throw new IllegalArgumentException("other must not be null");
        final BarExtractor left = extractor;
        final BarExtractor right = other.extractor;
        return new Series(source, (bar, i, bars) -> op.applyAsDouble(left.extract(bar, i, bars), right.extract(bar, i, bars)));
    }

    private Series combine(double other, DoubleBinaryOperator op) {
        final BarExtractor left = extractor;
        return new Series(source, (bar, i, bars) -> op.applyAsDouble(left.extract(bar, i, bars), other));
    }

    @Override
    public String toString() {
        Snapshot snap = cached;
        return "Series{length=" + source.length() + ", cachedVersion=" + (snap == null ? -1 : snap.version) + "}";
    }
}
