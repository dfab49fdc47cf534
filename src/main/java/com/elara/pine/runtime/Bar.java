package com.elara.pine.runtime;

/** One OHLCV row. Volume is NaN when the feed has none. */
public final class Bar {
    public final long time;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public Bar(long time, double open, double high, double low, double close) {
        this(time, open, high, low, close, Double.NaN);
    }

    public Bar(long time, double open, double high, double low, double close, double volume) {
        this.time = time;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public double field(String name) {
        switch (name) {
            case "open": return open;
            case "high": return high;
            case "low": return low;
            case "close": return close;
            case "volume": return volume;
            default:
                throw new IllegalArgumentException("Unknown bar field: " + name);
        }
    }

    @Override
    public String toString() {
        return "Bar{time=" + time + ", o=" + open + ", h=" + high + ", l=" + low + ", c=" + close + ", v=" + volume + "}";
    }
}
