package com.elara.pine.runtime;

public final class TimeValue {
    public final long time;
    public final double value;

    public TimeValue(long time, double value) {
        this.time = time;
        this.value = value;
    }

    @Override
    public String toString() {
        return "{time: " + time + ", value: " + value + "}";
    }
}
