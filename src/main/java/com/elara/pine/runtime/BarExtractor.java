package com.elara.pine.runtime;

import java.util.List;

/** Computes the value of a series at one bar. */
@FunctionalInterface
public interface BarExtractor {
    double extract(Bar bar, int index, List<Bar> bars);
}
