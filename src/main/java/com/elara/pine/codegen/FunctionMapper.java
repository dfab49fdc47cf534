package com.elara.pine.codegen;

import java.util.HashMap;
import java.util.Map;

/** Maps bare function names onto their runtime namespaces: sma becomes ta.sma, abs becomes math.abs. */
public final class FunctionMapper {

    private static final Map<String, String> NAMES = new HashMap<>();

    static {
        for (String ta : new String[] {"sma", "ema", "rsi", "macd", "bb", "atr", "stoch", "wma", "vwma",
                "crossover", "crossunder", "highest", "lowest"}) {
            NAMES.put(ta, "ta." + ta);
        }
        for (String m : new String[] {"sum", "abs", "round", "ceil", "floor", "max", "min", "sqrt", "pow",
                "log", "exp"}) {
            NAMES.put(m, "math." + m);
        }
    }

    private FunctionMapper() {}

    public static String translate(String name) {
        String mapped = NAMES.get(name);
        return mapped != null ? mapped : name;
    }

    /** True when the call resolves into the ta namespace. */
    public static boolean isTechnicalAnalysis(String name) {
        String translated = translate(name);
        return translated.startsWith("ta.") || translated.startsWith("taCore.");
    }
}
