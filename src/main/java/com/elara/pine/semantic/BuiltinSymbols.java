package com.elara.pine.semantic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** Builtin variables and function signatures declared into the global scope before analysis. */
public final class BuiltinSymbols {

    private static final List<String> PRICE_SERIES = Arrays.asList(
            "open", "high", "low", "close", "volume", "hl2", "hlc3", "ohlc4", "hlcc4");

    private static final List<String> TIME_SERIES = Arrays.asList(
            "bar_index", "time", "year", "month", "weekofyear", "dayofmonth", "dayofweek",
            "hour", "minute", "second");

    private static final List<String> SOURCE_LENGTH_FUNCTIONS = Arrays.asList(
            "ta.sma", "ta.ema", "ta.rsi", "ta.vwma", "ta.wma", "ta.highest", "ta.lowest", "ta.stdev");

    private static final List<String> PLOT_OPTIONS = Arrays.asList(
            "title", "color", "linewidth", "style", "trackprice", "histbase", "offset", "join",
            "editable", "show_last", "display", "force_overlay");

    private static final List<String> INDICATOR_OPTIONS = Arrays.asList(
            "shorttitle", "overlay", "format", "precision", "scale", "max_bars_back", "timeframe",
            "timeframe_gaps", "explicit_plot_zorder", "max_lines_count", "max_labels_count",
            "max_boxes_count", "max_polylines_count");

    private BuiltinSymbols() {}

    /** Names that can never be the target of {@code :=}. */
    public static final List<String> PROTECTED = Collections.unmodifiableList(Arrays.asList(
            "open", "high", "low", "close", "volume", "hl2", "hlc3", "ohlc4", "hlcc4",
            "bar_index", "time", "year", "month", "weekofyear", "dayofmonth", "dayofweek",
            "hour", "minute", "second", "na", "true", "false"));

    public static void declareAll(SymbolTable table) {
        for (String name : PRICE_SERIES) {
            table.declare(builtin(name, SymbolKind.VARIABLE, PineType.series(PineType.FLOAT)));
        }
        for (String name : TIME_SERIES) {
            table.declare(builtin(name, SymbolKind.VARIABLE, PineType.series(PineType.INT)));
        }
        table.declare(builtin("last_bar_index", SymbolKind.VARIABLE, PineType.INT));
        table.declare(builtin("na", SymbolKind.VARIABLE, PineType.NA));
        table.declare(builtin("true", SymbolKind.VARIABLE, PineType.BOOL));
        table.declare(builtin("false", SymbolKind.VARIABLE, PineType.BOOL));

        PineType seriesFloat = PineType.series(PineType.FLOAT);
        for (String name : SOURCE_LENGTH_FUNCTIONS) {
            function(table, name, seriesFloat, seriesFloat, PineType.INT);
        }
        function(table, "ta.atr", seriesFloat, PineType.INT);

        for (String name : Arrays.asList("math.max", "math.min", "math.pow")) {
            function(table, name, PineType.FLOAT, PineType.FLOAT, PineType.FLOAT);
        }
        for (String name : Arrays.asList("math.abs", "math.floor", "math.ceil", "math.sqrt", "math.log")) {
            function(table, name, PineType.FLOAT, PineType.FLOAT);
        }
        withOptions(table, "math.round", PineType.INT, list(PineType.FLOAT), Arrays.asList("precision"));

        withOptions(table, "nz", seriesFloat, list(seriesFloat), Arrays.asList("replacement"));
        function(table, "na", PineType.BOOL, seriesFloat);
        function(table, "fixnan", seriesFloat, seriesFloat);

        withOptions(table, "plot", PineType.VOID, list(seriesFloat), PLOT_OPTIONS);
        withOptions(table, "indicator", PineType.VOID, list(PineType.STRING), INDICATOR_OPTIONS);
        withOptions(table, "hline", PineType.VOID, list(PineType.FLOAT),
                Arrays.asList("title", "color", "linestyle", "linewidth", "editable", "display"));
        withOptions(table, "plotshape", PineType.VOID, list(seriesFloat),
                Arrays.asList("title", "style", "location", "color", "offset", "text", "textcolor",
                        "editable", "size", "show_last", "display"));
        withOptions(table, "plotchar", PineType.VOID, list(seriesFloat),
                Arrays.asList("title", "char", "location", "color", "offset", "text", "textcolor",
                        "editable", "size", "show_last"));
        withOptions(table, "bgcolor", PineType.VOID, list(PineType.COLOR),
                Arrays.asList("offset", "editable", "show_last", "title", "display"));
        withOptions(table, "fill", PineType.VOID, list(PineType.UNKNOWN, PineType.UNKNOWN),
                Arrays.asList("color", "title", "editable", "show_last", "fillgaps", "display"));
        withOptions(table, "alertcondition", PineType.VOID, list(seriesFloat),
                Arrays.asList("title", "message"));

        withOptions(table, "str.tostring", PineType.STRING, list(PineType.UNKNOWN), Arrays.asList("format"));

        withOptions(table, "array.new_float", PineType.array(PineType.FLOAT), list(),
                Arrays.asList("size", "initial_value"));
        withOptions(table, "array.new_int", PineType.array(PineType.INT), list(),
                Arrays.asList("size", "initial_value"));
        function(table, "array.push", PineType.VOID, PineType.array(PineType.UNKNOWN), PineType.UNKNOWN);
        function(table, "array.get", PineType.UNKNOWN, PineType.array(PineType.UNKNOWN), PineType.INT);
        function(table, "array.set", PineType.VOID, PineType.array(PineType.UNKNOWN), PineType.INT, PineType.UNKNOWN);
        function(table, "array.size", PineType.INT, PineType.array(PineType.UNKNOWN));
    }

    private static Symbol builtin(String name, SymbolKind kind, PineType type) {
        return new Symbol(name, kind, type, true, false, 0, 0);
    }

    private static void function(SymbolTable table, String name, PineType returns, PineType... required) {
        withOptions(table, name, returns, Arrays.asList(required), Collections.<String>emptyList());
    }

    private static void withOptions(SymbolTable table, String name, PineType returns,
                                    List<PineType> required, List<String> optionalNames) {
        List<FunctionParam> params = new ArrayList<>();
        for (PineType t : required) {
            params.add(FunctionParam.required(t));
        }
        for (String option : optionalNames) {
            params.add(FunctionParam.optional(option, PineType.UNKNOWN));
        }
        table.declare(builtin(name, SymbolKind.FUNCTION, PineType.function(params, returns)));
    }

    private static List<PineType> list(PineType... types) {
        return Arrays.asList(types);
    }
}
