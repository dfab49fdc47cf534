package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/** Fixed blocks of target text around the generated indicator body. */
final class Preamble {

    private Preamble() {}

    static String mainImport(List<String> used, String runtimeModule) {
        List<String> names = new ArrayList<>();
        names.add("Series");
        names.addAll(used);
        names.add("type IndicatorResult");
        names.add("type InputConfig");
        names.add("type PlotConfig");
        return "import { " + String.join(", ", names) + " } from '" + runtimeModule + "';";
    }

    static List<String> libraryImports(List<ImportInfo> imports, String libraryPath) {
        List<String> lines = new ArrayList<>();
        for (ImportInfo imp : imports) {
            lines.add("import * as " + imp.alias() + " from '" + libraryPath + "/" + imp.moduleName() + "';");
        }
        return lines;
    }

    static List<String> ohlcv() {
        return Arrays.asList(
                "// OHLCV Series",
                "const open = new Series(bars, (bar) => bar.open);",
                "const high = new Series(bars, (bar) => bar.high);",
                "const low = new Series(bars, (bar) => bar.low);",
                "const close = new Series(bars, (bar) => bar.close);",
                "const volume = new Series(bars, (bar) => bar.volume ?? 0);",
                "");
    }

    static List<String> calculatedSources() {
        return Arrays.asList(
                "// Calculated price sources",
                "const hl2 = high.add(low).div(2);",
                "const hlc3 = high.add(low).add(close).div(3);",
                "const ohlc4 = open.add(high).add(low).add(close).div(4);",
                "const hlcc4 = high.add(low).add(close).add(close).div(4);",
                "");
    }

    static List<String> timeSeries(Set<String> used) {
        List<String> lines = new ArrayList<>();
        if (used.isEmpty()) return lines;
        lines.add("// Time series");
        for (String name : InfoCollector.TIME_SERIES) {
            if (!used.contains(name)) continue;
            lines.add("const " + name + " = new Series(bars, (bar) => new Date(bar.time)." + dateAccessor(name) + ");");
        }
        lines.add("");
        return lines;
    }

    private static String dateAccessor(String name) {
        switch (name) {
            case "year": return "getFullYear()";
            case "month": return "getMonth() + 1";
            case "dayofmonth": return "getDate()";
            case "dayofweek": return "getDay() + 1";
            case "hour": return "getHours()";
            case "minute": return "getMinutes()";
            default: throw new IllegalArgumentException("Not a calendar series: " + name);
        }
    }

    static List<String> barIndex() {
        return Arrays.asList("// Bar index", "const last_bar_index = bars.length - 1;", "");
    }

    static List<String> inputsInterface(List<InputDefinition> inputs) {
        List<String> lines = new ArrayList<>();
        lines.add("export interface IndicatorInputs {");
        for (InputDefinition in : inputs) {
            lines.add("  " + in.name() + ": " + in.type().targetType() + ";");
        }
        lines.add("}");
        lines.add("");
        lines.add("const defaultInputs: IndicatorInputs = {");
        for (InputDefinition in : inputs) {
            lines.add("  " + in.name() + ": " + in.formattedDefault() + ",");
        }
        lines.add("};");
        lines.add("");
        return lines;
    }

    static List<String> syminfoInterface() {
        return Arrays.asList(
                "export interface SymbolInfo {",
                "  ticker: string;",
                "  tickerid: string;",
                "  currency: string;",
                "  mintick: number;",
                "  pointvalue: number;",
                "  type: string;",
                "}",
                "",
                "const defaultSyminfo: SymbolInfo = {",
                "  ticker: \"UNKNOWN\",",
                "  tickerid: \"UNKNOWN\",",
                "  currency: \"USD\",",
                "  mintick: 0.01,",
                "  pointvalue: 1,",
                "  type: \"stock\",",
                "};",
                "");
    }

    static List<String> timeframeInterface() {
        return Arrays.asList(
                "export interface TimeframeInfo {",
                "  period: string;",
                "  multiplier: number;",
                "  isintraday: boolean;",
                "  isdaily: boolean;",
                "  isweekly: boolean;",
                "  ismonthly: boolean;",
                "}",
                "",
                "const defaultTimeframe: TimeframeInfo = {",
                "  period: \"D\",",
                "  multiplier: 1,",
                "  isintraday: false,",
                "  isdaily: true,",
                "  isweekly: false,",
                "  ismonthly: false,",
                "};",
                "");
    }

    static String functionParams(boolean hasInputs, boolean usesSyminfo, boolean usesTimeframe) {
        List<String> params = new ArrayList<>();
        params.add("bars: any[]");
        if (hasInputs) params.add("inputs: Partial<IndicatorInputs> = {}");
        if (usesSyminfo) params.add("syminfoParam?: Partial<SymbolInfo>");
        if (usesTimeframe) params.add("timeframeParam?: Partial<TimeframeInfo>");
        return String.join(", ", params);
    }

    /** Maps each source input's selected name onto the matching price series. */
    static List<String> sourceMapping(List<InputDefinition> inputs) {
        List<String> lines = new ArrayList<>();
        boolean any = false;
        for (InputDefinition in : inputs) {
            if (in.type() != InputType.SOURCE) continue;
            if (!any) {
                lines.add("// Map source inputs to Series");
                any = true;
            }
            String name = Identifiers.sanitize(in.name());
            lines.add("const " + name + "Series = (() => {");
            lines.add("  switch (" + name + ") {");
            for (String source : Arrays.asList("open", "high", "low", "close", "hl2", "hlc3", "ohlc4", "hlcc4")) {
                lines.add("    case \"" + source + "\": return " + source + ";");
            }
            lines.add("    default: return close;");
            lines.add("  }");
            lines.add("})();");
        }
        if (any) lines.add("");
        return lines;
    }

    static String inputConfigArray(List<InputDefinition> inputs) {
        List<String> configs = new ArrayList<>();
        for (InputDefinition in : inputs) {
            List<String> parts = new ArrayList<>();
            parts.add("id: '" + in.name() + "'");
            parts.add("type: '" + in.type().label() + "'");
            String title = in.title() == null || in.title().isEmpty() ? in.name() : in.title();
            parts.add("title: '" + singleQuoted(title) + "'");
            parts.add("defval: " + in.formattedDefault());
            if (in.min() != null) parts.add("min: " + Identifiers.formatNumber(in.min()));
            if (in.max() != null) parts.add("max: " + Identifiers.formatNumber(in.max()));
            if (in.step() != null) parts.add("step: " + Identifiers.formatNumber(in.step()));
            if (!in.options().isEmpty()) {
                List<String> opts = new ArrayList<>();
                for (String o : in.options()) opts.add("'" + singleQuoted(o) + "'");
                parts.add("options: [" + String.join(", ", opts) + "]");
            }
            configs.add("{ " + String.join(", ", parts) + " }");
        }
        return "[" + String.join(", ", configs) + "]";
    }

    static String singleQuoted(String text) {
        return text.replace("\\", "\\\\").replace("'", "\\'");
    }
}
