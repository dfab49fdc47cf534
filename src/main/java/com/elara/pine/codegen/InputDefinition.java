package com.elara.pine.codegen;

import java.util.Collections;
import java.util.List;

/**
 * One user-tunable input. {@code defaultValue} holds the literal text of the default:
 * a number, true/false, or the raw string content for string, color and source inputs.
 */
public final class InputDefinition {
    private final String name;
    private final InputType type;
    private final String defaultValue;
    private final String title;
    private final Double min;
    private final Double max;
    private final Double step;
    private final List<String> options;

    public InputDefinition(String name, InputType type, String defaultValue, String title,
                           Double min, Double max, Double step, List<String> options) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.title = title;
        this.min = min;
        this.max = max;
        this.step = step;
        this.options = options == null ? Collections.<String>emptyList() : Collections.unmodifiableList(options);
    }

    public String name() { return name; }
    public InputType type() { return type; }
    public String defaultValue() { return defaultValue; }
    public String title() { return title; }
    public Double min() { return min; }
    public Double max() { return max; }
    public Double step() { return step; }
    public List<String> options() { return options; }

    /** Default rendered as a target literal for the defaultInputs object. */
    public String formattedDefault() {
        switch (type) {
            case STRING:
            case SOURCE:
                return Identifiers.quote(defaultValue);
            case COLOR:
                return Identifiers.quote(ColorMapper.toHex(defaultValue));
            default:
                return defaultValue;
        }
    }
}
