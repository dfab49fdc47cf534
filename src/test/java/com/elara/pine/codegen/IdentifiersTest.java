package com.elara.pine.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifiersTest {

    @Test
    void sanitize_replacesPunctuationAndCollapsesUnderscores() {
        assertEquals("My_RSI_14", Identifiers.sanitize("My RSI (14)"));
        assertEquals("Balance_of_Power", Identifiers.sanitize("Balance of Power"));
        assertEquals("a_b", Identifiers.sanitize("a -- b"));
    }

    @Test
    void sanitize_prefixesLeadingDigit() {
        assertEquals("_3_Line_Break", Identifiers.sanitize("3 Line Break"));
    }

    @Test
    void sanitize_fallsBackForEmptyNames() {
        assertEquals("unnamed", Identifiers.sanitize(null));
        assertEquals("unnamed", Identifiers.sanitize(""));
        assertEquals("unnamed", Identifiers.sanitize("()"));
    }

    @Test
    void formatNumber_dropsTrailingZeros() {
        assertEquals("14", Identifiers.formatNumber(14.0));
        assertEquals("0.5", Identifiers.formatNumber(0.5));
        assertEquals("0", Identifiers.formatNumber(-0.0));
        assertEquals("NaN", Identifiers.formatNumber(Double.NaN));
        assertEquals("Infinity", Identifiers.formatNumber(Double.POSITIVE_INFINITY));
        assertEquals("1000000", Identifiers.formatNumber(1e6));
    }

    @Test
    void quote_escapesQuotesAndBackslashes() {
        assertEquals("\"say \\\"hi\\\"\"", Identifiers.quote("say \"hi\""));
        assertEquals("\"a\\\\b\"", Identifiers.quote("a\\b"));
        assertEquals("\"\"", Identifiers.quote(null));
        assertEquals("\"a\\nb\\tc\"", Identifiers.quote("a\nb\tc"));
    }
}
