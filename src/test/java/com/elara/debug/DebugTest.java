package com.elara.debug;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setMinLevel(null);
    }

    @Test
    void nothingIsLoggable_withoutSink() {
        assertFalse(Debug.get().isLoggable(DebugLevel.ERROR));
        Debug.get().e("Test", "dropped");
    }

    @Test
    void entriesBelowMinLevel_neverReachSink() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(level + ":" + tag + ":" + message));
        Debug.get().setMinLevel(DebugLevel.INFO);

        Debug.get().t("Lexer", "trace");
        Debug.get().d("Lexer", "debug");
        Debug.get().i("Lexer", "info");
        Debug.get().w("Parser", "warn");

        assertEquals(List.of("INFO:Lexer:info", "WARN:Parser:warn"), seen);
        assertFalse(Debug.get().isLoggable(DebugLevel.DEBUG));
        assertTrue(Debug.get().isLoggable(DebugLevel.ERROR));
    }

    @Test
    void consoleSink_formatsLevelAndTag() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Debug.get().setSink(new ConsoleDebugSink(new PrintStream(bytes, true, StandardCharsets.UTF_8)));
        Debug.get().e("Series", "boom", new IllegalStateException("cause"));

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("ERROR [Series] boom"), text);
        assertTrue(text.contains("IllegalStateException: cause"));
    }

    @Test
    void consoleSink_rejectsNullStream() {
        assertThrows(IllegalArgumentException.class, () -> new ConsoleDebugSink(null));
    }

    @Test
    void levels_areOrdered() {
        assertTrue(DebugLevel.ERROR.isAtLeast(DebugLevel.WARN));
        assertTrue(DebugLevel.DEBUG.isAtLeast(DebugLevel.DEBUG));
        assertFalse(DebugLevel.TRACE.isAtLeast(DebugLevel.DEBUG));
    }
}
