package com.elara.pine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PineCliTest {

    private static final ObjectMapper om = new ObjectMapper();

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return PineCli.run(args, out, err);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void noArguments_printsUsage() {
        assertEquals(PineCli.EXIT_USAGE, run());
        assertTrue(err().startsWith("Usage:"));
    }

    @Test
    void extraPositional_isUsageError() throws Exception {
        Path src = write("a.pine", "plot(close)");
        assertEquals(PineCli.EXIT_USAGE, run(src.toString(), "other.pine"));
        assertTrue(err().contains("Unexpected argument: other.pine"));
    }

    @Test
    void missingFile_isIoError() {
        assertEquals(PineCli.EXIT_IO, run(dir.resolve("missing.pine").toString()));
        assertTrue(err().startsWith("Cannot read input:"));
    }

    @Test
    void validSource_printsCode() throws Exception {
        Path src = write("bop.pine", "indicator(\"BOP\")\nplot((close - open) / (high - low))");
        assertEquals(PineCli.EXIT_OK, run(src.toString()));
        assertTrue(out().contains("export function BOP(bars: any[]): IndicatorResult {"));
        assertEquals("", err());
    }

    @Test
    void errors_goToStderr() throws Exception {
        Path src = write("bad.pine", "x := 1");
        assertEquals(PineCli.EXIT_ERRORS, run(src.toString()));
        assertEquals("", out());
        assertTrue(err().contains("error: Line 1: Variable 'x' is not defined"));
    }

    @Test
    void warnings_areReportedAlongsideCode() throws Exception {
        Path src = write("levels.pine", "plot(close)\nhline(50)");
        assertEquals(PineCli.EXIT_OK, run(src.toString()));
        assertTrue(err().startsWith("warning: Line 2: "));
        assertTrue(out().contains("export const plotConfig"));
    }

    @Test
    void jsonMode_reportsErrorsAsJson() throws Exception {
        Path src = write("bad.pine", "x := 1");
        assertEquals(PineCli.EXIT_ERRORS, run(src.toString(), "--json"));
        JsonNode root = om.readTree(out());
        assertEquals(1, root.path("errors").size());
        assertEquals("", root.path("code").asText());
    }

    @Test
    void outFlag_writesFile_andOptionsAreApplied() throws Exception {
        Path src = write("a.pine", "plot(close)");
        Path opts = write("opts.json", "{\"runtimeModule\": \"./rt\"}");
        Path target = dir.resolve("a.ts");
        assertEquals(PineCli.EXIT_OK, run(src.toString(), "--out=" + target, "--options=" + opts));
        assertEquals("", out());
        assertTrue(Files.readString(target).contains("from './rt';"));
    }

    @Test
    void badOptionsFile_isIoError() throws Exception {
        Path src = write("a.pine", "plot(close)");
        Path opts = write("opts.json", "[]");
        assertEquals(PineCli.EXIT_IO, run(src.toString(), "--options=" + opts));
        assertTrue(err().contains("Options must be a JSON object"));
    }
}
