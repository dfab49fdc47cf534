package com.elara.pine;

import com.elara.debug.ConsoleDebugSink;
import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line wrapper.
 *
 *   java com.elara.pine.PineCli indicator.pine [--json] [--out=path] [--options=opts.json] [--verbose]
 *
 * Exit codes: 0 ok, 1 source has errors, 2 bad usage, 3 I/O failure.
 */
public final class PineCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private PineCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        Map<String, String> flags = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--")) {
                int i = a.indexOf('=');
                if (i > 0) flags.put(a.substring(2, i), a.substring(i + 1));
                else flags.put(a.substring(2), "true");
            } else if (file == null) {
                file = a;
            } else {
                err.println("Unexpected argument: " + a);
                return usage(err);
            }
        }
        if (file == null) return usage(err);

        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new ConsoleDebugSink(err));
            Debug.get().setMinLevel(DebugLevel.DEBUG);
        }

        TranspileOptions options = new TranspileOptions();
        String source;
        try {
            if (flags.containsKey("options")) {
                options = TranspileOptions.fromJson(Files.readString(Path.of(flags.get("options")), StandardCharsets.UTF_8));
            }
            source = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_IO;
        }

        TranspileResult result = new PineTranspiler(options).transpileWithResult(source);

        String output;
        if (flags.containsKey("json")) {
            output = result.toJson();
        } else {
            for (Diagnostic w : result.getWarnings()) {
                err.println("warning: " + w);
            }
            if (!result.isSuccess()) {
                for (Diagnostic e : result.getErrors()) {
                    err.println("error: " + e);
                }
                return EXIT_ERRORS;
            }
            output = result.getCode();
        }

        String outPath = flags.get("out");
        if (outPath != null) {
            try {
                Files.writeString(Path.of(outPath), output, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Cannot write output: " + e.getMessage());
                return EXIT_IO;
            }
        } else {
            out.println(output);
        }
        return result.isSuccess() ? EXIT_OK : EXIT_ERRORS;
    }

    private static int usage(PrintStream err) {
        err.println("Usage: PineCli <file.pine> [--json] [--out=path] [--options=opts.json] [--verbose]");
        return EXIT_USAGE;
    }
}
