package com.elara.pine;

import com.elara.debug.Debug;
import com.elara.pine.codegen.CodeGenerator;
import com.elara.pine.codegen.GeneratedCode;
import com.elara.pine.codegen.GeneratorWarning;
import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import com.elara.pine.parser.SyntaxError;
import com.elara.pine.semantic.AnalysisResult;
import com.elara.pine.semantic.SemanticAnalyzer;
import com.elara.pine.semantic.SemanticError;
import com.elara.pine.semantic.SemanticWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry point: parse, analyze, collect, generate.
 *
 * Each call builds its own analyzer and generator, so one instance can be
 * shared between threads.
 */
public final class PineTranspiler {

    private static final String TAG = "Transpiler";

    private volatile TranspileOptions options;

    public PineTranspiler() {
        this(new TranspileOptions());
    }

    public PineTranspiler(TranspileOptions options) {
        this.options = options == null ? new TranspileOptions() : options;
    }

    public TranspileOptions getOptions() {
        return options;
    }

    public void setOptions(TranspileOptions options) {
        this.options = options == null ? new TranspileOptions() : options;
    }

    /** Generated code, or a {@link TranspileException} carrying every error. */
    public String transpile(String source) {
        TranspileResult result = transpileWithResult(source);
        if (!result.isSuccess()) {
            throw new TranspileException(result.getErrors());
        }
        return result.getCode();
    }

    public TranspileResult transpileWithResult(String source) {
        ParseResult parsed = Parser.parseSource(source == null ? "" : source);
        if (parsed.hasErrors()) {
            List<Diagnostic> errors = new ArrayList<>();
            for (SyntaxError e : parsed.errors()) {
                errors.add(new Diagnostic(e.message, e.line, e.column));
            }
            Debug.get().d(TAG, "syntax errors=" + errors.size() + ", skipping analysis");
            return new TranspileResult("", errors, Collections.<Diagnostic>emptyList());
        }

        AnalysisResult analysis = new SemanticAnalyzer(source).analyze(parsed.statements());
        List<Diagnostic> warnings = new ArrayList<>();
        for (SemanticWarning w : analysis.warnings()) {
            warnings.add(new Diagnostic(w.message(), w.line(), w.column()));
        }
        if (!analysis.isValid()) {
            List<Diagnostic> errors = new ArrayList<>();
            for (SemanticError e : analysis.errors()) {
                errors.add(new Diagnostic(e.message(), e.line(), e.column()));
            }
            Debug.get().d(TAG, "semantic errors=" + errors.size() + ", skipping generation");
            return new TranspileResult("", errors, warnings);
        }

        GeneratedCode generated = new CodeGenerator(options).generate(parsed.statements());
        for (GeneratorWarning w : generated.warnings()) {
            warnings.add(new Diagnostic(w.message(), w.line(), w.column()));
        }
        Debug.get().d(TAG, "generated " + generated.code().length() + " chars, warnings=" + warnings.size());
        return new TranspileResult(generated.code(), Collections.<Diagnostic>emptyList(), warnings);
    }
}
