package com.elara.pine.semantic;

import java.util.Collections;
import java.util.List;

public final class AnalysisResult {
    private final List<SemanticError> errors;
    private final List<SemanticWarning> warnings;
    private final SymbolTable symbolTable;

    public AnalysisResult(List<SemanticError> errors, List<SemanticWarning> warnings, SymbolTable symbolTable) {
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.symbolTable = symbolTable;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<SemanticError> errors() { return errors; }
    public List<SemanticWarning> warnings() { return warnings; }
    public SymbolTable symbolTable() { return symbolTable; }
}
