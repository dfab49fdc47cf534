package com.elara.pine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.List;

public final class TranspileResult {

    private static final ObjectMapper om = new ObjectMapper();

    private final String code;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;

    public TranspileResult(String code, List<Diagnostic> errors, List<Diagnostic> warnings) {
        this.code = code == null ? "" : code;
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public String getCode() { return code; }
    public List<Diagnostic> getErrors() { return errors; }
    public List<Diagnostic> getWarnings() { return warnings; }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public ObjectNode toJsonNode() {
        ObjectNode root = om.createObjectNode();
        root.put("code", code);
        root.set("errors", diagnostics(errors));
        root.set("warnings", diagnostics(warnings));
        return root;
    }

    public String toJson() {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transpile result", e);
        }
    }

    private static ArrayNode diagnostics(List<Diagnostic> list) {
        ArrayNode arr = om.createArrayNode();
        for (Diagnostic d : list) {
            ObjectNode n = arr.addObject();
            n.put("message", d.getMessage());
            n.put("line", d.getLine());
            n.put("column", d.getColumn());
        }
        return arr;
    }
}
