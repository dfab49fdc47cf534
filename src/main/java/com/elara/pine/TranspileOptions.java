package com.elara.pine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/** Output settings for the code generator. Unknown JSON fields are ignored. */
public final class TranspileOptions {

    private static final ObjectMapper om = new ObjectMapper();

    public static final String DEFAULT_RUNTIME_MODULE = "oakscriptjs";
    public static final String DEFAULT_LIBRARY_PATH = "./libs";

    private boolean includeImports = true;
    private String runtimeModule = DEFAULT_RUNTIME_MODULE;
    private String libraryPath = DEFAULT_LIBRARY_PATH;

    public TranspileOptions() {}

    /**
     * Reads {@code {"includeImports": bool, "runtimeModule": "...", "libraryPath": "..."}}.
     * Absent fields keep their defaults.
     */
    public static TranspileOptions fromJson(String json) throws IOException {
        JsonNode root = om.readTree(json);
        TranspileOptions opts = new TranspileOptions();
        if (root == null || !root.isObject()) {
            throw new IOException("Options must be a JSON object");
        }
        JsonNode includeImports = root.path("includeImports");
        if (includeImports.isBoolean()) opts.setIncludeImports(includeImports.asBoolean());
        JsonNode runtimeModule = root.path("runtimeModule");
        if (runtimeModule.isTextual()) opts.setRuntimeModule(runtimeModule.asText());
        JsonNode libraryPath = root.path("libraryPath");
        if (libraryPath.isTextual()) opts.setLibraryPath(libraryPath.asText());
        return opts;
    }

    public boolean isIncludeImports() { return includeImports; }

    public TranspileOptions setIncludeImports(boolean includeImports) {
        this.includeImports = includeImports;
        return this;
    }

    public String getRuntimeModule() { return runtimeModule; }

    public TranspileOptions setRuntimeModule(String runtimeModule) {
        this.runtimeModule = runtimeModule == null || runtimeModule.isEmpty() ? DEFAULT_RUNTIME_MODULE : runtimeModule;
        return this;
    }

    public String getLibraryPath() { return libraryPath; }

    public TranspileOptions setLibraryPath(String libraryPath) {
        this.libraryPath = libraryPath == null || libraryPath.isEmpty() ? DEFAULT_LIBRARY_PATH : libraryPath;
        return this;
    }
}
