package com.elara.pine.codegen;

/** An external library imported under a local alias. */
public final class ImportInfo {
    private final String publisher;
    private final String library;
    private final int version;
    private final String alias;

    public ImportInfo(String publisher, String library, int version, String alias) {
        this.publisher = publisher;
        this.library = library;
        this.version = version;
        this.alias = alias;
    }

    public String publisher() { return publisher; }
    public String library() { return library; }
    public int version() { return version; }
    public String alias() { return alias; }

    /** File name of the generated library module, e.g. TradingView_ta_v7. */
    public String moduleName() {
        return publisher + "_" + library + "_v" + version;
    }
}
