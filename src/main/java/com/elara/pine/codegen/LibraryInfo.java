package com.elara.pine.codegen;

public final class LibraryInfo {
    private final String name;
    private final boolean overlay;

    public LibraryInfo(String name, boolean overlay) {
        this.name = name;
        this.overlay = overlay;
    }

    public String name() { return name; }
    public boolean isOverlay() { return overlay; }
}
