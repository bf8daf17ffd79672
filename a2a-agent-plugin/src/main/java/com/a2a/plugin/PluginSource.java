package com.a2a.plugin;

/**
 * Where a registry entry came from.
 */
public enum PluginSource {

    /** Compile-time registration table. */
    BUILTIN("builtin"),

    /** Extension manifest on the class path or in a community JAR. */
    EXTENSION("extension");

    private final String tag;

    PluginSource(String tag) {
        this.tag = tag;
    }

    /** Listing tag ("builtin" or "extension"). */
    public String getTag() {
        return tag;
    }
}
