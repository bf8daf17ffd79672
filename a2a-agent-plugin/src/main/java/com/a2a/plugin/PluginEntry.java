package com.a2a.plugin;

import java.util.Objects;

/**
 * One registry entry: id, where it came from, and a factory that never throws.
 *
 * @param <A> construction argument
 * @param <T> plugin contract
 */
public final class PluginEntry<A, T> {

    private final String id;
    private final PluginSource source;
    private final SafeFactory<A, T> factory;

    public PluginEntry(String id, PluginSource source, SafeFactory<A, T> factory) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public String getId() {
        return id;
    }

    public PluginSource getSource() {
        return source;
    }

    public SafeFactory<A, T> getFactory() {
        return factory;
    }

    /** Builds a new plugin instance (or a placeholder). Never throws. */
    public T create(A argument) {
        return factory.create(argument);
    }

    @Override
    public String toString() {
        return id + " (" + source.getTag() + ")";
    }
}
