package com.a2a.plugin;

import java.util.Objects;

/**
 * Describes one plugin slot (e.g. "providers", "frameworks"): the contract every plugin must
 * implement, the argument its constructor or factory receives, and how to build a not-ready
 * placeholder when a plugin cannot be loaded or constructed.
 *
 * @param <A> construction argument ({@link Void} when plugins take none)
 * @param <T> plugin contract
 */
public final class PluginSlot<A, T> {

    private static final String MANIFEST_PREFIX = "META-INF/a2a/";
    private static final String MANIFEST_SUFFIX = ".properties";

    private final String name;
    private final Class<T> contract;
    private final Class<A> argumentType;
    private final Placeholder<A, T> placeholder;

    private PluginSlot(String name, Class<T> contract, Class<A> argumentType, Placeholder<A, T> placeholder) {
        this.name = name;
        this.contract = contract;
        this.argumentType = argumentType;
        this.placeholder = placeholder;
    }

    /**
     * @param name         slot name; also names the extension manifest
     * @param contract     interface every plugin implements
     * @param argumentType constructor/factory argument type, {@code Void.class} for none
     * @param placeholder  builds a not-ready instance; must not throw
     */
    public static <A, T> PluginSlot<A, T> of(String name, Class<T> contract, Class<A> argumentType,
                                             Placeholder<A, T> placeholder) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Slot name must be non-blank");
        }
        return new PluginSlot<>(name.trim(), Objects.requireNonNull(contract, "contract"),
                Objects.requireNonNull(argumentType, "argumentType"),
                Objects.requireNonNull(placeholder, "placeholder"));
    }

    public String getName() {
        return name;
    }

    public Class<T> getContract() {
        return contract;
    }

    public Class<A> getArgumentType() {
        return argumentType;
    }

    /** Whether plugins of this slot are constructed without an argument. */
    public boolean takesNoArgument() {
        return argumentType == Void.class;
    }

    /** Class-path resource listing extension plugins: {@code META-INF/a2a/<name>.properties}. */
    public String manifestResource() {
        return MANIFEST_PREFIX + name + MANIFEST_SUFFIX;
    }

    /** Builds a not-ready placeholder carrying {@code reason}. */
    public T notReady(A argument, String id, String reason) {
        return placeholder.create(argument, id, reason);
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Creates the degenerate instance substituted for a plugin that failed to load or construct.
     */
    @FunctionalInterface
    public interface Placeholder<A, T> {

        T create(A argument, String id, String reason);
    }
}
