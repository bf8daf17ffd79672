package com.a2a.plugin;

/**
 * Raw plugin factory. A class implementing this interface and named in a slot's extension manifest
 * is the preferred way for an extension to contribute a plugin: the locator instantiates the class
 * with its public no-arg constructor and calls {@link #create(Object)} each time the plugin is built.
 * <p>
 * Provider factories receive {@code null}; framework factories receive the Provider the framework
 * must wrap. Raw factories may throw; the registry always calls them through {@link SafeFactory}.
 *
 * @param <A> construction argument ({@link Void} for providers)
 * @param <T> plugin contract
 */
@FunctionalInterface
public interface PluginFactory<A, T> {

    T create(A argument) throws Exception;
}
