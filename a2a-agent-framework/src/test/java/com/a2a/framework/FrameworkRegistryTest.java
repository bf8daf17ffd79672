package com.a2a.framework;

import com.a2a.message.ChatMessage;
import com.a2a.plugin.PluginLocator;
import com.a2a.provider.Provider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameworkRegistryTest {

    private static PluginLocator.Builder<Provider, Framework> builtinsOnly() {
        return PluginLocator.builder(FrameworkRegistry.SLOT).withoutClassPathExtensions();
    }

    @Test
    void buildFramework_nativeByDefault() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly().builtin(NativeFramework.class).build(), null);
        Provider provider = TestFrameworks.echo();

        Framework framework = registry.buildFramework(provider);

        assertEquals("native", framework.getId());
        assertSame(provider, framework.getProvider());
        assertEquals("native", registry.frameworkId());
    }

    @Test
    void buildFramework_aliasResolvesBeforeLookup() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly().builtin(NativeFramework.class).build(), " DIRECT ");

        assertEquals("native", registry.frameworkId());
        assertEquals("native", registry.buildFramework(TestFrameworks.echo()).getId());
    }

    @Test
    void buildFramework_unknownFallsBackToNative() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly().builtin(NativeFramework.class).build(), "native");

        assertEquals("native", registry.buildFramework(TestFrameworks.echo(), "autogen").getId());
    }

    @Test
    void buildFramework_nothingRegisteredYieldsUnknownPlaceholder() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly().build(), "native");

        Framework framework = registry.buildFramework(TestFrameworks.echo());

        assertEquals("unknown", framework.getId());
        assertFalse(framework.isReady());
        assertEquals("No frameworks discovered", framework.getReason());
        assertEquals("Hello, you said: x", framework.execute(List.of(ChatMessage.user("x"))).toCompletableFuture().join());
    }

    @Test
    void buildFramework_failingFactoryYieldsPlaceholderAroundSameProvider() {
        Provider provider = TestFrameworks.echo();
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly()
                .builtin("beeai", p -> {
                    throw new NoClassDefFoundError("beeai/Agent");
                }).build(), "bee.ai");

        Framework framework = registry.buildFramework(provider);

        assertEquals("beeai", framework.getId());
        assertFalse(framework.isReady());
        assertEquals("beeai/Agent", framework.getReason());
        assertSame(provider, framework.getProvider());
    }

    @Test
    void buildFramework_unannotatedFrameworkReportsRegisteredId() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly()
                .builtin("autogen", TestFrameworks.UpperCaseFramework::new)
                .build(), "autogen");

        Framework framework = registry.buildFramework(TestFrameworks.echo());

        assertEquals("autogen", framework.getId());
        assertEquals("autogen", framework.getDisplayName());
    }

    @Test
    void buildFramework_nullProviderGetsPlaceholder() {
        FrameworkRegistry registry = new FrameworkRegistry(builtinsOnly().builtin(NativeFramework.class).build(), null);

        Framework framework = registry.buildFramework(null, "native");

        assertEquals("native", framework.getId());
        assertEquals("unknown", framework.getProvider().getId());
        assertFalse(framework.getProvider().isReady());
        assertEquals("No provider supplied", framework.getProvider().getReason());
        assertTrue(framework.execute(List.of(ChatMessage.user("x"))).toCompletableFuture().join()
                .startsWith("[unknown not ready: No provider supplied]"));
    }

    @Test
    void extensionsFromManifestAreResolved() {
        FrameworkRegistry registry = new FrameworkRegistry(PluginLocator.builder(FrameworkRegistry.SLOT)
                .builtin(NativeFramework.class)
                .build(), "lg");

        Framework langgraph = registry.buildFramework(TestFrameworks.echo());
        assertEquals("langgraph", langgraph.getId());
        assertEquals("HELLO, YOU SAID: PING", langgraph.execute(List.of(ChatMessage.user("ping"))).toCompletableFuture().join());

        Framework crew = registry.buildFramework(TestFrameworks.echo(), "crew");
        assertEquals("crewai", crew.getId());
        assertFalse(crew.isReady());
        assertTrue(crew.getReason().startsWith("Import error: "), crew.getReason());

        assertEquals(Map.of("native", "builtin", "langgraph", "extension", "crewai", "extension"), registry.listFrameworks());
    }
}
