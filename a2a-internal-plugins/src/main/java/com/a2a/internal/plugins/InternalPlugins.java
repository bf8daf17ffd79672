package com.a2a.internal.plugins;

import com.a2a.framework.Framework;
import com.a2a.framework.FrameworkRegistry;
import com.a2a.framework.NativeFramework;
import com.a2a.plugin.CommunityPlugins;
import com.a2a.plugin.PluginLocator;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderRegistry;
import com.a2a.provider.echo.EchoProvider;
import com.a2a.provider.ollama.OllamaProvider;
import com.a2a.provider.openai.AzureOpenAiProvider;
import com.a2a.provider.openai.OpenAiProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Plugin-side bootstrap: the builtin registration table for both slots and the community JAR
 * loaders. The agent only calls {@link #providers(List)} and {@link #frameworks(List)} and hands the
 * locators to the registries.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    /** Resolved by name so the agent still starts when LangChain4j is left off the class path. */
    static final String LANGCHAIN4J_FRAMEWORK = "com.a2a.framework.langchain4j.Langchain4jFramework";

    private InternalPlugins() {
    }

    /**
     * Opens the community plugin JARs in {@code pluginsDir}; null means no community plugins.
     */
    public static List<ClassLoader> openCommunityJars(Path pluginsDir) {
        List<ClassLoader> loaders = CommunityPlugins.open(pluginsDir);
        log.info("Plugins: {} community JAR(s) (dir={})", loaders.size(), pluginsDir != null ? pluginsDir : "none");
        return loaders;
    }

    /**
     * Provider locator: builtin echo, ollama, openai and azure_openai, then class-path and community
     * extension manifests.
     */
    public static PluginLocator<Void, Provider> providers(List<ClassLoader> communityLoaders) {
        PluginLocator.Builder<Void, Provider> builder = PluginLocator.builder(ProviderRegistry.SLOT)
                .builtin(EchoProvider.class)
                .builtin(OllamaProvider.class)
                .builtin(OpenAiProvider.class)
                .builtin(AzureOpenAiProvider.class);
        communityLoaders.forEach(builder::extensionLoader);
        return builder.build();
    }

    /**
     * Framework locator: builtin native and langchain4j, then class-path and community extension
     * manifests.
     */
    public static PluginLocator<Provider, Framework> frameworks(List<ClassLoader> communityLoaders) {
        PluginLocator.Builder<Provider, Framework> builder = PluginLocator.builder(FrameworkRegistry.SLOT)
                .builtin(NativeFramework.class)
                .builtin("langchain4j", LANGCHAIN4J_FRAMEWORK, InternalPlugins.class.getClassLoader());
        communityLoaders.forEach(builder::extensionLoader);
        return builder.build();
    }
}
