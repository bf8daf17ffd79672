package com.a2a.bootstrap;

import com.a2a.config.AgentConfig;
import com.a2a.framework.Framework;
import com.a2a.framework.FrameworkRegistry;
import com.a2a.internal.plugins.InternalPlugins;
import com.a2a.provider.DispatchMetrics;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderExecutors;
import com.a2a.provider.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Bootstrap for the A2A agent: loads configuration, opens community plugin JARs, builds the
 * provider and framework registries from the builtin table and the extension manifests, resolves
 * the active provider (memoized) and framework, and returns an {@link AgentContext}.
 * Plugin problems never stop startup; they show up as not-ready plugins in the readiness report.
 */
public final class AgentBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AgentBootstrap.class);

    private AgentBootstrap() {
    }

    /** Bootstraps from environment variables. */
    public static AgentContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(AgentConfig.fromEnvironment());
    }

    public static AgentContext initialize(AgentConfig config) {
        return initialize(config, new SimpleMeterRegistry());
    }

    /**
     * Bootstraps with the given configuration; provider call metrics go to {@code meterRegistry}.
     */
    public static AgentContext initialize(AgentConfig config, MeterRegistry meterRegistry) {
        log.info("Bootstrap: provider={}, framework={}, pluginsDir={}, providerPool={}, orchestrationPool={}",
                config.getLlmProvider(), config.getAgentFramework(), config.getPluginsDir().orElse(null),
                config.getProviderPoolSize(), config.getOrchestrationPoolSize());
        ProviderExecutors.configure(config.getProviderPoolSize());
        ProviderExecutors.configureOrchestration(config.getOrchestrationPoolSize());
        DispatchMetrics.bind(meterRegistry);

        Path pluginsDir = config.getPluginsDir().orElse(null);
        List<ClassLoader> community = InternalPlugins.openCommunityJars(pluginsDir);

        ProviderRegistry providers = new ProviderRegistry(InternalPlugins.providers(community), config.getLlmProvider());
        FrameworkRegistry frameworks = new FrameworkRegistry(InternalPlugins.frameworks(community), config.getAgentFramework());

        Provider provider = providers.provider();
        Framework framework = frameworks.buildFramework(provider);

        log.info("Startup: provider={} ({}, ready={}, reason={}), framework={} ({}, ready={}, reason={})",
                provider.getId(), provider.getDisplayName(), provider.isReady(), provider.getReason(),
                framework.getId(), framework.getDisplayName(), framework.isReady(), framework.getReason());
        if (!provider.getId().equals(providers.providerId())) {
            log.warn("Configured provider '{}' resolved to '{}'", providers.providerId(), provider.getId());
        }
        if (!framework.getId().equals(frameworks.frameworkId())) {
            log.warn("Configured framework '{}' resolved to '{}'", frameworks.frameworkId(), framework.getId());
        }
        return new AgentContext(config, providers, frameworks, provider, framework, meterRegistry);
    }
}
