package com.a2a.bootstrap;

import com.a2a.annotations.ResourceCleanup;
import com.a2a.config.AgentConfig;
import com.a2a.framework.Framework;
import com.a2a.framework.FrameworkRegistry;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderExecutors;
import com.a2a.provider.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything the agent built at startup: configuration, both registries, the active provider
 * and framework, and the meter registry. {@link #close()} releases plugin resources and the shared
 * provider pool.
 */
public final class AgentContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentContext.class);

    private final AgentConfig config;
    private final ProviderRegistry providerRegistry;
    private final FrameworkRegistry frameworkRegistry;
    private final Provider provider;
    private final Framework framework;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean closed = new AtomicBoolean();

    AgentContext(AgentConfig config, ProviderRegistry providerRegistry, FrameworkRegistry frameworkRegistry,
                 Provider provider, Framework framework, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "providerRegistry");
        this.frameworkRegistry = Objects.requireNonNull(frameworkRegistry, "frameworkRegistry");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.framework = Objects.requireNonNull(framework, "framework");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public AgentConfig getConfig() {
        return config;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public FrameworkRegistry getFrameworkRegistry() {
        return frameworkRegistry;
    }

    public Provider getProvider() {
        return provider;
    }

    public Framework getFramework() {
        return framework;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Ready when both the provider and the framework are ready. */
    public boolean isReady() {
        return provider.isReady() && framework.isReady();
    }

    /**
     * Readiness report: {@code status} ("ready"/"not-ready"), and id, name, ready and reason of the
     * provider and of the framework.
     */
    public Map<String, Object> readiness() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", isReady() ? "ready" : "not-ready");
        out.put("provider", providerMeta(provider));
        out.put("framework", frameworkMeta(framework));
        return out;
    }

    static Map<String, Object> providerMeta(Provider p) {
        return meta(p.getId(), p.getDisplayName(), p.isReady(), p.getReason());
    }

    static Map<String, Object> frameworkMeta(Framework f) {
        return meta(f.getId(), f.getDisplayName(), f.isReady(), f.getReason());
    }

    private static Map<String, Object> meta(String id, String name, boolean ready, String reason) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("name", name);
        m.put("ready", ready);
        m.put("reason", reason != null ? reason : "");
        return m;
    }

    /**
     * Runs {@link ResourceCleanup#onExit()} on the framework and provider, then stops the shared
     * provider and orchestration pools. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cleanup(framework, framework.getId());
        if (provider != framework.getProvider()) {
            cleanup(framework.getProvider(), framework.getProvider().getId());
        }
        cleanup(provider, provider.getId());
        ProviderExecutors.shutdown();
        log.info("Agent resources released");
    }

    private static void cleanup(Object plugin, String id) {
        if (plugin instanceof ResourceCleanup) {
            try {
                ((ResourceCleanup) plugin).onExit();
            } catch (RuntimeException e) {
                log.warn("onExit failed for plugin {}: {}", id, e.getMessage(), e);
            }
        }
    }
}
