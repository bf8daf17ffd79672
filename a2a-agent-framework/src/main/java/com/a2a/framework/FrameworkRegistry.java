package com.a2a.framework;

import com.a2a.plugin.PluginCatalog;
import com.a2a.plugin.PluginEntry;
import com.a2a.plugin.PluginLocator;
import com.a2a.plugin.PluginSlot;
import com.a2a.plugin.PluginSource;
import com.a2a.provider.NotReadyProvider;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework registry: same resolution rules as the provider registry, keyed by the configured
 * framework (AGENT_FRAMEWORK). Unknown selections fall back to "native", then to any registered
 * framework, then to a {@link NotReadyFramework} with id "unknown". Never throws for plugin problems.
 */
public final class FrameworkRegistry {

    private static final Logger log = LoggerFactory.getLogger(FrameworkRegistry.class);

    public static final String DEFAULT_ID = "native";
    public static final String UNKNOWN_ID = "unknown";
    public static final String NOTHING_DISCOVERED = "No frameworks discovered";
    public static final String NO_PROVIDER = "No provider supplied";

    /** The "frameworks" plugin slot: plugins implementing {@link Framework}, built around a Provider. */
    public static final PluginSlot<Provider, Framework> SLOT = PluginSlot.of("frameworks", Framework.class, Provider.class,
            (provider, id, reason) -> new NotReadyFramework(provider, id, reason));

    private final PluginLocator<Provider, Framework> locator;
    private final PluginCatalog<Provider, Framework> catalog;
    private final String configured;

    public FrameworkRegistry(PluginLocator<Provider, Framework> locator, String configured) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.catalog = locator.locate();
        this.configured = configured != null && !configured.isBlank() ? configured : DEFAULT_ID;
    }

    /** id to "builtin"/"extension"; never constructs a framework. */
    public Map<String, String> listFrameworks() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, PluginSource> e : locator.describe().entrySet()) {
            out.put(e.getKey(), e.getValue().getTag());
        }
        return out;
    }

    public PluginCatalog<Provider, Framework> getCatalog() {
        return catalog;
    }

    /** Configured framework id after aliasing. */
    public String frameworkId() {
        return FrameworkAliases.resolve(configured);
    }

    /** Builds the configured framework around {@code provider}. */
    public Framework buildFramework(Provider provider) {
        return buildFramework(provider, null);
    }

    /**
     * Builds the framework for {@code selector} (null or blank means the configured framework).
     * A null provider is replaced by a not-ready placeholder. Never throws.
     */
    public Framework buildFramework(Provider provider, String selector) {
        if (provider == null) {
            log.warn("No provider supplied for framework; using a not-ready placeholder");
            provider = new NotReadyProvider(ProviderRegistry.UNKNOWN_ID, NO_PROVIDER);
        }
        String want = FrameworkAliases.resolve(selector != null && !selector.isBlank() ? selector : configured);
        Optional<PluginEntry<Provider, Framework>> entry = catalog.resolve(want, DEFAULT_ID);
        if (entry.isEmpty()) {
            log.warn("No frameworks discovered; framework '{}' is not available", want);
            return new NotReadyFramework(provider, UNKNOWN_ID, NOTHING_DISCOVERED);
        }
        if (!entry.get().getId().equals(want)) {
            log.warn("Framework '{}' is not registered; falling back to '{}'", want, entry.get().getId());
        }
        Framework framework = entry.get().create(provider);
        if (framework instanceof AbstractFramework) {
            ((AbstractFramework) framework).registeredAs(entry.get().getId());
        }
        if (!framework.isReady()) {
            log.warn("Framework '{}' is not ready: {}", framework.getId(), framework.getReason());
        }
        return framework;
    }
}
