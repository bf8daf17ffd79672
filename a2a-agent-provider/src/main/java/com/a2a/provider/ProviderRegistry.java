package com.a2a.provider;

import com.a2a.plugin.PluginCatalog;
import com.a2a.plugin.PluginEntry;
import com.a2a.plugin.PluginLocator;
import com.a2a.plugin.PluginSlot;
import com.a2a.plugin.PluginSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Provider registry: resolves a selector (or the configured provider) through the alias table and
 * the plugin catalog and builds the provider. Never throws for plugin problems; an unusable or
 * unknown selection falls back to "echo", then to any registered provider, then to a
 * {@link NotReadyProvider} with id "unknown".
 * <p>
 * The catalog is built once at construction and read without locks. The only lock guards the
 * memoized default provider.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    public static final String DEFAULT_ID = "echo";
    public static final String UNKNOWN_ID = "unknown";
    public static final String NOTHING_DISCOVERED = "No providers discovered";

    /** The "providers" plugin slot: no-arg plugins implementing {@link Provider}. */
    public static final PluginSlot<Void, Provider> SLOT =
            PluginSlot.of("providers", Provider.class, Void.class, (arg, id, reason) -> new NotReadyProvider(id, reason));

    private final PluginLocator<Void, Provider> locator;
    private final PluginCatalog<Void, Provider> catalog;
    private final String configured;
    private final ReentrantLock lock = new ReentrantLock();
    private Provider active;

    /**
     * @param locator    provider plugin locator
     * @param configured configured selection (e.g. the LLM_PROVIDER value); blank means "echo"
     */
    public ProviderRegistry(PluginLocator<Void, Provider> locator, String configured) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.catalog = locator.locate();
        this.configured = configured != null && !configured.isBlank() ? configured : DEFAULT_ID;
    }

    /**
     * id to "builtin"/"extension". Re-reads the extension manifests; never constructs a provider.
     */
    public Map<String, String> listProviders() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, PluginSource> e : locator.describe().entrySet()) {
            out.put(e.getKey(), e.getValue().getTag());
        }
        return out;
    }

    /** Catalog built at startup. */
    public PluginCatalog<Void, Provider> getCatalog() {
        return catalog;
    }

    /** Configured provider id after aliasing. */
    public String providerId() {
        return ProviderAliases.resolve(configured);
    }

    /** Builds the configured provider. */
    public Provider buildProvider() {
        return buildProvider(null);
    }

    /**
     * Builds a new provider for {@code selector} (null or blank means the configured provider).
     * Never throws.
     */
    public Provider buildProvider(String selector) {
        String want = ProviderAliases.resolve(selector != null && !selector.isBlank() ? selector : configured);
        Optional<PluginEntry<Void, Provider>> entry = catalog.resolve(want, DEFAULT_ID);
        if (entry.isEmpty()) {
            log.warn("No providers discovered; provider '{}' is not available", want);
            return new NotReadyProvider(UNKNOWN_ID, NOTHING_DISCOVERED);
        }
        if (!entry.get().getId().equals(want)) {
            log.warn("Provider '{}' is not registered; falling back to '{}'", want, entry.get().getId());
        }
        Provider provider = entry.get().create(null);
        if (!provider.isReady()) {
            log.warn("Provider '{}' is not ready: {}", provider.getId(), provider.getReason());
        }
        return provider;
    }

    /** The memoized configured provider. */
    public Provider provider() {
        return provider(null, false);
    }

    /**
     * Returns the active provider. With no {@code name}, returns the memoized configured provider,
     * building it once; {@code fresh=true} builds a new one without replacing the cached instance.
     * An explicit {@code name} always builds a new instance.
     */
    public Provider provider(String name, boolean fresh) {
        if (name != null) {
            return buildProvider(name);
        }
        if (fresh) {
            return buildProvider();
        }
        lock.lock();
        try {
            if (active == null) {
                active = buildProvider();
            }
            return active;
        } finally {
            lock.unlock();
        }
    }
}
