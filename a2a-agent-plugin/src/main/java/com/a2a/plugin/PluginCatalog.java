package com.a2a.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable id to entry map for one slot, built once by {@link PluginLocator#locate()} and read
 * without locks afterwards.
 *
 * @param <A> construction argument
 * @param <T> plugin contract
 */
public final class PluginCatalog<A, T> {

    private final PluginSlot<A, T> slot;
    private final Map<String, PluginEntry<A, T>> entries;

    PluginCatalog(PluginSlot<A, T> slot, Map<String, PluginEntry<A, T>> entries) {
        this.slot = slot;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public PluginSlot<A, T> getSlot() {
        return slot;
    }

    public Optional<PluginEntry<A, T>> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return id != null && entries.containsKey(id);
    }

    /** Ids in registration order (builtins first, then extensions not overriding a builtin). */
    public Set<String> ids() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Resolves {@code id} with fallbacks: the entry for {@code id}, else the one for
     * {@code defaultId}, else the first registered entry. Empty only when the catalog is empty.
     */
    public Optional<PluginEntry<A, T>> resolve(String id, String defaultId) {
        Optional<PluginEntry<A, T>> exact = get(id);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<PluginEntry<A, T>> fallback = get(defaultId);
        if (fallback.isPresent()) {
            return fallback;
        }
        return entries.values().stream().findFirst();
    }

    /** id to source tag ("builtin"/"extension"). */
    public Map<String, String> sources() {
        Map<String, String> out = new LinkedHashMap<>();
        entries.forEach((id, entry) -> out.put(id, entry.getSource().getTag()));
        return out;
    }
}
