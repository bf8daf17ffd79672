package com.a2a.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static synonym to canonical-id map consulted before every registry lookup. Every canonical id
 * that appears as a target must map to itself, so {@code resolve(resolve(x)) == resolve(x)}.
 * Unknown names resolve to their normalized form.
 */
public final class AliasTable {

    private final Map<String, String> aliases;

    private AliasTable(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * @throws IllegalArgumentException when a key or target is blank or a target does not map to itself
     */
    public static AliasTable of(Map<String, String> aliases) {
        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : aliases.entrySet()) {
            String key = normalize(e.getKey());
            String target = normalize(e.getValue());
            if (key.isEmpty() || target.isEmpty()) {
                throw new IllegalArgumentException("Alias entries must be non-blank: " + e);
            }
            normalized.put(key, target);
        }
        for (String target : normalized.values()) {
            String self = normalized.get(target);
            if (self != null && !self.equals(target)) {
                throw new IllegalArgumentException("Canonical id '" + target + "' must map to itself, not '" + self + "'");
            }
        }
        return new AliasTable(normalized);
    }

    /** Trims and lower-cases {@code name}; null becomes the empty string. */
    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    /** Canonical id for {@code name} (normalized first). */
    public String resolve(String name) {
        String key = normalize(name);
        return aliases.getOrDefault(key, key);
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}
