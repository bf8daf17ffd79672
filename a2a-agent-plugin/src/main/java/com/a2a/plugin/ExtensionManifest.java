package com.a2a.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Reads extension manifests: {@code META-INF/a2a/<slot>.properties} resources with one
 * {@code id=fully.qualified.ClassName} line per plugin. Reading never loads the named classes.
 */
final class ExtensionManifest {

    private static final Logger log = LoggerFactory.getLogger(ExtensionManifest.class);

    private ExtensionManifest() {
    }

    /**
     * Returns the entries of every manifest named {@code resource} visible to {@code loader}, in
     * resource order; within one file, in id order. Unreadable files and blank values are skipped.
     */
    static List<Entry> read(String resource, ClassLoader loader) {
        List<Entry> out = new ArrayList<>();
        Enumeration<URL> urls;
        try {
            urls = loader.getResources(resource);
        } catch (IOException e) {
            log.warn("Failed to enumerate extension manifests {}: {}", resource, e.getMessage());
            return out;
        }
        for (URL url : Collections.list(urls)) {
            Properties props = new Properties();
            try (InputStream in = url.openStream()) {
                props.load(in);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable extension manifest {}: {}", url, e.getMessage());
                continue;
            }
            Map<String, String> sorted = new TreeMap<>();
            for (String key : props.stringPropertyNames()) {
                String id = AliasTable.normalize(key);
                String className = props.getProperty(key).trim();
                if (id.isEmpty() || className.isEmpty()) {
                    log.warn("Skipping malformed entry '{}' in extension manifest {}", key, url);
                    continue;
                }
                sorted.put(id, className);
            }
            for (Map.Entry<String, String> e : sorted.entrySet()) {
                out.add(new Entry(e.getKey(), e.getValue(), loader, url.toExternalForm()));
            }
        }
        return out;
    }

    /** One manifest line together with the loader that must resolve its class. */
    static final class Entry {

        private final String id;
        private final String className;
        private final ClassLoader loader;
        private final String origin;

        Entry(String id, String className, ClassLoader loader, String origin) {
            this.id = id;
            this.className = className;
            this.loader = loader;
            this.origin = origin;
        }

        String getId() {
            return id;
        }

        String getClassName() {
            return className;
        }

        ClassLoader getLoader() {
            return loader;
        }

        String getOrigin() {
            return origin;
        }
    }
}
