package com.a2a.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Opens community plugin JARs from a controlled directory. Only the configured directory is
 * scanned and only {@code *.jar} files are opened; each JAR gets its own {@link URLClassLoader}
 * whose parent is a {@link RestrictedPluginClassLoader}. The loaders are then searched for
 * extension manifests like the application class path.
 * <p>
 * Failures (missing directory, unreadable JAR) are logged and skipped; the agent continues.
 */
public final class CommunityPlugins {

    private static final Logger log = LoggerFactory.getLogger(CommunityPlugins.class);

    private CommunityPlugins() {
    }

    /**
     * Opens every JAR in {@code pluginsDir}, in file-name order.
     *
     * @param pluginsDir plugins directory; null yields an empty list
     * @return one classloader per JAR that could be opened
     */
    public static List<ClassLoader> open(Path pluginsDir) {
        List<ClassLoader> loaders = new ArrayList<>();
        if (pluginsDir == null) {
            return loaders;
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Community plugins directory does not exist: {}", pluginsDir);
            return loaders;
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Community plugins path is not a directory: {}", pluginsDir);
            return loaders;
        }
        TreeSet<Path> jars = new TreeSet<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar);
            }
        } catch (IOException e) {
            log.warn("Failed to list community plugins directory {}: {}", pluginsDir, e.getMessage());
            return loaders;
        }
        for (Path jar : jars) {
            try {
                URL jarUrl = jar.toUri().toURL();
                loaders.add(new URLClassLoader(new URL[]{jarUrl}, new RestrictedPluginClassLoader()));
                log.info("Opened community plugin JAR: {}", jar.getFileName());
            } catch (IOException | RuntimeException e) {
                log.error("Failed to open community plugin JAR {} (skipping): {}", jar, e.getMessage(), e);
            }
        }
        return loaders;
    }
}
