package com.a2a.plugin;

import com.a2a.annotations.A2aPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Discovers the plugins of one slot. Sources, in override order:
 * <ol>
 *   <li>the builtin registration table (explicit {@code (id, factory)} pairs, or classes carrying
 *       {@link A2aPlugin}, or class names resolved lazily so an optional dependency may be absent)</li>
 *   <li>extension manifests {@code META-INF/a2a/<slot>.properties} on the class path, then in each
 *       community JAR loader; an extension overrides a builtin with the same id and later extensions
 *       override earlier ones</li>
 * </ol>
 * Each candidate class is inspected in priority order: a {@link PluginFactory} implementation is
 * instantiated and its {@code create} used; a class implementing the slot contract is constructed
 * directly (no-arg constructor, or a constructor taking the slot argument type); anything else
 * becomes a stub producing a placeholder. Class loading and reflection failures become factories
 * that always return an "Import error" placeholder. Discovery never throws.
 *
 * @param <A> construction argument
 * @param <T> plugin contract
 */
public final class PluginLocator<A, T> {

    private static final Logger log = LoggerFactory.getLogger(PluginLocator.class);

    private final PluginSlot<A, T> slot;
    private final Map<String, Builtin<A>> builtins;
    private final List<ClassLoader> extensionLoaders;

    private PluginLocator(PluginSlot<A, T> slot, Map<String, Builtin<A>> builtins, List<ClassLoader> extensionLoaders) {
        this.slot = slot;
        this.builtins = Collections.unmodifiableMap(new LinkedHashMap<>(builtins));
        this.extensionLoaders = Collections.unmodifiableList(new ArrayList<>(extensionLoaders));
    }

    public static <A, T> Builder<A, T> builder(PluginSlot<A, T> slot) {
        return new Builder<>(slot);
    }

    public PluginSlot<A, T> getSlot() {
        return slot;
    }

    /**
     * Full discovery: inspects every candidate and wraps its factory. Plugins are not constructed.
     */
    public PluginCatalog<A, T> locate() {
        Map<String, PluginEntry<A, T>> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Builtin<A>> e : builtins.entrySet()) {
            String id = e.getKey();
            entries.put(id, new PluginEntry<>(id, PluginSource.BUILTIN, inspectBuiltin(id, e.getValue())));
        }
        int extensions = 0;
        for (ExtensionManifest.Entry ext : readManifests()) {
            PluginEntry<A, T> previous = entries.get(ext.getId());
            if (previous != null) {
                log.info("{} extension '{}' from {} overrides {} entry", slot, ext.getId(), ext.getOrigin(),
                        previous.getSource().getTag());
            }
            entries.put(ext.getId(), new PluginEntry<>(ext.getId(), PluginSource.EXTENSION,
                    inspectClassName(ext.getId(), ext.getClassName(), ext.getLoader())));
            extensions++;
        }
        log.info("{}: {} plugin(s) located ({} builtin, {} extension entries): {}", slot, entries.size(),
                builtins.size(), extensions, entries.keySet());
        return new PluginCatalog<>(slot, entries);
    }

    /**
     * Metadata-only scan: id to source, following the same override rules as {@link #locate()}.
     * Re-reads the manifests on every call; never loads a plugin class or invokes a factory.
     */
    public Map<String, PluginSource> describe() {
        Map<String, PluginSource> out = new LinkedHashMap<>();
        for (String id : builtins.keySet()) {
            out.put(id, PluginSource.BUILTIN);
        }
        for (ExtensionManifest.Entry ext : readManifests()) {
            out.put(ext.getId(), PluginSource.EXTENSION);
        }
        return out;
    }

    private List<ExtensionManifest.Entry> readManifests() {
        List<ExtensionManifest.Entry> out = new ArrayList<>();
        for (ClassLoader loader : extensionLoaders) {
            out.addAll(ExtensionManifest.read(slot.manifestResource(), loader));
        }
        return out;
    }

    private SafeFactory<A, T> inspectBuiltin(String id, Builtin<A> builtin) {
        if (builtin.factory != null) {
            return SafeFactory.wrap(builtin.factory, slot, id);
        }
        if (builtin.pluginClass != null) {
            return inspectClass(id, builtin.pluginClass);
        }
        return inspectClassName(id, builtin.className, builtin.loader);
    }

    private SafeFactory<A, T> inspectClassName(String id, String className, ClassLoader loader) {
        Class<?> cls;
        try {
            cls = Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            return importError(id, e);
        }
        return inspectClass(id, cls);
    }

    @SuppressWarnings("unchecked")
    private SafeFactory<A, T> inspectClass(String id, Class<?> cls) {
        try {
            if (PluginFactory.class.isAssignableFrom(cls) && isConcrete(cls)) {
                Constructor<?> ctor = cls.getConstructor();
                return SafeFactory.wrap(argument -> ((PluginFactory<A, ?>) ctor.newInstance()).create(argument), slot, id);
            }
            if (slot.getContract().isAssignableFrom(cls) && isConcrete(cls)) {
                if (slot.takesNoArgument()) {
                    Constructor<?> ctor = cls.getConstructor();
                    return SafeFactory.wrap(argument -> ctor.newInstance(), slot, id);
                }
                Constructor<?> ctor = cls.getConstructor(slot.getArgumentType());
                return SafeFactory.wrap(argument -> ctor.newInstance(argument), slot, id);
            }
        } catch (NoSuchMethodException e) {
            String reason = "Module did not expose a valid " + contractName() + " class or factory: "
                    + cls.getName() + " has no public " + constructorShape() + " constructor";
            log.warn("{} plugin '{}': {}", slot, id, reason);
            return SafeFactory.failing(slot, id, reason);
        } catch (SecurityException | LinkageError e) {
            return importError(id, e);
        }
        String reason = "Module did not expose a valid " + contractName() + " class or factory";
        log.warn("{} plugin '{}' ({}): {}", slot, id, cls.getName(), reason);
        return SafeFactory.failing(slot, id, reason);
    }

    private SafeFactory<A, T> importError(String id, Throwable e) {
        String reason = "Import error: " + SafeFactory.describe(e);
        log.warn("{} plugin '{}' could not be loaded: {}", slot, id, reason);
        return SafeFactory.failing(slot, id, reason);
    }

    private String contractName() {
        return slot.getContract().getSimpleName();
    }

    private String constructorShape() {
        return slot.takesNoArgument() ? "no-arg" : "(" + slot.getArgumentType().getSimpleName() + ")";
    }

    private static boolean isConcrete(Class<?> cls) {
        return !cls.isInterface() && !Modifier.isAbstract(cls.getModifiers());
    }

    /** One row of the builtin table; exactly one of factory, pluginClass or className is set. */
    private static final class Builtin<A> {

        private final PluginFactory<A, ?> factory;
        private final Class<?> pluginClass;
        private final String className;
        private final ClassLoader loader;

        private Builtin(PluginFactory<A, ?> factory, Class<?> pluginClass, String className, ClassLoader loader) {
            this.factory = factory;
            this.pluginClass = pluginClass;
            this.className = className;
            this.loader = loader;
        }
    }

    public static final class Builder<A, T> {

        private final PluginSlot<A, T> slot;
        private final Map<String, Builtin<A>> builtins = new LinkedHashMap<>();
        private final List<ClassLoader> extensionLoaders = new ArrayList<>();
        private boolean classPathExtensions = true;
        private ClassLoader classPathLoader = PluginLocator.class.getClassLoader();

        private Builder(PluginSlot<A, T> slot) {
            this.slot = Objects.requireNonNull(slot, "slot");
        }

        /** Registers a builtin factory under {@code id}. */
        public Builder<A, T> builtin(String id, PluginFactory<A, ? extends T> factory) {
            Objects.requireNonNull(factory, "factory");
            builtins.put(requireId(id), new Builtin<>(factory, null, null, null));
            return this;
        }

        /**
         * Registers a builtin plugin class; the id comes from its {@link A2aPlugin} annotation.
         *
         * @throws IllegalArgumentException when the annotation is missing or names another slot
         */
        public Builder<A, T> builtin(Class<?> pluginClass) {
            Objects.requireNonNull(pluginClass, "pluginClass");
            A2aPlugin meta = pluginClass.getAnnotation(A2aPlugin.class);
            if (meta == null) {
                throw new IllegalArgumentException(pluginClass.getName() + " is not annotated with @A2aPlugin");
            }
            if (!slot.getName().equals(meta.slot())) {
                throw new IllegalArgumentException(pluginClass.getName() + " belongs to slot '" + meta.slot()
                        + "', not '" + slot.getName() + "'");
            }
            builtins.put(requireId(meta.id()), new Builtin<>(null, pluginClass, null, null));
            return this;
        }

        /**
         * Registers a builtin by class name, loaded at discovery time with {@code loader}. Use for
         * builtins whose optional dependencies may be missing at runtime.
         */
        public Builder<A, T> builtin(String id, String className, ClassLoader loader) {
            Objects.requireNonNull(className, "className");
            Objects.requireNonNull(loader, "loader");
            builtins.put(requireId(id), new Builtin<>(null, null, className, loader));
            return this;
        }

        /** Class loader searched for extension manifests on the class path. */
        public Builder<A, T> classPathLoader(ClassLoader loader) {
            this.classPathLoader = Objects.requireNonNull(loader, "loader");
            return this;
        }

        /** Disables the class-path manifest scan (tests, embedded use). */
        public Builder<A, T> withoutClassPathExtensions() {
            this.classPathExtensions = false;
            return this;
        }

        /**
         * Adds a loader searched for manifests after the class path, e.g. one returned by
         * {@link CommunityPlugins#open(java.nio.file.Path)}.
         */
        public Builder<A, T> extensionLoader(ClassLoader loader) {
            extensionLoaders.add(Objects.requireNonNull(loader, "loader"));
            return this;
        }

        public PluginLocator<A, T> build() {
            List<ClassLoader> loaders = new ArrayList<>();
            if (classPathExtensions) {
                loaders.add(classPathLoader);
            }
            loaders.addAll(extensionLoaders);
            return new PluginLocator<>(slot, builtins, loaders);
        }

        private static String requireId(String id) {
            String normalized = AliasTable.normalize(id);
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("Plugin id must be non-blank");
            }
            return normalized;
        }
    }
}
