package com.a2a.plugin;

/**
 * Restricted parent classloader for community plugin JARs. Exposes only the JDK, the public plugin
 * API packages and the logging/JSON libraries those APIs expose; all other requests throw
 * {@link ClassNotFoundException}. Requests made through reflection go through this loader as well.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code jakarta.*}, {@code com.a2a.plugin.*},
 * {@code com.a2a.provider.*}, {@code com.a2a.framework.*}, {@code com.a2a.message.*},
 * {@code com.a2a.annotations.*}, {@code com.a2a.config.*}, {@code org.slf4j.*},
 * {@code com.fasterxml.jackson.*}
 * <p>
 * <b>Denied:</b> {@code com.a2a.bootstrap.*}, {@code com.a2a.internal.*} and every other package.
 * A denied class referenced by an extension shows up as an "Import error" placeholder.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "jakarta.",
            "com.a2a.plugin.",
            "com.a2a.provider.",
            "com.a2a.framework.",
            "com.a2a.message.",
            "com.a2a.annotations.",
            "com.a2a.config.",
            "org.slf4j.",
            "com.fasterxml.jackson."
    };

    private final ClassLoader kernelLoader;

    /**
     * Creates a restricted classloader with no parent. Delegates to the loader that loaded
     * {@link PluginSlot} only for allowed package prefixes.
     */
    public RestrictedPluginClassLoader() {
        this(PluginSlot.class.getClassLoader());
    }

    RestrictedPluginClassLoader(ClassLoader kernelLoader) {
        super(null);
        this.kernelLoader = kernelLoader;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = kernelLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (community plugins may only use the JDK, the com.a2a plugin API packages, org.slf4j and com.fasterxml.jackson)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
