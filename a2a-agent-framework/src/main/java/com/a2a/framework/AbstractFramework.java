package com.a2a.framework;

import com.a2a.annotations.A2aPlugin;
import com.a2a.provider.Provider;

import java.util.Objects;

/**
 * Base for framework plugins: holds the provider and takes id and display name from
 * {@link A2aPlugin} when present. Unannotated frameworks report the id they were registered
 * under, falling back to the simple class name.
 */
public abstract class AbstractFramework implements Framework {

    private final Provider provider;
    private volatile String registeredId;

    protected AbstractFramework(Provider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public final Provider getProvider() {
        return provider;
    }

    @Override
    public String getId() {
        A2aPlugin meta = getClass().getAnnotation(A2aPlugin.class);
        if (meta != null) {
            return meta.id();
        }
        String id = registeredId;
        return id != null ? id : getClass().getSimpleName();
    }

    /** Records the catalog id this instance was built for; set once by {@link FrameworkRegistry}. */
    void registeredAs(String id) {
        if (registeredId == null) {
            registeredId = id;
        }
    }

    @Override
    public String getDisplayName() {
        A2aPlugin meta = getClass().getAnnotation(A2aPlugin.class);
        return meta != null && !meta.displayName().isEmpty() ? meta.displayName() : getId();
    }

    @Override
    public boolean isReady() {
        return true;
    }
}
