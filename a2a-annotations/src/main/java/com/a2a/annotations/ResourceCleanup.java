package com.a2a.annotations;

/**
 * Contract for resource cleanup when the agent is shutting down.
 * Providers and frameworks that hold resources (HTTP clients, thread pools) implement this and
 * release them in {@link #onExit()}. The bootstrap invokes {@code onExit()} on the active provider
 * and framework before the process exits.
 */
public interface ResourceCleanup {

    /**
     * Called once on shutdown. Exceptions should be logged and not rethrown so other components
     * still get a chance to clean up.
     */
    void onExit();
}
