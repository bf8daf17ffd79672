package com.a2a.provider;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts provider calls made through {@link ProviderCalls}: {@code a2a.provider.calls} tagged with
 * {@code provider} and {@code outcome} ("ok" or "degraded"). The registry is a lazily created
 * {@link SimpleMeterRegistry} unless the application binds its own first.
 */
public final class DispatchMetrics {

    public static final String CALLS = "a2a.provider.calls";

    private static final AtomicReference<MeterRegistry> REGISTRY = new AtomicReference<>();

    private DispatchMetrics() {
    }

    /** Uses {@code registry} for all later recordings. */
    public static void bind(MeterRegistry registry) {
        REGISTRY.set(Objects.requireNonNull(registry, "registry"));
    }

    /** Returns the registry in use, creating a simple one on first call. */
    public static MeterRegistry registry() {
        MeterRegistry existing = REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return REGISTRY.get();
    }

    static void record(String providerId, CallOutcome outcome) {
        String provider = providerId != null && !providerId.isBlank() ? providerId : "unknown";
        registry().counter(CALLS, "provider", provider, "outcome", outcome.isOk() ? "ok" : "degraded").increment();
    }

    /** Count recorded so far for one provider and outcome; 0 when none. */
    public static double count(String providerId, CallOutcome.Status status) {
        Counter counter = registry().find(CALLS)
                .tag("provider", providerId)
                .tag("outcome", status == CallOutcome.Status.OK ? "ok" : "degraded")
                .counter();
        return counter != null ? counter.count() : 0;
    }
}
