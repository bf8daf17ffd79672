package com.a2a.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/**
 * Factory that never throws. Wraps a raw factory so that a construction exception, a linkage error
 * (e.g. an optional dependency missing at runtime), a null result or an object that does not
 * implement the slot contract all yield a not-ready placeholder instead.
 *
 * @param <A> construction argument
 * @param <T> plugin contract
 */
public final class SafeFactory<A, T> {

    private static final Logger log = LoggerFactory.getLogger(SafeFactory.class);

    private final PluginSlot<A, T> slot;
    private final String fallbackId;
    private final PluginFactory<A, ?> raw;
    private final String failureReason;

    private SafeFactory(PluginSlot<A, T> slot, String fallbackId, PluginFactory<A, ?> raw, String failureReason) {
        this.slot = slot;
        this.fallbackId = fallbackId;
        this.raw = raw;
        this.failureReason = failureReason;
    }

    /**
     * Wraps {@code raw}. Placeholders produced by the wrapper carry {@code fallbackId}.
     */
    public static <A, T> SafeFactory<A, T> wrap(PluginFactory<A, ?> raw, PluginSlot<A, T> slot, String fallbackId) {
        return new SafeFactory<>(Objects.requireNonNull(slot, "slot"), Objects.requireNonNull(fallbackId, "fallbackId"),
                Objects.requireNonNull(raw, "raw"), null);
    }

    /**
     * Factory that always yields a placeholder with the given reason (discovery-time failures).
     */
    public static <A, T> SafeFactory<A, T> failing(PluginSlot<A, T> slot, String fallbackId, String reason) {
        return new SafeFactory<>(Objects.requireNonNull(slot, "slot"), Objects.requireNonNull(fallbackId, "fallbackId"),
                null, reason != null ? reason : "unknown error");
    }

    /**
     * Builds the plugin. Never throws.
     *
     * @param argument construction argument (null for argument-less slots)
     * @return the plugin, or a not-ready placeholder with a diagnostic reason
     */
    public T create(A argument) {
        if (raw == null) {
            return slot.notReady(argument, fallbackId, failureReason);
        }
        Class<T> contract = slot.getContract();
        Object result;
        try {
            result = raw.create(argument);
        } catch (Exception | LinkageError e) {
            String reason = describe(e);
            log.warn("{} plugin {} failed to construct: {}", slot, fallbackId, reason);
            return slot.notReady(argument, fallbackId, reason);
        }
        if (result == null) {
            log.warn("{} plugin {} factory returned null", slot, fallbackId);
            return slot.notReady(argument, fallbackId, "factory returned null, expected " + contract.getSimpleName());
        }
        if (!contract.isInstance(result)) {
            log.warn("{} plugin {} factory returned {}, expected {}", slot, fallbackId, result.getClass().getName(), contract.getName());
            return slot.notReady(argument, fallbackId,
                    "factory returned " + result.getClass().getName() + ", expected " + contract.getSimpleName());
        }
        return contract.cast(result);
    }

    /** Id carried by placeholders from this factory. */
    public String getFallbackId() {
        return fallbackId;
    }

    /**
     * Human-readable text for a failure: the message of the root reflective cause, or its class name
     * when there is no message.
     */
    static String describe(Throwable t) {
        Throwable cause = t;
        while (cause instanceof InvocationTargetException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ExceptionInInitializerError && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getName();
    }
}
