package com.a2a.provider;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one provider call through {@link ProviderCalls#callForOutcome}. A degraded outcome
 * still renders the same plain text a caller of {@link ProviderCalls#call} would get, and also keeps
 * the failure for callers that want to tell the two apart.
 */
public final class CallOutcome {

    public enum Status {
        OK,
        DEGRADED
    }

    private final Status status;
    private final String text;
    private final Throwable cause;

    private CallOutcome(Status status, String text, Throwable cause) {
        this.status = status;
        this.text = text;
        this.cause = cause;
    }

    public static CallOutcome ok(String text) {
        return new CallOutcome(Status.OK, text != null ? text : "", null);
    }

    public static CallOutcome degraded(String text, Throwable cause) {
        return new CallOutcome(Status.DEGRADED, Objects.requireNonNull(text, "text"), cause);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /** Reply text, or the bracket-tagged diagnostic for a degraded call. */
    public String text() {
        return text;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return status + ": " + text;
    }
}
