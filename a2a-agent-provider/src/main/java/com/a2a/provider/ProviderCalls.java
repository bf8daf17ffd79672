package com.a2a.provider;

import com.a2a.message.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * The one place frameworks call providers. Invokes {@link Provider#generate} exactly once, never
 * blocks the calling thread, and turns every failure (synchronous throw or exceptional completion)
 * into {@code "[framework/provider error] <details>"} text.
 */
public final class ProviderCalls {

    private static final Logger log = LoggerFactory.getLogger(ProviderCalls.class);

    public static final String ERROR_PREFIX = "[framework/provider error] ";

    private ProviderCalls() {
    }

    /**
     * Calls the provider and returns its reply, or a bracket-tagged diagnostic. The returned future
     * never completes exceptionally.
     */
    public static CompletableFuture<String> call(Provider provider, String prompt, List<ChatMessage> messages) {
        return callForOutcome(provider, prompt, messages).thenApply(CallOutcome::text);
    }

    /**
     * Like {@link #call} but keeps whether the call degraded, and why.
     */
    public static CompletableFuture<CallOutcome> callForOutcome(Provider provider, String prompt, List<ChatMessage> messages) {
        String id = provider != null ? provider.getId() : null;
        List<ChatMessage> history = messages != null ? messages : List.of();
        CompletionStage<String> stage;
        try {
            stage = provider.generate(prompt != null ? prompt : "", history);
        } catch (RuntimeException | LinkageError e) {
            return CompletableFuture.completedFuture(degraded(id, e));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(ok(id, ""));
        }
        CompletableFuture<CallOutcome> result = new CompletableFuture<>();
        stage.whenComplete((text, error) -> result.complete(error == null ? ok(id, text) : degraded(id, error)));
        return result;
    }

    private static CallOutcome ok(String providerId, String text) {
        CallOutcome outcome = CallOutcome.ok(text);
        DispatchMetrics.record(providerId, outcome);
        return outcome;
    }

    private static CallOutcome degraded(String providerId, Throwable error) {
        Throwable cause = unwrap(error);
        log.warn("Provider {} call failed: {}", providerId, details(cause), cause);
        CallOutcome outcome = CallOutcome.degraded(ERROR_PREFIX + details(cause), cause);
        DispatchMetrics.record(providerId, outcome);
        return outcome;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Message of {@code t}, or its class name when it has none. */
    public static String details(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getName();
    }
}
