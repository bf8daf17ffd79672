package com.a2a.provider;

import com.a2a.message.ChatMessage;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Placeholder returned when a provider plugin fails to load or construct, or when nothing is
 * registered. Never throws; replies with a tagged diagnostic.
 */
public final class NotReadyProvider implements Provider {

    private final String id;
    private final String reason;

    public NotReadyProvider(String id, String reason) {
        this.id = id != null && !id.isBlank() ? id : "unknown";
        this.reason = reason != null && !reason.isBlank() ? reason : "Not initialized";
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDisplayName() {
        return id.substring(0, 1).toUpperCase(Locale.ROOT) + id.substring(1);
    }

    @Override
    public boolean isReady() {
        return false;
    }

    @Override
    public String getReason() {
        return reason;
    }

    @Override
    public boolean supportsMessages() {
        return true;
    }

    /** {@code "[<id> not ready: <reason>] You said: <prompt>"}, or {@code "... Hello, World!"} for a blank prompt. */
    @Override
    public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
        String base = prompt == null ? "" : prompt.trim();
        String prefix = "[" + id + " not ready: " + reason + "] ";
        return CompletableFuture.completedFuture(prefix + (base.isEmpty() ? "Hello, World!" : "You said: " + base));
    }

    @Override
    public String toString() {
        return "NotReadyProvider{id='" + id + "', reason='" + reason + "'}";
    }
}
