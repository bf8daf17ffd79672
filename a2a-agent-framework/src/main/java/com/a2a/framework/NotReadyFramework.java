package com.a2a.framework;

import com.a2a.message.ChatMessage;
import com.a2a.provider.Provider;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionStage;

/**
 * Placeholder returned when a framework plugin fails to load or construct. Reports not ready and
 * still answers by calling its provider directly.
 */
public final class NotReadyFramework extends AbstractFramework {

    private final String id;
    private final String reason;

    public NotReadyFramework(Provider provider, String id, String reason) {
        super(provider);
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
    public CompletionStage<String> execute(List<ChatMessage> messages) {
        return NativeFramework.direct(getProvider(), messages);
    }

    @Override
    public String toString() {
        return "NotReadyFramework{id='" + id + "', reason='" + reason + "'}";
    }
}
