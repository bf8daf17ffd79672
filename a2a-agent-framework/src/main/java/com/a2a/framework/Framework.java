package com.a2a.framework;

import com.a2a.message.ChatMessage;
import com.a2a.provider.Provider;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Orchestration strategy wrapping exactly one {@link Provider}, fixed at construction.
 * {@link #execute} never completes exceptionally for plugin or backend failures; those come back as
 * bracket-tagged text.
 */
public interface Framework {

    String getId();

    default String getDisplayName() {
        return getId();
    }

    boolean isReady();

    /** Diagnostic text; non-null when not ready, may also be set on a ready but degraded framework. */
    default String getReason() {
        return null;
    }

    Provider getProvider();

    /**
     * Produces the reply for a conversation.
     *
     * @param messages conversation, oldest first
     */
    CompletionStage<String> execute(List<ChatMessage> messages);
}
