package com.a2a.framework;

import com.a2a.annotations.A2aPlugin;
import com.a2a.message.ChatMessage;
import com.a2a.message.Messages;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderCalls;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Pass-through: sends the last user text and the full conversation to the provider and returns
 * its reply verbatim.
 */
@A2aPlugin(id = "native", slot = "frameworks", displayName = "Native PassThrough",
        description = "Calls the provider directly with the last user message")
public final class NativeFramework extends AbstractFramework {

    public NativeFramework(Provider provider) {
        super(provider);
    }

    @Override
    public CompletionStage<String> execute(List<ChatMessage> messages) {
        return direct(getProvider(), messages);
    }

    /** Shared direct path, also used by placeholders and degraded frameworks. */
    public static CompletionStage<String> direct(Provider provider, List<ChatMessage> messages) {
        return ProviderCalls.call(provider, Messages.extractLastUserText(messages), messages);
    }
}
