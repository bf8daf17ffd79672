package com.a2a.provider.echo;

import com.a2a.message.ChatMessage;
import com.a2a.provider.ProviderCalls;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoProviderTest {

    private final EchoProvider provider = new EchoProvider();

    @Test
    void generate_echoesPrompt() {
        assertEquals("Hello, you said: ping", provider.generate("ping", List.of()).toCompletableFuture().join());
    }

    @Test
    void generate_emptyPromptSaysHello() {
        assertEquals("Hello, World!", provider.generate("", List.of()).toCompletableFuture().join());
        assertEquals("Hello, World!", provider.generate("   ", List.of()).toCompletableFuture().join());
        assertEquals("Hello, World!", provider.generate(null, null).toCompletableFuture().join());
    }

    @Test
    void isAlwaysReady() {
        assertTrue(provider.isReady());
        assertEquals("echo", provider.getId());
    }

    @Test
    void throughShim_returnsSameText() {
        assertEquals("Hello, you said: hi",
                ProviderCalls.call(provider, "hi", List.of(ChatMessage.user("hi"))).join());
    }
}
