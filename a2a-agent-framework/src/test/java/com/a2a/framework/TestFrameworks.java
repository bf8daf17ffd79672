package com.a2a.framework;

import com.a2a.message.ChatMessage;
import com.a2a.provider.Provider;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Providers and frameworks used by the framework tests.
 */
public final class TestFrameworks {

    private TestFrameworks() {
    }

    /** Echo-style provider: {@code "Hello, you said: <prompt>"}. */
    public static Provider echo() {
        return new Provider() {
            @Override
            public String getId() {
                return "echo";
            }

            @Override
            public boolean isReady() {
                return true;
            }

            @Override
            public CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
                String p = prompt == null ? "" : prompt.trim();
                return CompletableFuture.completedFuture(p.isEmpty() ? "Hello, World!" : "Hello, you said: " + p);
            }
        };
    }

    /** Listed in the test frameworks manifest under "langgraph"; carries no annotation. */
    public static final class UpperCaseFramework extends AbstractFramework {

        public UpperCaseFramework(Provider provider) {
            super(provider);
        }

        @Override
        public CompletionStage<String> execute(List<ChatMessage> messages) {
            return NativeFramework.direct(getProvider(), messages).thenApply(s -> s.toUpperCase(Locale.ROOT));
        }
    }
}
