package com.a2a.provider;

import com.a2a.message.ChatMessage;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Base class for backends whose client blocks. {@link #generate} submits exactly one
 * {@link #generateBlocking} call to a bounded pool and returns immediately, so a slow backend never
 * stalls the caller's thread.
 */
public abstract class BlockingProvider implements Provider {

    private final Executor executor;

    /** Runs blocking calls on {@link ProviderExecutors#shared()}. */
    protected BlockingProvider() {
        this.executor = null;
    }

    protected BlockingProvider(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Performs the blocking generation on a pool thread. May throw; the failure completes the
     * returned stage exceptionally.
     */
    protected abstract String generateBlocking(String prompt, List<ChatMessage> messages) throws Exception;

    @Override
    public final CompletionStage<String> generate(String prompt, List<ChatMessage> messages) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return generateBlocking(prompt, messages);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor != null ? executor : ProviderExecutors.shared());
    }
}
