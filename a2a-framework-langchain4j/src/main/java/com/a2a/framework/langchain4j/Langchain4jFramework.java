package com.a2a.framework.langchain4j;

import com.a2a.annotations.A2aPlugin;
import com.a2a.framework.AbstractFramework;
import com.a2a.framework.NativeFramework;
import com.a2a.message.ChatMessage;
import com.a2a.message.Messages;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderCalls;
import com.a2a.provider.ProviderExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Framework that routes each request through a one-node LangChain4j AI service whose chat model
 * calls back into the provider. Orchestration runs on the shared bounded pool
 * {@link ProviderExecutors#orchestration()}, never on the caller's thread.
 * <p>
 * When LangChain4j is missing or the service cannot be built, the framework stays ready with a
 * reason and answers like {@link NativeFramework}. A failure while running a request comes back as
 * {@code "[langchain4j error] <details>"}.
 */
@A2aPlugin(id = "langchain4j", slot = "frameworks", displayName = "LangChain4j Framework",
        description = "One-node LangChain4j AI service over the active provider")
public final class Langchain4jFramework extends AbstractFramework {

    private static final Logger log = LoggerFactory.getLogger(Langchain4jFramework.class);

    static final String ERROR_PREFIX = "[langchain4j error] ";
    static final String UNAVAILABLE_PREFIX = "LangChain4j unavailable, falling back to direct calls: ";

    private final AgentAssistant assistant;
    private final Executor executor;
    private final String reason;

    public Langchain4jFramework(Provider provider) {
        this(provider, p -> ProviderChatModel.assistantFor(p), null);
    }

    /** {@code executor} null means the shared orchestration pool. */
    Langchain4jFramework(Provider provider, Function<Provider, AgentAssistant> assistantFactory, Executor executor) {
        super(provider);
        AgentAssistant built = null;
        String why = null;
        try {
            built = assistantFactory.apply(provider);
            if (built == null) {
                why = UNAVAILABLE_PREFIX + "assistant factory returned null";
            }
        } catch (RuntimeException | LinkageError e) {
            why = UNAVAILABLE_PREFIX + ProviderCalls.details(e);
            log.warn("LangChain4j service could not be built; using direct provider calls: {}", ProviderCalls.details(e));
        }
        this.assistant = why == null ? built : null;
        this.reason = why;
        this.executor = executor;
    }

    @Override
    public String getReason() {
        return reason;
    }

    /** Whether requests run through the LangChain4j service rather than direct provider calls. */
    public boolean isOrchestrated() {
        return assistant != null;
    }

    @Override
    public CompletionStage<String> execute(List<ChatMessage> messages) {
        String text = Messages.extractLastUserText(messages);
        // LangChain4j rejects blank user messages
        if (assistant == null || text.isEmpty()) {
            return NativeFramework.direct(getProvider(), messages);
        }
        try {
            Executor pool = executor != null ? executor : ProviderExecutors.orchestration();
            return CompletableFuture.supplyAsync(() -> assistant.reply(text), pool)
                    .exceptionally(Langchain4jFramework::errorReply);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(errorReply(e));
        }
    }

    private static String errorReply(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("LangChain4j request failed: {}", ProviderCalls.details(cause), cause);
        return ERROR_PREFIX + ProviderCalls.details(cause);
    }
}
