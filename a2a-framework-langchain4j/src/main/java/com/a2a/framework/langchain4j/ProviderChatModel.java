package com.a2a.framework.langchain4j;

import com.a2a.message.ChatMessage;
import com.a2a.provider.Provider;
import com.a2a.provider.ProviderCalls;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.service.AiServices;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LangChain4j {@link ChatModel} backed by an A2A {@link Provider}. Each chat request becomes one
 * provider call through {@link ProviderCalls}; the calling orchestration thread waits for it while
 * the provider runs on its own pool or client threads.
 */
final class ProviderChatModel implements ChatModel {

    private final Provider provider;

    ProviderChatModel(Provider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    /** Builds the one-node AI service over {@code provider}. Throws a linkage error when LangChain4j is absent. */
    static AgentAssistant assistantFor(Provider provider) {
        return AiServices.create(AgentAssistant.class, new ProviderChatModel(provider));
    }

    @Override
    public ChatResponse doChat(ChatRequest chatRequest) {
        List<ChatMessage> history = toMessages(chatRequest.messages());
        String prompt = "";
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).isUser()) {
                prompt = history.get(i).getText();
                break;
            }
        }
        String reply = ProviderCalls.call(provider, prompt, history).join();
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(reply))
                .build();
    }

    static List<ChatMessage> toMessages(List<dev.langchain4j.data.message.ChatMessage> messages) {
        List<ChatMessage> out = new ArrayList<>();
        if (messages == null) {
            return out;
        }
        for (dev.langchain4j.data.message.ChatMessage m : messages) {
            if (m instanceof UserMessage) {
                UserMessage user = (UserMessage) m;
                out.add(ChatMessage.user(user.hasSingleText() ? user.singleText() : ""));
            } else if (m instanceof AiMessage) {
                String text = ((AiMessage) m).text();
                out.add(ChatMessage.assistant(text != null ? text : ""));
            } else if (m instanceof SystemMessage) {
                out.add(ChatMessage.of(ChatMessage.ROLE_SYSTEM, ((SystemMessage) m).text()));
            }
        }
        return out;
    }
}
