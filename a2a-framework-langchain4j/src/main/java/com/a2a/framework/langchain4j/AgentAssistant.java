package com.a2a.framework.langchain4j;

import dev.langchain4j.service.UserMessage;

/**
 * One-node LangChain4j AI service: a single user message in, the model's reply out.
 */
public interface AgentAssistant {

    String reply(@UserMessage String text);
}
