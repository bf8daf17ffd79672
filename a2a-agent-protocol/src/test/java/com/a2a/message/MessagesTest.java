package com.a2a.message;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessagesTest {

    @Test
    void extractLastUserText_returnsLatestUserMessage() {
        List<ChatMessage> messages = List.of(
                ChatMessage.assistant("x"),
                ChatMessage.user("y"));

        assertEquals("y", Messages.extractLastUserText(messages));
    }

    @Test
    void extractLastUserText_emptyListReturnsEmptyString() {
        assertEquals("", Messages.extractLastUserText(List.of()));
        assertEquals("", Messages.extractLastUserText(null));
    }

    @Test
    void extractLastUserText_onlyNonUserRolesReturnsEmptyString() {
        List<ChatMessage> messages = List.of(
                ChatMessage.of(ChatMessage.ROLE_SYSTEM, "be nice"),
                ChatMessage.assistant("hello"));

        assertEquals("", Messages.extractLastUserText(messages));
    }

    @Test
    void extractLastUserText_trimsStringContent() {
        assertEquals("ping", Messages.extractLastUserText(List.of(ChatMessage.user("  ping \n"))));
    }

    @Test
    void extractLastUserText_usesFirstTextPart() {
        ChatMessage m = ChatMessage.ofParts(ChatMessage.ROLE_USER, List.of(
                new ContentPart("image_url", null),
                ContentPart.text("from parts"),
                ContentPart.text("second")));

        assertEquals("from parts", Messages.extractLastUserText(List.of(m)));
    }

    @Test
    void extractLastUserText_skipsUserMessagesWithoutTextAndKeepsScanning() {
        List<ChatMessage> messages = List.of(
                ChatMessage.user("older question"),
                ChatMessage.assistant("answer"),
                ChatMessage.ofParts(ChatMessage.ROLE_USER, List.of(new ContentPart("image_url", null))),
                ChatMessage.user("   "));

        assertEquals("older question", Messages.extractLastUserText(messages));
    }

    @Test
    void extractLastUserText_toleratesNullEntries() {
        assertEquals("y", Messages.extractLastUserText(Arrays.asList(ChatMessage.user("y"), null)));
    }

    @Test
    void promptOrLastUserText_prefersPromptThenMessagesThenFallback() {
        List<ChatMessage> messages = List.of(ChatMessage.user("from history"));

        assertEquals("direct", Messages.promptOrLastUserText(" direct ", messages, "Say hello."));
        assertEquals("from history", Messages.promptOrLastUserText("", messages, "Say hello."));
        assertEquals("Say hello.", Messages.promptOrLastUserText(null, List.of(), "Say hello."));
    }
}
