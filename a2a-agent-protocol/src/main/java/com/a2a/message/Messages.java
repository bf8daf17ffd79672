package com.a2a.message;

import java.util.List;
import java.util.ListIterator;

/**
 * Best-effort helpers over a conversation. Nothing here validates or throws; messages from any of
 * the inbound wire shapes are accepted.
 */
public final class Messages {

    private Messages() {
    }

    /**
     * Returns the latest user text. Scans newest to oldest; for the first message with role
     * {@code user}, string content is returned trimmed if non-blank, and part content yields its
     * first non-blank {@code text} part. Messages that yield nothing are skipped.
     *
     * @param messages conversation, oldest first; may be null
     * @return trimmed user text, or "" when there is none
     */
    public static String extractLastUserText(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "";
        }
        ListIterator<ChatMessage> it = messages.listIterator(messages.size());
        while (it.hasPrevious()) {
            ChatMessage m = it.previous();
            if (m == null || !m.isUser()) continue;
            if (m.hasTextContent()) {
                if (!m.getText().isBlank()) {
                    return m.getText().trim();
                }
                continue;
            }
            for (ContentPart part : m.getParts()) {
                if (part != null && part.isText() && part.getText() != null && !part.getText().isBlank()) {
                    return part.getText().trim();
                }
            }
        }
        return "";
    }

    /**
     * Prompt used by prompt-only backends: the trimmed prompt, else the latest user text, else
     * {@code fallback}.
     */
    public static String promptOrLastUserText(String prompt, List<ChatMessage> messages, String fallback) {
        String p = prompt != null ? prompt.trim() : "";
        if (!p.isEmpty()) {
            return p;
        }
        String fromMessages = extractLastUserText(messages);
        return !fromMessages.isEmpty() ? fromMessages : fallback;
    }
}
