package com.a2a.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conversation message {@code {role, content}} where content is either a plain string or a list of
 * {@link ContentPart}s. Deserialization is lenient: a missing content, a JSON string, an array of
 * strings or part objects, and the A2A {@code parts} field are all accepted; anything else becomes
 * empty content rather than an error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ChatMessage {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";

    private final String role;
    /** Plain string content; null when the content is a part list. */
    private final String text;
    private final List<ContentPart> parts;

    private ChatMessage(String role, String text, List<ContentPart> parts) {
        this.role = role;
        this.text = text;
        this.parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static ChatMessage of(String role, String text) {
        return new ChatMessage(role, text != null ? text : "", null);
    }

    public static ChatMessage ofParts(String role, List<ContentPart> parts) {
        return new ChatMessage(role, null, Objects.requireNonNull(parts, "parts"));
    }

    public static ChatMessage user(String text) {
        return of(ROLE_USER, text);
    }

    public static ChatMessage assistant(String text) {
        return of(ROLE_ASSISTANT, text);
    }

    /** Used when the payload is a JSON object (chat-completions or A2A message). */
    @JsonCreator
    public static ChatMessage fromJson(
            @JsonProperty("role") String role,
            @JsonProperty("content") JsonNode content,
            @JsonProperty("parts") JsonNode parts) {
        JsonNode body = content != null && !content.isNull() && !content.isMissingNode() ? content : parts;
        if (body == null || body.isNull() || body.isMissingNode()) {
            return of(role, "");
        }
        if (body.isTextual()) {
            return of(role, body.asText());
        }
        if (body.isArray()) {
            List<ContentPart> out = new ArrayList<>();
            for (JsonNode item : body) {
                if (item.isTextual()) {
                    out.add(ContentPart.text(item.asText()));
                } else if (item.isObject()) {
                    JsonNode tag = item.hasNonNull("type") ? item.get("type") : item.get("kind");
                    JsonNode t = item.get("text");
                    out.add(new ContentPart(tag != null ? tag.asText() : null,
                            t != null && t.isTextual() ? t.asText() : null));
                }
            }
            return ofParts(role, out);
        }
        return of(role, "");
    }

    public String getRole() {
        return role;
    }

    /** Content for serialization: the string, or the part list. */
    @JsonProperty("content")
    public Object getContent() {
        return text != null ? text : parts;
    }

    /** Plain string content, or null when the content is a part list. */
    @JsonIgnore
    public String getText() {
        return text;
    }

    @JsonIgnore
    public List<ContentPart> getParts() {
        return parts;
    }

    @JsonIgnore
    public boolean hasTextContent() {
        return text != null;
    }

    @JsonIgnore
    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessage)) return false;
        ChatMessage that = (ChatMessage) o;
        return Objects.equals(role, that.role) && Objects.equals(text, that.text) && parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, text, parts);
    }

    @Override
    public String toString() {
        return "ChatMessage{role=" + role + ", content=" + getContent() + "}";
    }
}
