package com.a2a.message;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One part of a multi-part message content: {@code {"type":"text","text":"..."}}.
 * A2A envelopes tag parts with {@code kind} instead of {@code type}; both are accepted.
 * Non-text parts (images, files) keep their tag and have null text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ContentPart {

    public static final String TEXT = "text";

    private final String type;
    private final String text;

    @JsonCreator
    public ContentPart(
            @JsonProperty("type") @JsonAlias("kind") String type,
            @JsonProperty("text") String text) {
        this.type = type;
        this.text = text;
    }

    public static ContentPart text(String text) {
        return new ContentPart(TEXT, text);
    }

    public String getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    @JsonIgnore
    public boolean isText() {
        return TEXT.equals(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentPart)) return false;
        ContentPart that = (ContentPart) o;
        return Objects.equals(type, that.type) && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return "ContentPart{type=" + type + ", text=" + text + "}";
    }
}
