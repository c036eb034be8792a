package com.rcpilot.core.insertion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One annotation to insert: its verbatim text plus an optional placement hint.
 * The text is opaque here; only an embedded function name matters for matching.
 */
public final class AnnotationRequest {

    private final String        text;
    private final InsertionHint hint;   // null = match by embedded function name

    @JsonCreator
    public AnnotationRequest(@JsonProperty("text") String text,
                             @JsonProperty("hint") InsertionHint hint) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Annotation text must not be blank");
        }
        this.text = text.strip();
        this.hint = hint;
    }

    public static AnnotationRequest of(String text) {
        return new AnnotationRequest(text, null);
    }

    public static AnnotationRequest at(String text, InsertionHint hint) {
        return new AnnotationRequest(text, hint);
    }

    public String        getText() { return text; }
    public InsertionHint getHint() { return hint; }

    public boolean hasHint() {
        return hint != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotationRequest)) return false;
        AnnotationRequest that = (AnnotationRequest) o;
        return text.equals(that.text) && Objects.equals(hint, that.hint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, hint);
    }

    @Override
    public String toString() {
        return hint == null ? text : text + " @" + hint;
    }
}
