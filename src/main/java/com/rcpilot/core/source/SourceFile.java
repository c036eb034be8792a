package com.rcpilot.core.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SourceFile — one discovered C file and its annotated working copy.
 *
 * {@code originalText} is the immutable baseline read from disk. {@code text} is
 * the live content the owning repair flow mutates: always the original lines plus
 * inserted annotation lines, never reordered.
 *
 * Owned by exactly one repair flow at a time. Not thread-safe.
 */
public class SourceFile {

    private final String path;
    private final String originalText;
    private String text;

    // annotation text → 1-based line it landed on in the current text
    private final Map<String, Integer> annotationLocations = new LinkedHashMap<>();

    public SourceFile(String path, String originalText) {
        this.path         = path;
        this.originalText = originalText != null ? originalText : "";
        this.text         = this.originalText;
    }

    public String getPath()         { return path; }
    public String getOriginalText() { return originalText; }
    public String getText()         { return text; }

    public void setText(String text) {
        this.text = text != null ? text : "";
    }

    public boolean isModified() {
        return !text.equals(originalText);
    }

    /** Drops the working copy back to the baseline, forgetting recorded locations. */
    public void resetToOriginal() {
        this.text = originalText;
        annotationLocations.clear();
    }

    public void recordAnnotationLocations(Map<String, Integer> locations) {
        annotationLocations.clear();
        annotationLocations.putAll(locations);
    }

    public Map<String, Integer> getAnnotationLocations() {
        return Collections.unmodifiableMap(annotationLocations);
    }

    /** Name without directory and extension, e.g. {@code fib} for {@code src/fib.c}. */
    public String getStem() {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public String toString() {
        return "SourceFile{path=" + path + ", modified=" + isModified() + "}";
    }
}
