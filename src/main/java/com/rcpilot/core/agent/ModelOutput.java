package com.rcpilot.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Helpers for the raw text models send back: fenced or prose-wrapped JSON,
 * and prompt-sized excerpts of long inputs.
 */
final class ModelOutput {

    private ModelOutput() {}

    /** Parse the first JSON object in a model response. */
    static JsonNode readObject(ObjectMapper mapper, String raw) throws JsonProcessingException {
        String cleaned = raw == null ? "" : raw.trim();

        // Strip markdown fences
        if (cleaned.startsWith("```")) {
            int start = cleaned.indexOf('\n') + 1;
            int end   = cleaned.lastIndexOf("```");
            if (end > start) cleaned = cleaned.substring(start, end).trim();
        }

        // Skip leading prose to first '{', trailing prose after last '}'
        int jsonStart = cleaned.indexOf('{');
        int jsonEnd   = cleaned.lastIndexOf('}');
        if (jsonStart >= 0 && jsonEnd > jsonStart) {
            cleaned = cleaned.substring(jsonStart, jsonEnd + 1);
        }

        JsonNode root = mapper.readTree(cleaned);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Model response is not a JSON object");
        }
        return root;
    }

    static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode v = node.get(key);
            if (v != null && !v.isNull()) {
                String s = v.asText();
                if (!s.isBlank()) return s;
            }
        }
        return null;
    }

    static String truncate(String text, int maxChars) {
        if (text == null) return "";
        if (text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + "\n[... " + (text.length() - maxChars) + " more chars]";
    }

    static String numbered(String source) {
        String[] lines = source.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            sb.append(String.format("%4d | %s%n", i + 1, lines[i]));
        }
        return sb.toString();
    }
}
