package com.rcpilot.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.core.error.GenerationException;
import com.rcpilot.core.insertion.AnnotationRequest;
import com.rcpilot.core.insertion.InsertionHint;
import com.rcpilot.core.state.RepairAttempt;
import com.rcpilot.llm.AgentRole;
import com.rcpilot.llm.LLMClient;
import com.rcpilot.llm.LLMException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * SpecGenerator that asks the model for RefinedC annotations as JSON:
 *
 * <pre>
 * { "annotations": [ { "function": "add", "text": "[[rc::returns(...)]]" },
 *                    { "line": 12, "position": "before", "text": "[[rc::inv_vars(...)]]" },
 *                    "[[rc::parameters(...)]]" ],
 *   "explanation": "..." }
 * </pre>
 *
 * "function" or "line" become an insertion hint; bare strings are matched by
 * the function name they contain.
 */
@Component
public class LlmSpecGenerator implements SpecGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmSpecGenerator.class);

    private static final int MAX_ERROR_CHARS   = 4000;
    private static final int MAX_CONTEXT_CHARS = 6000;

    private final LLMClient    llm;
    private final ObjectMapper objectMapper;

    public LlmSpecGenerator(LLMClient llm, ObjectMapper objectMapper) {
        this.llm          = llm;
        this.objectMapper = objectMapper;
    }

    @Override
    public SpecResult generate(SpecRequest request) {
        String prompt = buildPrompt(request);
        log.info("[SpecGenerator] {} for {} (promptLen={})",
                request.isRegeneration() ? "Regenerating" : "Generating", request.getPath(), prompt.length());

        String raw;
        try {
            raw = llm.generateWithRole(AgentRole.SPEC_GENERATOR, prompt,
                    llm.getTemperatureForRole(AgentRole.SPEC_GENERATOR));
        } catch (LLMException e) {
            throw new GenerationException(request.getPath(), "Spec generation failed: " + e.getMessage(), e);
        }

        SpecResult result = parse(request.getPath(), raw);
        if (result.getAnnotations().isEmpty()) {
            log.warn("[SpecGenerator] Model returned no annotations for {}", request.getPath());
        } else {
            log.info("[SpecGenerator] {} annotations for {}", result.getAnnotations().size(), request.getPath());
        }
        return result;
    }

    // =========================================================================
    // PROMPT
    // =========================================================================

    String buildPrompt(SpecRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Write RefinedC specifications for the C file ").append(request.getPath()).append(".\n\n");
        sb.append("SOURCE (line numbers are not part of the file):\n");
        sb.append(ModelOutput.numbered(request.getSourceText())).append("\n");

        if (!request.getRelatedContext().isBlank()) {
            sb.append("RELATED FILES:\n");
            sb.append(ModelOutput.truncate(request.getRelatedContext(), MAX_CONTEXT_CHARS)).append("\n\n");
        }

        if (request.isRegeneration()) {
            sb.append("The previous specifications were rejected. VERIFIER OUTPUT:\n");
            sb.append(ModelOutput.truncate(request.getPriorError(), MAX_ERROR_CHARS)).append("\n\n");

            List<RepairAttempt> history = request.getHistory();
            if (!history.isEmpty()) {
                sb.append("PREVIOUS ATTEMPTS:\n");
                for (RepairAttempt attempt : history) {
                    sb.append(attempt.toPromptSection());
                }
                sb.append("\n");
            }
            sb.append("Return the complete corrected set of annotations, not a diff.\n\n");
        }

        sb.append("""
                Respond with one JSON object:
                {
                  "annotations": [
                    { "function": "<function the annotation belongs to>", "text": "<annotation>" },
                    { "line": <line number>, "position": "before" | "after", "text": "<loop annotation>" }
                  ],
                  "explanation": "<one or two sentences>"
                }
                """);
        return sb.toString();
    }

    // =========================================================================
    // PARSE
    // =========================================================================

    SpecResult parse(String path, String raw) {
        JsonNode root;
        try {
            root = ModelOutput.readObject(objectMapper, raw);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GenerationException(path, "Unparseable spec generator response: " + e.getMessage(), e);
        }

        JsonNode items = root.get("annotations");
        if (items == null || !items.isArray()) {
            throw new GenerationException(path, "Spec generator response has no \"annotations\" array");
        }

        List<AnnotationRequest> annotations = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                if (!item.asText().isBlank()) annotations.add(AnnotationRequest.of(item.asText()));
                continue;
            }
            String text = ModelOutput.text(item, "text", "annotation");
            if (text == null) {
                log.warn("[SpecGenerator] Skipping annotation entry without text: {}", item);
                continue;
            }
            annotations.add(new AnnotationRequest(text, hintOf(item)));
        }

        return new SpecResult(annotations, ModelOutput.text(root, "explanation"));
    }

    private InsertionHint hintOf(JsonNode item) {
        String location = ModelOutput.text(item, "function", "line");
        if (location == null) {
            return null;
        }
        String position = ModelOutput.text(item, "position");
        return "after".equalsIgnoreCase(position)
                ? InsertionHint.after(location)
                : InsertionHint.before(location);
    }
}
