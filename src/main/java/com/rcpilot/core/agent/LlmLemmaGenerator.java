package com.rcpilot.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.core.error.GenerationException;
import com.rcpilot.core.lemma.HelperLemma;
import com.rcpilot.llm.AgentRole;
import com.rcpilot.llm.LLMClient;
import com.rcpilot.llm.LLMException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * LemmaGenerator that asks the model for Coq helper lemmas as JSON:
 *
 * <pre>
 * { "lemmas":  [ { "name": "...", "statement": "...", "proof": "...", "dependencies": [] } ],
 *   "imports": [ "Coq.micromega.Lia" ] }
 * </pre>
 */
@Component
public class LlmLemmaGenerator implements LemmaGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmLemmaGenerator.class);

    private static final int MAX_ERROR_CHARS = 4000;

    private final LLMClient    llm;
    private final ObjectMapper objectMapper;

    public LlmLemmaGenerator(LLMClient llm, ObjectMapper objectMapper) {
        this.llm          = llm;
        this.objectMapper = objectMapper;
    }

    @Override
    public LemmaResult generate(LemmaRequest request) {
        String prompt = buildPrompt(request);
        log.info("[LemmaGenerator] Generating lemmas for {} ({} existing)",
                request.getPath(), request.getExistingLemmas().size());

        String raw;
        try {
            raw = llm.generateWithRole(AgentRole.LEMMA_GENERATOR, prompt,
                    llm.getTemperatureForRole(AgentRole.LEMMA_GENERATOR));
        } catch (LLMException e) {
            throw new GenerationException(request.getPath(), "Lemma generation failed: " + e.getMessage(), e);
        }
        return parse(request.getPath(), raw);
    }

    String buildPrompt(LemmaRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("RefinedC could not solve side conditions in ").append(request.getPath()).append(".\n\n");
        sb.append("SOURCE:\n").append(ModelOutput.numbered(request.getSourceText())).append("\n");
        sb.append("VERIFIER OUTPUT:\n")
          .append(ModelOutput.truncate(request.getLastError(), MAX_ERROR_CHARS)).append("\n\n");

        if (!request.getExistingLemmas().isEmpty()) {
            sb.append("EXISTING LEMMAS (already available, do not repeat them):\n");
            for (HelperLemma lemma : request.getExistingLemmas()) {
                sb.append("  Lemma ").append(lemma.getName()).append(": ")
                  .append(lemma.getStatement()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("""
                Respond with one JSON object:
                {
                  "lemmas": [
                    { "name": "<identifier>", "statement": "<Coq proposition>",
                      "proof": "<tactic script, empty if unknown>", "dependencies": ["<lemma name>"] }
                  ],
                  "imports": ["<Coq module>"]
                }
                """);
        return sb.toString();
    }

    LemmaResult parse(String path, String raw) {
        JsonNode root;
        try {
            root = ModelOutput.readObject(objectMapper, raw);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GenerationException(path, "Unparseable lemma generator response: " + e.getMessage(), e);
        }

        List<HelperLemma> lemmas = new ArrayList<>();
        JsonNode items = root.get("lemmas");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                String name      = ModelOutput.text(item, "name");
                String statement = ModelOutput.text(item, "statement");
                if (name == null || statement == null) {
                    log.warn("[LemmaGenerator] Skipping incomplete lemma entry: {}", item);
                    continue;
                }
                List<String> deps = new ArrayList<>();
                JsonNode depNode = item.get("dependencies");
                if (depNode != null && depNode.isArray()) {
                    depNode.forEach(d -> deps.add(d.asText()));
                }
                lemmas.add(new HelperLemma(name, statement, ModelOutput.text(item, "proof", "proofBody"), deps));
            }
        }

        List<String> imports = new ArrayList<>();
        JsonNode importNode = root.get("imports");
        if (importNode != null && importNode.isArray()) {
            importNode.forEach(i -> imports.add(i.asText()));
        }

        log.info("[LemmaGenerator] {} lemmas, {} imports for {}", lemmas.size(), imports.size(), path);
        return new LemmaResult(lemmas, imports);
    }
}
