package com.rcpilot.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient — LLMClient backed by a local Ollama server.
 *
 * Role → system prompt mapping lives here only; generators send the task prompt.
 */
@Component
@Profile("!mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OllamaLLMClient(
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model,
            ObjectMapper objectMapper
    ) {
        this.baseUrl      = baseUrl;
        this.model        = model;
        this.restTemplate = new RestTemplate();
        this.objectMapper = objectMapper;
    }

    @Override
    public String generateWithRole(AgentRole role, String userPrompt, double temperature) {
        String fullPrompt = getSystemPromptForRole(role) + "\n\n" + userPrompt;
        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, fullPrompt.length());
        return callOllama(fullPrompt, temperature);
    }

    // =========================================================================
    // System prompts
    // =========================================================================

    private String getSystemPromptForRole(AgentRole role) {
        return switch (role) {
            case SPEC_GENERATOR -> """
                    You are an expert in RefinedC, a verification framework for C programs.
                    You write RefinedC specification annotations such as [[rc::parameters(...)]],
                    [[rc::args(...)]], [[rc::requires(...)]], [[rc::returns(...)]],
                    [[rc::ensures(...)]] and loop invariants [[rc::exists(...)]], [[rc::inv_vars(...)]].
                    Output ONLY valid JSON. No prose outside the JSON object.
                    """;

            case LEMMA_GENERATOR -> """
                    You are an expert in Coq and RefinedC.
                    You write helper lemmas that discharge side conditions RefinedC could not solve.
                    Each lemma needs a name, a Coq statement and a proof script.
                    Output ONLY valid JSON. No prose outside the JSON object.
                    """;
        };
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);

        Map<String, Object> body = new HashMap<>();
        body.put("model",   model);
        body.put("prompt",  prompt);
        body.put("options", options);
        body.put("stream",  false);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root   = objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");
            String   result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (RestClientException | IOException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new LLMException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
