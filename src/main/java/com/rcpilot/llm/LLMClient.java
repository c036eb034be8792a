package com.rcpilot.llm;

/**
 * LLMClient — single interface for all model calls.
 *
 * Implementations only provide generateWithRole(). Canonical per-role
 * temperatures live in getTemperatureForRole() so generators do not hardcode them.
 */
public interface LLMClient {

    /**
     * @param role        generator role, selects the system prompt
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature (0.0 = deterministic)
     * @return raw model text, never null
     */
    String generateWithRole(AgentRole role, String userPrompt, double temperature);

    /**
     * SPEC_GENERATOR  0.2 — structured JSON, low variance
     * LEMMA_GENERATOR 0.3 — proof search benefits from some variance
     */
    default double getTemperatureForRole(AgentRole role) {
        return switch (role) {
            case SPEC_GENERATOR  -> 0.2;
            case LEMMA_GENERATOR -> 0.3;
        };
    }
}
