package com.rcpilot.llm;

/** Which generator is talking to the model. Drives system prompt and temperature. */
public enum AgentRole {
    SPEC_GENERATOR,
    LEMMA_GENERATOR
}
