package com.rcpilot.core.agent;

/**
 * Produces helper lemmas for the side conditions in the last verifier output.
 *
 * @throws com.rcpilot.core.error.GenerationException when no usable answer could be produced
 */
public interface LemmaGenerator {

    LemmaResult generate(LemmaRequest request);
}
