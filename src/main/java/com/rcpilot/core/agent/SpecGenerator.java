package com.rcpilot.core.agent;

/**
 * Produces specification annotations for one C file.
 *
 * @throws com.rcpilot.core.error.GenerationException when no usable answer could be produced
 */
public interface SpecGenerator {

    SpecResult generate(SpecRequest request);
}
