package com.rcpilot.core.error;

/**
 * A spec or lemma generator could not produce a usable answer (transport
 * failure, unparseable model output). Distinct from a verification failure.
 */
public class GenerationException extends RepairException {

    public GenerationException(String path, String message) {
        super(path, message);
    }

    public GenerationException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
