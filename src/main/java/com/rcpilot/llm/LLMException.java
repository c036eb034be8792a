package com.rcpilot.llm;

/** Transport or protocol failure talking to a model back end. */
public class LLMException extends RuntimeException {

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
