package com.rcpilot.core.error;

/** A write the flow depends on (artifact, lemma file, final text) failed. */
public class RepairPersistenceException extends RepairException {

    public RepairPersistenceException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
