package com.rcpilot.core.error;

import com.rcpilot.core.state.RepairState;

/**
 * Base for every failure that ends a repair flow. Verification failures are
 * not exceptions; they are ordinary results that drive the retry policy.
 *
 * A flow that fails after it started carries its in-flight state, so the
 * iterations it spent survive into the next resumed run.
 */
public class RepairException extends RuntimeException {

    private final String path;
    private transient RepairState resumableState;

    public RepairException(String path, String message) {
        super(message);
        this.path = path;
    }

    public RepairException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** Logical path of the file whose flow failed, may be null. */
    public String getPath() {
        return path;
    }

    /** State of the flow when it failed, null if the flow never started. */
    public RepairState getResumableState() {
        return resumableState;
    }

    public RepairException withResumableState(RepairState state) {
        this.resumableState = state;
        return this;
    }
}
