package com.rcpilot.core.error;

/** Flow or iteration deadline expired, or the flow thread was interrupted. */
public class RepairTimeoutException extends RepairException {

    public RepairTimeoutException(String path, String message) {
        super(path, message);
    }

    public RepairTimeoutException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
