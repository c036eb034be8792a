package com.rcpilot.core.error;

/** Unknown file, escaping path or missing project directory. Never retried. */
public class RepairConfigurationException extends RepairException {

    public RepairConfigurationException(String path, String message) {
        super(path, message);
    }

    public RepairConfigurationException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
