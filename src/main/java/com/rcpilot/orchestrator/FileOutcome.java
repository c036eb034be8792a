package com.rcpilot.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rcpilot.core.error.RepairException;
import com.rcpilot.core.state.RepairState;

/**
 * One file's entry in a {@link CodebaseReport}: either the flow's report or
 * the failure that ended it, plus what happened when its result was persisted.
 *
 * A verified file whose text could not be written is not a success.
 */
public final class FileOutcome {

    private final String       path;
    private final RepairReport report;
    private final String       failure;
    private final String       failureType;
    private final RepairState  failedState;
    private boolean            persisted;
    private boolean            outputFailed;
    private String             persistError;

    private FileOutcome(String path, RepairReport report, String failure, String failureType,
                        RepairState failedState) {
        this.path        = path;
        this.report      = report;
        this.failure     = failure;
        this.failureType = failureType;
        this.failedState = failedState;
    }

    static FileOutcome completed(RepairReport report) {
        return new FileOutcome(report.getPath(), report, null, null, null);
    }

    static FileOutcome failed(String path, Throwable cause) {
        String      message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        RepairState state   = cause instanceof RepairException
                ? ((RepairException) cause).getResumableState()
                : null;
        return new FileOutcome(path, null, message, cause.getClass().getSimpleName(), state);
    }

    void markPersisted() {
        this.persisted = true;
    }

    void recordPersistError(String message) {
        this.persistError = (persistError == null) ? message : persistError + "; " + message;
    }

    void recordOutputError(String message) {
        this.outputFailed = true;
        recordPersistError(message);
    }

    public String       getPath()         { return path; }
    public RepairReport getReport()       { return report; }
    public String       getFailure()      { return failure; }
    public String       getFailureType()  { return failureType; }
    public boolean      isPersisted()     { return persisted; }
    public String       getPersistError() { return persistError; }

    /** State a failed flow had reached, stored so a resumed run keeps its spent budget. */
    @JsonIgnore
    public RepairState getFailedState() {
        return failedState;
    }

    public boolean isSuccess() {
        return report != null && report.isSuccess() && !outputFailed;
    }

    @Override
    public String toString() {
        return report != null
                ? "FileOutcome{" + path + ", success=" + isSuccess() + ", persisted=" + persisted + "}"
                : "FileOutcome{" + path + ", failed=" + failureType + ": " + failure + "}";
    }
}
