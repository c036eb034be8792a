package com.rcpilot.core.agent;

import com.rcpilot.core.state.RepairAttempt;

import java.util.List;

/**
 * Input for one spec generation call. {@code priorError} is null on the first
 * call of a flow and holds the last verifier output on regeneration.
 */
public final class SpecRequest {

    private final String              path;
    private final String              sourceText;
    private final String              relatedContext;
    private final String              priorError;
    private final List<RepairAttempt> history;

    public SpecRequest(String path, String sourceText, String relatedContext,
                       String priorError, List<RepairAttempt> history) {
        this.path           = path;
        this.sourceText     = sourceText;
        this.relatedContext = relatedContext != null ? relatedContext : "";
        this.priorError     = priorError;
        this.history        = history != null ? List.copyOf(history) : List.of();
    }

    public String              getPath()           { return path; }
    public String              getSourceText()     { return sourceText; }
    public String              getRelatedContext() { return relatedContext; }
    public String              getPriorError()     { return priorError; }
    public List<RepairAttempt> getHistory()        { return history; }

    public boolean isRegeneration() {
        return priorError != null;
    }
}
