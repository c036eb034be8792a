package com.rcpilot.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/** Outcome of repairing every .c file of one project. */
public final class CodebaseReport {

    private final String            project;
    private final List<FileOutcome> outcomes;
    private final long              elapsedMs;
    private String                  reportError;

    CodebaseReport(String project, List<FileOutcome> outcomes, long elapsedMs) {
        this.project   = project;
        this.outcomes  = List.copyOf(outcomes);
        this.elapsedMs = elapsedMs;
    }

    void recordReportError(String message) {
        this.reportError = message;
    }

    public String            getProject()     { return project; }
    public List<FileOutcome> getOutcomes()    { return outcomes; }
    public long              getElapsedMs()   { return elapsedMs; }
    public String            getReportError() { return reportError; }

    public long getSucceeded() {
        return outcomes.stream().filter(FileOutcome::isSuccess).count();
    }

    public long getFailed() {
        return outcomes.size() - getSucceeded();
    }

    @JsonIgnore
    public FileOutcome outcomeFor(String path) {
        for (FileOutcome o : outcomes) {
            if (o.getPath().equals(path)) return o;
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("CodebaseReport{project=%s, files=%d, succeeded=%d, elapsedMs=%d}",
                project, outcomes.size(), getSucceeded(), elapsedMs);
    }
}
