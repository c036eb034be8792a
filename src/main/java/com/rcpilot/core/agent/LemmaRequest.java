package com.rcpilot.core.agent;

import com.rcpilot.core.lemma.HelperLemma;

import java.util.List;

public final class LemmaRequest {

    private final String            path;
    private final String            sourceText;
    private final String            lastError;
    private final List<HelperLemma> existingLemmas;

    public LemmaRequest(String path, String sourceText, String lastError, List<HelperLemma> existingLemmas) {
        this.path           = path;
        this.sourceText     = sourceText;
        this.lastError      = lastError != null ? lastError : "";
        this.existingLemmas = existingLemmas != null ? List.copyOf(existingLemmas) : List.of();
    }

    public String            getPath()           { return path; }
    public String            getSourceText()     { return sourceText; }
    public String            getLastError()      { return lastError; }
    public List<HelperLemma> getExistingLemmas() { return existingLemmas; }
}
