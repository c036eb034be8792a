package com.rcpilot.core.diagnostic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Classified verifier output. Syntax errors take priority: when any annotation
 * is rejected, proof failures are not reported as such.
 */
public final class DiagnosticSet {

    private final List<Diagnostic> diagnostics;
    private final boolean          hasSyntaxErrors;
    private final boolean          hasProofFailures;
    private final String           summary;

    public DiagnosticSet(List<Diagnostic> diagnostics) {
        this.diagnostics = Collections.unmodifiableList(diagnostics);

        long invalid = diagnostics.stream().filter(Diagnostic::isSyntaxError).count();
        long proof   = diagnostics.size() - invalid;

        this.hasSyntaxErrors  = invalid > 0;
        this.hasProofFailures = proof > 0 && invalid == 0;

        if (hasSyntaxErrors) {
            this.summary = invalid + " invalid annotation" + (invalid == 1 ? "" : "s");
        } else if (hasProofFailures) {
            this.summary = proof + " proof failure" + (proof == 1 ? "" : "s");
        } else {
            this.summary = "no classified diagnostics";
        }
    }

    public static DiagnosticSet empty() {
        return new DiagnosticSet(List.of());
    }

    public List<Diagnostic> getDiagnostics()  { return diagnostics; }
    @JsonProperty("hasSyntaxErrors")
    public boolean          hasSyntaxErrors()  { return hasSyntaxErrors; }
    @JsonProperty("hasProofFailures")
    public boolean          hasProofFailures() { return hasProofFailures; }
    public String           getSummary()       { return summary; }

    @JsonIgnore
    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "DiagnosticSet{" + summary + "}";
    }
}
