package com.rcpilot.core.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rcpilot.core.diagnostic.DiagnosticSet;

/**
 * Immutable record of one failed verification round.
 *
 * Recorded by RepairOrchestrator right after the verifier output is classified.
 * Stored in RepairState.attempts (capped at 5) and rendered into the spec
 * regeneration prompt.
 */
public final class RepairAttempt {

    public enum Outcome {
        /** Verifier rejected one or more annotations. */
        INVALID_ANNOTATION,
        /** Annotations accepted, side conditions left unproved. */
        PROOF_FAILURE,
        /** Non-zero exit with output the classifier could not categorize. */
        UNCLASSIFIED;

        public static Outcome of(DiagnosticSet diagnostics) {
            if (diagnostics.hasSyntaxErrors())  return INVALID_ANNOTATION;
            if (diagnostics.hasProofFailures()) return PROOF_FAILURE;
            return UNCLASSIFIED;
        }
    }

    private final int         attemptNumber;
    private final RepairPhase phase;
    private final Outcome     outcome;

    /** DiagnosticSet summary, e.g. "2 invalid annotations". */
    private final String diagnosticSummary;

    /** First lines of the raw verifier output. */
    private final String errorExcerpt;

    private final int annotationCount;
    private final int lemmaCount;

    @JsonCreator
    RepairAttempt(@JsonProperty("attemptNumber")     int attemptNumber,
                  @JsonProperty("phase")             RepairPhase phase,
                  @JsonProperty("outcome")           Outcome outcome,
                  @JsonProperty("diagnosticSummary") String diagnosticSummary,
                  @JsonProperty("errorExcerpt")      String errorExcerpt,
                  @JsonProperty("annotationCount")   int annotationCount,
                  @JsonProperty("lemmaCount")        int lemmaCount) {
        this.attemptNumber     = attemptNumber;
        this.phase             = phase;
        this.outcome           = outcome;
        this.diagnosticSummary = diagnosticSummary;
        this.errorExcerpt      = errorExcerpt;
        this.annotationCount   = annotationCount;
        this.lemmaCount        = lemmaCount;
    }

    // ----------------------------------------------------------------
    // Prompt rendering
    // ----------------------------------------------------------------

    /**
     * Plain-text block for the regeneration prompt.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(attemptNumber).append("\n");
        sb.append("  Phase       : ").append(phase).append("\n");
        sb.append("  Outcome     : ").append(outcome).append("\n");
        sb.append("  Annotations : ").append(annotationCount)
          .append(", lemmas: ").append(lemmaCount).append("\n");
        if (diagnosticSummary != null && !diagnosticSummary.isBlank()) {
            sb.append("  Diagnostics : ").append(diagnosticSummary).append("\n");
        }

        switch (outcome) {
            case INVALID_ANNOTATION:
                sb.append("  Hint        : Fix annotation syntax before anything else.\n");
                break;
            case PROOF_FAILURE:
                sb.append("  Hint        : Annotations parsed; strengthen pre/postconditions or invariants.\n");
                break;
            case UNCLASSIFIED:
                sb.append("  Hint        : Read the raw verifier output below.\n");
                break;
        }

        if (errorExcerpt != null && !errorExcerpt.isBlank()) {
            sb.append("  Output      : |\n");
            for (String line : errorExcerpt.split("\n")) {
                sb.append("                ").append(line).append("\n");
            }
        }
        return sb.toString();
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public int         getAttemptNumber()     { return attemptNumber; }
    public RepairPhase getPhase()             { return phase; }
    public Outcome     getOutcome()           { return outcome; }
    public String      getDiagnosticSummary() { return diagnosticSummary; }
    public String      getErrorExcerpt()      { return errorExcerpt; }
    public int         getAnnotationCount()   { return annotationCount; }
    public int         getLemmaCount()        { return lemmaCount; }

    // ----------------------------------------------------------------
    // Builder
    // ----------------------------------------------------------------

    public static Builder builder(int attemptNumber, Outcome outcome) {
        return new Builder(attemptNumber, outcome);
    }

    public static final class Builder {
        private final int     attemptNumber;
        private final Outcome outcome;
        private RepairPhase phase             = RepairPhase.VERIFYING;
        private String      diagnosticSummary = null;
        private String      errorExcerpt      = null;
        private int         annotationCount   = 0;
        private int         lemmaCount        = 0;

        private Builder(int attemptNumber, Outcome outcome) {
            this.attemptNumber = attemptNumber;
            this.outcome       = outcome;
        }

        public Builder phase(RepairPhase v)         { this.phase = v;                      return this; }
        public Builder diagnosticSummary(String v)  { this.diagnosticSummary = v;          return this; }
        public Builder errorExcerpt(String v)       { this.errorExcerpt = firstNLines(v, 5); return this; }
        public Builder annotationCount(int v)       { this.annotationCount = v;            return this; }
        public Builder lemmaCount(int v)            { this.lemmaCount = v;                 return this; }

        public RepairAttempt build() {
            return new RepairAttempt(attemptNumber, phase, outcome, diagnosticSummary,
                    errorExcerpt, annotationCount, lemmaCount);
        }
    }

    // ----------------------------------------------------------------
    // Utilities
    // ----------------------------------------------------------------

    private static String firstNLines(String text, int n) {
        if (text == null) return null;
        String[] lines = text.strip().split("\n");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(n, lines.length); i++) {
            if (i > 0) sb.append("\n");
            sb.append(lines[i]);
        }
        if (lines.length > n) sb.append("\n[+" + (lines.length - n) + " more lines]");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RepairAttempt{#" + attemptNumber + ", phase=" + phase + ", outcome=" + outcome + "}";
    }
}
