package com.rcpilot.config;

import java.time.Duration;
import java.util.List;

/**
 * Immutable repair settings, built once from {@code rcpilot.*} properties and
 * passed to every component that needs them.
 */
public final class RepairConfig {

    private final String       sourcesDir;
    private final String       artifactsDir;
    private final String       outputDir;
    private final int          specMaxIterations;
    private final boolean      lemmaEnabled;
    private final int          lemmaMaxIterations;
    private final boolean      escalateOnProofFailure;
    private final String       coqRoot;
    private final List<String> lemmaImports;
    private final String       verifierCommand;
    private final Duration     iterationTimeout;
    private final Duration     flowTimeout;
    private final int          maxFlows;

    private RepairConfig(Builder b) {
        if (b.specMaxIterations < 1)
            throw new IllegalArgumentException("rcpilot.spec.max-iterations must be >= 1");
        if (b.lemmaMaxIterations < 0)
            throw new IllegalArgumentException("rcpilot.lemma.max-iterations must be >= 0");
        if (b.maxFlows < 1)
            throw new IllegalArgumentException("rcpilot.concurrency.max-flows must be >= 1");
        if (b.iterationTimeout.isZero() || b.iterationTimeout.isNegative()
                || b.flowTimeout.isZero() || b.flowTimeout.isNegative())
            throw new IllegalArgumentException("rcpilot.timeouts.* must be positive");
        if (b.verifierCommand == null || b.verifierCommand.isBlank())
            throw new IllegalArgumentException("rcpilot.verifier.command must not be blank");

        this.sourcesDir             = b.sourcesDir;
        this.artifactsDir           = b.artifactsDir;
        this.outputDir              = b.outputDir;
        this.specMaxIterations      = b.specMaxIterations;
        this.lemmaEnabled           = b.lemmaEnabled;
        this.lemmaMaxIterations     = b.lemmaMaxIterations;
        this.escalateOnProofFailure = b.escalateOnProofFailure;
        this.coqRoot                = b.coqRoot;
        this.lemmaImports           = List.copyOf(b.lemmaImports);
        this.verifierCommand        = b.verifierCommand;
        this.iterationTimeout       = b.iterationTimeout;
        this.flowTimeout            = b.flowTimeout;
        this.maxFlows               = b.maxFlows;
    }

    public String       getSourcesDir()             { return sourcesDir; }
    public String       getArtifactsDir()           { return artifactsDir; }
    public String       getOutputDir()              { return outputDir; }
    public int          getSpecMaxIterations()      { return specMaxIterations; }
    public boolean      isLemmaEnabled()            { return lemmaEnabled; }
    public int          getLemmaMaxIterations()     { return lemmaMaxIterations; }
    public boolean      isEscalateOnProofFailure()  { return escalateOnProofFailure; }
    public String       getCoqRoot()                { return coqRoot; }
    public List<String> getLemmaImports()           { return lemmaImports; }
    public String       getVerifierCommand()        { return verifierCommand; }
    public Duration     getIterationTimeout()       { return iterationTimeout; }
    public Duration     getFlowTimeout()            { return flowTimeout; }
    public int          getMaxFlows()               { return maxFlows; }

    /** Upper bound on verification rounds for one file, across all resumed runs. */
    public int getTotalIterationBudget() {
        return specMaxIterations + (lemmaEnabled ? lemmaMaxIterations : 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
                "RepairConfig{spec=%d, lemma=%s/%d, escalate=%b, verifier='%s', iteration=%ss, flow=%ss, flows=%d}",
                specMaxIterations, lemmaEnabled, lemmaMaxIterations, escalateOnProofFailure,
                verifierCommand, iterationTimeout.toSeconds(), flowTimeout.toSeconds(), maxFlows);
    }

    // ----------------------------------------------------------------
    // Builder (defaults mirror application.properties)
    // ----------------------------------------------------------------

    public static final class Builder {
        private String       sourcesDir             = "sources";
        private String       artifactsDir           = "artifacts";
        private String       outputDir              = "output";
        private int          specMaxIterations      = 5;
        private boolean      lemmaEnabled           = true;
        private int          lemmaMaxIterations     = 3;
        private boolean      escalateOnProofFailure = false;
        private String       coqRoot                = "refinedc.project";
        private List<String> lemmaImports           = List.of("refinedc.typing.typing");
        private String       verifierCommand        = "refinedc check";
        private Duration     iterationTimeout       = Duration.ofSeconds(300);
        private Duration     flowTimeout            = Duration.ofSeconds(3600);
        private int          maxFlows               = 4;

        private Builder() {}

        public Builder sourcesDir(String v)               { this.sourcesDir = v;             return this; }
        public Builder artifactsDir(String v)             { this.artifactsDir = v;           return this; }
        public Builder outputDir(String v)                { this.outputDir = v;              return this; }
        public Builder specMaxIterations(int v)           { this.specMaxIterations = v;      return this; }
        public Builder lemmaEnabled(boolean v)            { this.lemmaEnabled = v;           return this; }
        public Builder lemmaMaxIterations(int v)          { this.lemmaMaxIterations = v;     return this; }
        public Builder escalateOnProofFailure(boolean v)  { this.escalateOnProofFailure = v; return this; }
        public Builder coqRoot(String v)                  { this.coqRoot = v;                return this; }
        public Builder lemmaImports(List<String> v)       { this.lemmaImports = v;           return this; }
        public Builder verifierCommand(String v)          { this.verifierCommand = v;        return this; }
        public Builder iterationTimeout(Duration v)       { this.iterationTimeout = v;       return this; }
        public Builder flowTimeout(Duration v)            { this.flowTimeout = v;            return this; }
        public Builder maxFlows(int v)                    { this.maxFlows = v;               return this; }

        public RepairConfig build() { return new RepairConfig(this); }
    }
}
