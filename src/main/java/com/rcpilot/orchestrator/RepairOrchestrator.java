package com.rcpilot.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.config.RepairConfig;
import com.rcpilot.core.agent.LemmaGenerator;
import com.rcpilot.core.agent.LemmaRequest;
import com.rcpilot.core.agent.LemmaResult;
import com.rcpilot.core.agent.SpecGenerator;
import com.rcpilot.core.agent.SpecRequest;
import com.rcpilot.core.agent.SpecResult;
import com.rcpilot.core.diagnostic.DiagnosticClassifier;
import com.rcpilot.core.diagnostic.DiagnosticSet;
import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.error.RepairException;
import com.rcpilot.core.error.RepairPersistenceException;
import com.rcpilot.core.error.RepairTimeoutException;
import com.rcpilot.core.filesystem.ArtifactPathResolver;
import com.rcpilot.core.filesystem.FileSystemManager;
import com.rcpilot.core.insertion.AnnotationRequest;
import com.rcpilot.core.insertion.InsertionEngine;
import com.rcpilot.core.insertion.InsertionResult;
import com.rcpilot.core.lemma.LemmaFileWriter;
import com.rcpilot.core.lemma.LemmaImportDirective;
import com.rcpilot.core.source.SourceFile;
import com.rcpilot.core.state.RepairAttempt;
import com.rcpilot.core.state.RepairPhase;
import com.rcpilot.core.state.RepairState;
import com.rcpilot.core.verifier.VerificationResult;
import com.rcpilot.core.verifier.Verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RepairOrchestrator — drives one file from first specification to a verdict.
 *
 * Phase flow (see {@link RepairPhase}):
 *
 *   spec phase   generate → verify → regenerate with last error → verify ...
 *                until success or spec.max-iterations rounds
 *   lemma phase  insert import directive, then generate lemmas → write lemma
 *                file → verify ... until success or lemma.max-iterations rounds
 *
 * The verifier's exit code is the only success signal. Classification only
 * steers which strategy runs next. A verifier run that hits the per-iteration
 * timeout is a failed round like any other; only the flow deadline ends the
 * flow.
 *
 * A flow that fails with a {@link RepairException} hands its in-flight state
 * to the exception, so the iterations it spent are stored with it.
 *
 * Stateless: every flow owns its SourceFile and RepairState, so one instance
 * serves all concurrent flows.
 */
@Component
public class RepairOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RepairOrchestrator.class);

    static final String SPEC_SUGGESTION =
            "Consider trying with helper lemmas or manually adjusting the specifications.";

    static final String EXHAUSTED_SUGGESTION = """
            Consider:
            1. Reviewing and simplifying the code
            2. Adjusting the specifications
            3. Breaking the verification into smaller parts
            4. Resuming the verification with the current state""";

    private final RepairConfig         config;
    private final InsertionEngine      insertionEngine;
    private final DiagnosticClassifier classifier;
    private final SpecGenerator        specGenerator;
    private final LemmaGenerator       lemmaGenerator;
    private final Verifier             verifier;
    private final FileSystemManager    artifacts;
    private final ArtifactPathResolver paths;
    private final LemmaFileWriter      lemmaFileWriter;
    private final ObjectMapper         objectMapper;

    public RepairOrchestrator(
            RepairConfig         config,
            InsertionEngine      insertionEngine,
            DiagnosticClassifier classifier,
            SpecGenerator        specGenerator,
            LemmaGenerator       lemmaGenerator,
            Verifier             verifier,
            FileSystemManager    artifacts,
            ArtifactPathResolver paths,
            LemmaFileWriter      lemmaFileWriter,
            ObjectMapper         objectMapper
    ) {
        this.config          = config;
        this.insertionEngine = insertionEngine;
        this.classifier      = classifier;
        this.specGenerator   = specGenerator;
        this.lemmaGenerator  = lemmaGenerator;
        this.verifier        = verifier;
        this.artifacts       = artifacts;
        this.paths           = paths;
        this.lemmaFileWriter = lemmaFileWriter;
        this.objectMapper    = objectMapper;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    /**
     * Repair one file of the codebase.
     *
     * @param codebase loaded project
     * @param path     project-relative path of a .c file
     * @param previous stored state to resume from, or null for a fresh flow
     * @throws RepairException carrying the flow's state once the flow has started
     * @throws RepairConfigurationException  path not in the codebase or escaping it
     * @throws com.rcpilot.core.error.GenerationException a generator failed
     * @throws RepairTimeoutException        flow deadline expired or thread interrupted
     * @throws RepairPersistenceException    artifact or lemma file could not be written
     */
    public RepairReport repair(Codebase codebase, String path, RepairState previous) {

        long startTime = System.currentTimeMillis();

        // ------------------------------------------------------------
        // INIT
        // ------------------------------------------------------------
        String     project  = codebase.getProject();
        String     logical  = paths.normalize(project, path);
        SourceFile file     = codebase.find(logical)
                .orElseThrow(() -> new RepairConfigurationException(path,
                        "File " + path + " is not part of project " + project));
        FlowDeadline deadline = FlowDeadline.start(config.getFlowTimeout());
        Flow         flow     = new Flow(codebase, file, previous != null ? previous.copy() : new RepairState(), deadline);

        // a previous run that died while regenerating still owes that regeneration
        boolean regenerate = previous != null && previous.getPhase() == RepairPhase.REGENERATING_SPEC;

        flow.state.setPhase(RepairPhase.INIT);
        log.info("========== REPAIR START {} / {} ==========", project, logical);
        if (previous != null) {
            log.info("[Orchestrator] Resuming: {}", flow.state);
        }

        try {
            RepairReport report = flow.state.isLemmaPhaseEntered() ? null : runSpecPhase(flow, regenerate);

            if (report == null) {
                report = runLemmaPhase(flow);
            }

            logBenchmark(flow, startTime, report);
            return report;

        } catch (RepairException e) {
            log.warn("[Orchestrator] Flow for {} failed during {} after {} iterations: {}",
                    logical, flow.state.getPhase(), flow.state.getIterationsUsed(), e.getMessage());
            throw e.withResumableState(flow.state);
        }
    }

    // =========================================================================
    // SPEC PHASE
    // =========================================================================

    /** @return final report, or null to continue with the lemma phase */
    private RepairReport runSpecPhase(Flow flow, boolean regenerate) {

        RepairState state   = flow.state;
        int         maxSpec = config.getSpecMaxIterations();

        if (!state.hasAnnotations() && state.getSpecIterationsUsed() < maxSpec) {
            state.setPhase(RepairPhase.GENERATING_SPEC);
            requestSpecs(flow, null);
        } else if (regenerate && state.getSpecIterationsUsed() < maxSpec) {
            state.setPhase(RepairPhase.REGENERATING_SPEC);
            requestSpecs(flow, state.getLastError());
        }
        render(flow.file, state);

        while (state.getSpecIterationsUsed() < maxSpec) {

            state.setPhase(RepairPhase.VERIFYING);
            VerificationResult result = verifyRound(flow, false);

            if (result.isSuccess()) {
                return succeed(flow);
            }

            DiagnosticSet diagnostics = recordFailure(flow, result, RepairPhase.VERIFYING);

            if (config.isLemmaEnabled() && config.isEscalateOnProofFailure()
                    && diagnostics.hasProofFailures()) {
                log.info("[Orchestrator] Proof failures with valid annotations, escalating early");
                break;
            }

            if (state.getSpecIterationsUsed() < maxSpec) {
                state.setPhase(RepairPhase.REGENERATING_SPEC);
                requestSpecs(flow, state.getLastError());
                render(flow.file, state);
            }
        }

        if (!config.isLemmaEnabled()) {
            log.warn("[Orchestrator] Spec budget spent ({} rounds), lemma phase disabled",
                    state.getSpecIterationsUsed());
            return exhaust(flow, "Specification budget exhausted after "
                    + state.getSpecIterationsUsed() + " iterations", SPEC_SUGGESTION);
        }

        state.setPhase(RepairPhase.ESCALATING_TO_LEMMAS);
        state.enterLemmaPhase();
        log.info("[Orchestrator] Transition: spec phase → lemma phase");
        return null;
    }

    private void requestSpecs(Flow flow, String priorError) {
        flow.deadline.checkpoint(flow.file.getPath(), "spec generation");

        SpecResult result = specGenerator.generate(new SpecRequest(
                flow.file.getPath(),
                flow.file.getOriginalText(),
                flow.codebase.relatedContext(flow.file.getPath()),
                priorError,
                flow.state.getAttempts()));

        flow.state.replaceAnnotations(result.getAnnotations());
        log.info("[Orchestrator] {} annotations stored ({})",
                result.getAnnotations().size(),
                result.getExplanation().isBlank() ? "no explanation" : result.getExplanation());
    }

    // =========================================================================
    // LEMMA PHASE
    // =========================================================================

    private RepairReport runLemmaPhase(Flow flow) {

        RepairState state = flow.state;

        if (!config.isLemmaEnabled()) {
            return exhaust(flow, "Lemma phase disabled", SPEC_SUGGESTION);
        }

        render(flow.file, state);

        while (state.getLemmaIterationsUsed() < config.getLemmaMaxIterations()) {

            state.setPhase(RepairPhase.GENERATING_LEMMA);
            flow.deadline.checkpoint(flow.file.getPath(), "lemma generation");

            LemmaResult generated = lemmaGenerator.generate(new LemmaRequest(
                    flow.file.getPath(),
                    flow.file.getText(),
                    state.getLastError(),
                    state.getHelperLemmas()));

            int added = state.appendLemmas(generated.getLemmas());
            state.addLemmaImports(generated.getImports());
            log.info("[Orchestrator] Lemmas: +{} (total {})", added, state.getHelperLemmas().size());
            if (added == 0) {
                log.warn("[Orchestrator] Lemma generator produced nothing new for {}", flow.file.getPath());
            }

            writeLemmaFile(flow);

            state.setPhase(RepairPhase.VERIFYING_WITH_LEMMA);
            VerificationResult result = verifyRound(flow, true);

            if (result.isSuccess()) {
                return succeed(flow);
            }
            recordFailure(flow, result, RepairPhase.VERIFYING_WITH_LEMMA);
        }

        return exhaust(flow, "Max iterations exceeded", EXHAUSTED_SUGGESTION);
    }

    private void writeLemmaFile(Flow flow) {
        List<String> imports = new ArrayList<>(config.getLemmaImports());
        imports.addAll(flow.state.getLemmaImports());

        String target  = paths.lemmaFilePath(flow.codebase.getProject(), flow.file.getPath());
        String content = lemmaFileWriter.render(imports, flow.state.getHelperLemmas());
        try {
            artifacts.writeFile(target, content);
            log.info("[Orchestrator] Lemma file written: {}", target);
        } catch (FileSystemManager.FileSystemException e) {
            throw new RepairPersistenceException(flow.file.getPath(),
                    "Failed to write lemma file " + target + ": " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // VERIFICATION ROUND
    // =========================================================================

    private VerificationResult verifyRound(Flow flow, boolean lemmaRound) {
        String path = flow.file.getPath();
        flow.deadline.checkpoint(path, "verification");

        Path artifact = writeArtifact(flow);

        VerificationResult result;
        try {
            result = verifier.verify(artifact, flow.deadline.iterationTimeout(config.getIterationTimeout()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepairTimeoutException(path, "Interrupted while verifying " + path, e);
        }

        if (lemmaRound) flow.state.recordLemmaIteration();
        else            flow.state.recordSpecIteration();

        log.info("[Orchestrator] Iteration {} ({}): exit={} in {} ms",
                flow.state.getIterationsUsed(), lemmaRound ? "lemma" : "spec",
                result.getExitCode(), result.getElapsedMs());

        if (result.isTimedOut()) {
            if (flow.deadline.remaining().isZero()) {
                throw new RepairTimeoutException(path, "Flow deadline expired while verifying " + path);
            }
            log.warn("[Orchestrator] Verifier timed out on {}, counted as a failed round", path);
        }
        if (result.getExitCode() == VerificationResult.EXIT_ERROR) {
            throw new RepairConfigurationException(path, result.getOutput());
        }
        return result;
    }

    private DiagnosticSet recordFailure(Flow flow, VerificationResult result, RepairPhase phase) {
        RepairState   state       = flow.state;
        DiagnosticSet diagnostics = classifier.classify(result.getOutput());

        flow.lastDiagnostics = diagnostics;
        state.setLastError(result.getOutput());
        state.addAttempt(RepairAttempt.builder(state.getIterationsUsed(), RepairAttempt.Outcome.of(diagnostics))
                .phase(phase)
                .diagnosticSummary(diagnostics.getSummary())
                .errorExcerpt(result.getOutput())
                .annotationCount(state.annotationCount())
                .lemmaCount(state.getHelperLemmas().size())
                .build());

        log.info("[Orchestrator] Verification failed: {}", diagnostics.getSummary());
        return diagnostics;
    }

    private Path writeArtifact(Flow flow) {
        String target = paths.artifactPath(flow.codebase.getProject(), flow.file.getPath());
        try {
            artifacts.writeFile(target, flow.file.getText());
            return artifacts.resolve(target);
        } catch (FileSystemManager.FileSystemException e) {
            throw new RepairPersistenceException(flow.file.getPath(),
                    "Failed to write artifact " + target + ": " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // TEXT
    // =========================================================================

    /**
     * Rebuild the file's text from its original: annotations inserted at their
     * points, unplaced ones at the top of the file, and the lemma import
     * directive once the lemma phase has started (and has rounds to run).
     */
    public void render(SourceFile file, RepairState state) {
        String text = file.getOriginalText();

        List<AnnotationRequest> annotations = state.hasAnnotations()
                ? state.getCurrentAnnotations()
                : List.of();

        if (!annotations.isEmpty()) {
            InsertionResult inserted = insertionEngine.insert(text, annotations);
            text = inserted.getText();

            if (inserted.hasUnplaced()) {
                List<String> top = new ArrayList<>();
                for (AnnotationRequest a : inserted.getUnplaced()) {
                    top.add(InsertionEngine.normalizeForTop(a.getText()));
                }
                log.warn("[Orchestrator] {} annotations unplaced, added at top of {}",
                        top.size(), file.getPath());
                text = insertionEngine.prependToTop(text, top);
            }
        }

        // without lemma rounds no lemma file is ever written to import
        if (state.isLemmaPhaseEntered() && config.getLemmaMaxIterations() > 0) {
            text = LemmaImportDirective.insertInto(text,
                    LemmaImportDirective.forFile(file.getStem(), config.getCoqRoot()));
        }

        file.setText(text);
        file.recordAnnotationLocations(insertionEngine.locate(text, annotations));
    }

    // =========================================================================
    // RESULT BUILDERS
    // =========================================================================

    private RepairReport succeed(Flow flow) {
        flow.state.setPhase(RepairPhase.SUCCESS);
        log.info("========== REPAIR SUCCESS {} ({} iterations) ==========",
                flow.file.getPath(), flow.state.getIterationsUsed());
        return RepairReport.success(flow.file.getPath(), flow.file.getText(),
                flow.file.getAnnotationLocations(), flow.state);
    }

    private RepairReport exhaust(Flow flow, String reason, String suggestions) {
        flow.state.setPhase(RepairPhase.EXHAUSTED);

        // best-known text stays on disk next to the last verifier run
        writeArtifact(flow);

        String message = flow.lastDiagnostics != null
                ? reason + " (" + flow.lastDiagnostics.getSummary() + ")"
                : reason;
        log.warn("========== REPAIR EXHAUSTED {}: {} ==========", flow.file.getPath(), message);

        return RepairReport.failure(flow.file.getPath(), flow.file.getText(),
                flow.file.getAnnotationLocations(), flow.state, message, suggestions,
                flow.lastDiagnostics);
    }

    /**
     * Inline benchmark logging: one JSON line per flow for log parsers.
     */
    private void logBenchmark(Flow flow, long startTime, RepairReport report) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("project",          flow.codebase.getProject());
        record.put("file",             flow.file.getPath());
        record.put("resolved",         report.isSuccess());
        record.put("total_iterations", flow.state.getIterationsUsed());
        record.put("lemma_iterations", flow.state.getLemmaIterationsUsed());
        record.put("annotations",      flow.state.annotationCount());
        record.put("helper_lemmas",    flow.state.getHelperLemmas().size());
        record.put("final_phase",      flow.state.getPhase().name());
        record.put("wall_time_ms",     System.currentTimeMillis() - startTime);
        try {
            log.info("[Benchmark] {}", objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.warn("[Benchmark] Could not serialize record: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Per-flow context
    // =========================================================================

    private static final class Flow {
        final Codebase     codebase;
        final SourceFile   file;
        final RepairState  state;
        final FlowDeadline deadline;
        DiagnosticSet      lastDiagnostics;

        Flow(Codebase codebase, SourceFile file, RepairState state, FlowDeadline deadline) {
            this.codebase = codebase;
            this.file     = file;
            this.state    = state;
            this.deadline = deadline;
        }
    }
}
