package com.rcpilot.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.config.RepairConfig;
import com.rcpilot.core.error.RepairException;
import com.rcpilot.core.error.RepairPersistenceException;
import com.rcpilot.core.error.RepairTimeoutException;
import com.rcpilot.core.filesystem.ArtifactPathResolver;
import com.rcpilot.core.filesystem.FileSystemManager;
import com.rcpilot.core.filesystem.RepairStateStore;
import com.rcpilot.core.source.SourceFile;
import com.rcpilot.core.state.RepairState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CodebaseCoordinator — runs one repair flow per .c file of a project and
 * persists what the flows produced.
 *
 * Flows run in parallel on the "repairExecutor" pool and share nothing. The
 * coordinator is the only writer of the shared file collection, and only
 * after every flow has settled:
 *
 *   1. join      failures and timeouts become failed FileOutcomes
 *   2. state     each flow's resumable state is stored as JSON, including the
 *                state a failed flow reached
 *   3. output    changed files of completed flows are written to output/<project>/<rel>
 *   4. summary   rcpilot_report.json next to the artifacts
 */
@Component
public class CodebaseCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CodebaseCoordinator.class);

    private static final Duration JOIN_GRACE = Duration.ofSeconds(30);

    private final RepairOrchestrator     orchestrator;
    private final CodebaseLoader         loader;
    private final RepairStateStore       stateStore;
    private final ArtifactPathResolver   paths;
    private final FileSystemManager      artifacts;
    private final FileSystemManager      output;
    private final ObjectMapper           objectMapper;
    private final RepairConfig           config;
    private final ThreadPoolTaskExecutor executor;

    public CodebaseCoordinator(
            RepairOrchestrator   orchestrator,
            CodebaseLoader       loader,
            RepairStateStore     stateStore,
            ArtifactPathResolver paths,
            FileSystemManager    artifacts,
            ObjectMapper         objectMapper,
            RepairConfig         config,
            @Qualifier("repairExecutor") ThreadPoolTaskExecutor executor
    ) {
        this.orchestrator = orchestrator;
        this.loader       = loader;
        this.stateStore   = stateStore;
        this.paths        = paths;
        this.artifacts    = artifacts;
        this.output       = new FileSystemManager(config.getOutputDir());
        this.objectMapper = objectMapper;
        this.config       = config;
        this.executor     = executor;
    }

    // =========================================================================
    // PROJECT
    // =========================================================================

    public CodebaseReport repairProject(String project, boolean resume) {
        long startTime = System.currentTimeMillis();

        Codebase     codebase = loader.load(project);
        List<String> targets  = codebase.getRepairTargets();

        log.info("========== PROJECT START {} ({} files, resume={}) ==========",
                project, targets.size(), resume);

        // ------------------------------------------------------------
        // Launch
        // ------------------------------------------------------------
        Map<String, Future<RepairReport>> futures = new LinkedHashMap<>();
        for (String path : targets) {
            futures.put(path, executor.submit(() -> {
                RepairState previous = resume ? stateStore.load(project, path).orElse(null) : null;
                return orchestrator.repair(codebase, path, previous);
            }));
        }

        // ------------------------------------------------------------
        // Join
        // ------------------------------------------------------------
        long joinDeadline = System.nanoTime() + joinBudget(targets.size()).toNanos();
        List<FileOutcome> outcomes = new ArrayList<>();

        for (Map.Entry<String, Future<RepairReport>> entry : futures.entrySet()) {
            outcomes.add(await(entry.getKey(), entry.getValue(), joinDeadline));
        }

        // ------------------------------------------------------------
        // Persist (single-threaded, after all flows settled)
        // ------------------------------------------------------------
        for (FileOutcome outcome : outcomes) {
            if (outcome.getReport() != null) {
                persist(codebase, outcome);
            } else if (outcome.getFailedState() != null) {
                saveFailedState(project, outcome.getPath(), outcome.getFailedState());
            }
        }

        CodebaseReport report = new CodebaseReport(project, outcomes, System.currentTimeMillis() - startTime);
        writeSummary(report);

        log.info("========== PROJECT DONE {} ==========", report);
        return report;
    }

    // =========================================================================
    // SINGLE FILE
    // =========================================================================

    /**
     * Repair one file synchronously and persist its result.
     *
     * @throws RepairPersistenceException if the state or output file could not be written
     */
    public RepairReport repairFile(String project, String path, boolean resume) {
        Codebase    codebase = loader.load(project);
        String      logical  = paths.normalize(project, path);
        RepairState previous = resume ? stateStore.load(project, logical).orElse(null) : null;

        RepairReport report;
        try {
            report = orchestrator.repair(codebase, logical, previous);
        } catch (RepairException e) {
            if (e.getResumableState() != null) {
                saveFailedState(project, logical, e.getResumableState());
            }
            throw e;
        }

        FileOutcome outcome = FileOutcome.completed(report);
        persist(codebase, outcome);

        if (outcome.getPersistError() != null) {
            throw new RepairPersistenceException(logical, outcome.getPersistError(), null);
        }
        return outcome.getReport();
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private FileOutcome await(String path, Future<RepairReport> future, long joinDeadline) {
        try {
            long waitNanos = Math.max(0, joinDeadline - System.nanoTime());
            RepairReport report = future.get(waitNanos, TimeUnit.NANOSECONDS);
            return FileOutcome.completed(report);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Coordinator] {} exceeded its time budget, cancelled", path);
            return FileOutcome.failed(path, new RepairTimeoutException(path, "Flow cancelled after timeout"));

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Coordinator] Flow for {} failed: {}", path, cause.getMessage(), cause);
            return FileOutcome.failed(path, cause);

        } catch (CancellationException e) {
            return FileOutcome.failed(path, e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return FileOutcome.failed(path, new RepairTimeoutException(path, "Coordinator interrupted", e));
        }
    }

    /** Flows beyond the pool size queue up, so the join waits for every wave. */
    private Duration joinBudget(int flows) {
        int waves = Math.max(1, (flows + config.getMaxFlows() - 1) / config.getMaxFlows());
        return config.getFlowTimeout().multipliedBy(waves).plus(JOIN_GRACE);
    }

    private void persist(Codebase codebase, FileOutcome outcome) {
        String       project = codebase.getProject();
        RepairReport report  = outcome.getReport();
        RepairState  state   = report.getResumableState();

        try {
            stateStore.save(project, report.getPath(), state);
        } catch (RepairPersistenceException e) {
            log.warn("[Coordinator] {}", e.getMessage());
            outcome.recordPersistError(e.getMessage());
        }

        SourceFile file = codebase.find(report.getPath()).orElse(null);
        if (file == null) {
            return;
        }
        if (!file.isModified() && state.hasAnnotations()) {
            log.info("[Coordinator] Merging stored annotations into {}", file.getPath());
            orchestrator.render(file, state);
        }
        if (!file.isModified()) {
            log.debug("[Coordinator] {} unchanged, not written", file.getPath());
            return;
        }

        String target = project + "/" + report.getPath();
        try {
            output.writeFile(target, file.getText());
            outcome.markPersisted();
            log.info("[Coordinator] Wrote {}", output.getRootPath().resolve(target));
        } catch (FileSystemManager.FileSystemException e) {
            log.warn("[Coordinator] Failed to write {}: {}", target, e.getMessage());
            outcome.recordOutputError("Failed to write " + target + ": " + e.getMessage());
        }
    }

    private void saveFailedState(String project, String path, RepairState state) {
        try {
            stateStore.save(project, path, state);
            log.info("[Coordinator] Stored state of failed flow {} ({} iterations spent)",
                    path, state.getIterationsUsed());
        } catch (RepairPersistenceException e) {
            log.warn("[Coordinator] {}", e.getMessage());
        }
    }

    private void writeSummary(CodebaseReport report) {
        String target = paths.reportPath(report.getProject());
        try {
            artifacts.writeFile(target, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (JsonProcessingException | FileSystemManager.FileSystemException e) {
            log.warn("[Coordinator] Failed to write project report {}: {}", target, e.getMessage());
            report.recordReportError(e.getMessage());
        }
    }
}
