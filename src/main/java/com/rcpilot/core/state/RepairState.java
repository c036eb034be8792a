package com.rcpilot.core.state;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rcpilot.core.insertion.AnnotationRequest;
import com.rcpilot.core.lemma.HelperLemma;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RepairState — everything one file's repair flow needs to pick up where it stopped.
 *
 * Owned by exactly one flow. Serialized to JSON field-by-field; a flow resumed
 * from a stored state keeps its counters, so iterations never reset.
 *
 * Invariants:
 *   - iterationsUsed and lemmaIterationsUsed only grow
 *   - helperLemmas is append-only
 *   - currentAnnotations == null means "not generated yet", not "no annotations"
 */
@JsonAutoDetect(
        fieldVisibility    = JsonAutoDetect.Visibility.ANY,
        getterVisibility   = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility   = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RepairState {

    private static final Logger log = LoggerFactory.getLogger(RepairState.class);

    private static final int MAX_ATTEMPT_HISTORY = 5;

    private List<AnnotationRequest> currentAnnotations  = null;
    private List<HelperLemma>       helperLemmas        = new ArrayList<>();
    private List<String>            lemmaImports        = new ArrayList<>();
    private String                  lastError           = null;
    private int                     iterationsUsed      = 0;
    private int                     lemmaIterationsUsed = 0;
    private boolean                 lemmaPhaseEntered   = false;
    private RepairPhase             phase               = RepairPhase.INIT;
    private List<RepairAttempt>     attempts            = new ArrayList<>();

    public RepairState() {
    }

    /** Deep enough copy for handing a state across flows: lists are copied, elements are immutable. */
    public RepairState copy() {
        RepairState c = new RepairState();
        c.currentAnnotations  = currentAnnotations != null ? new ArrayList<>(currentAnnotations) : null;
        c.helperLemmas        = new ArrayList<>(helperLemmas);
        c.lemmaImports        = new ArrayList<>(lemmaImports);
        c.lastError           = lastError;
        c.iterationsUsed      = iterationsUsed;
        c.lemmaIterationsUsed = lemmaIterationsUsed;
        c.lemmaPhaseEntered   = lemmaPhaseEntered;
        c.phase               = phase;
        c.attempts            = new ArrayList<>(attempts);
        return c;
    }

    // =========================================================================
    // Phase
    // =========================================================================

    public RepairPhase getPhase() { return phase; }

    public void setPhase(RepairPhase phase) {
        if (this.phase != phase) {
            log.debug("[State] Phase transition: {} → {}", this.phase, phase);
            this.phase = phase;
        }
    }

    public boolean isLemmaPhaseEntered() { return lemmaPhaseEntered; }

    public void enterLemmaPhase() {
        this.lemmaPhaseEntered = true;
    }

    // =========================================================================
    // Annotations
    // =========================================================================

    public List<AnnotationRequest> getCurrentAnnotations() {
        return currentAnnotations == null ? null : Collections.unmodifiableList(currentAnnotations);
    }

    public void replaceAnnotations(List<AnnotationRequest> annotations) {
        this.currentAnnotations = new ArrayList<>(annotations);
    }

    public boolean hasAnnotations() {
        return currentAnnotations != null;
    }

    public int annotationCount() {
        return currentAnnotations == null ? 0 : currentAnnotations.size();
    }

    // =========================================================================
    // Lemmas (append-only)
    // =========================================================================

    public List<HelperLemma> getHelperLemmas() {
        return Collections.unmodifiableList(helperLemmas);
    }

    /**
     * Appends lemmas whose names are not known yet.
     *
     * @return number of lemmas actually added
     */
    public int appendLemmas(List<HelperLemma> lemmas) {
        Set<String> known = new LinkedHashSet<>();
        for (HelperLemma l : helperLemmas) known.add(l.getName());

        int added = 0;
        for (HelperLemma l : lemmas) {
            if (known.add(l.getName())) {
                helperLemmas.add(l);
                added++;
            } else {
                log.debug("[State] Lemma '{}' already present, skipped", l.getName());
            }
        }
        return added;
    }

    public List<String> getLemmaImports() {
        return Collections.unmodifiableList(lemmaImports);
    }

    public void addLemmaImports(List<String> imports) {
        for (String imp : imports) {
            if (imp != null && !imp.isBlank() && !lemmaImports.contains(imp.trim())) {
                lemmaImports.add(imp.trim());
            }
        }
    }

    // =========================================================================
    // Errors and counters
    // =========================================================================

    public String getLastError() { return lastError; }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getIterationsUsed()      { return iterationsUsed; }
    public int getLemmaIterationsUsed() { return lemmaIterationsUsed; }

    /** Verification rounds spent before the lemma phase. */
    public int getSpecIterationsUsed() {
        return iterationsUsed - lemmaIterationsUsed;
    }

    public void recordSpecIteration() {
        iterationsUsed++;
    }

    public void recordLemmaIteration() {
        iterationsUsed++;
        lemmaIterationsUsed++;
    }

    // =========================================================================
    // Attempt history (capped)
    // =========================================================================

    public void addAttempt(RepairAttempt attempt) {
        if (attempts.size() >= MAX_ATTEMPT_HISTORY) attempts.remove(0);
        attempts.add(attempt);
        log.debug("[State] RepairAttempt #{} recorded (outcome={}, history={})",
                attempt.getAttemptNumber(), attempt.getOutcome(), attempts.size());
    }

    public List<RepairAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    @Override
    public String toString() {
        return String.format("RepairState{phase=%s, iterations=%d (lemma=%d), annotations=%d, lemmas=%d}",
                phase, iterationsUsed, lemmaIterationsUsed, annotationCount(), helperLemmas.size());
    }
}
