package com.rcpilot.orchestrator;

import com.rcpilot.core.diagnostic.DiagnosticSet;
import com.rcpilot.core.lemma.HelperLemma;
import com.rcpilot.core.state.RepairState;

import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of one file's repair flow. Always carries the best text
 * the flow reached and the state to resume from, success or not.
 */
public final class RepairReport {

    private final String               path;
    private final boolean              success;
    private final int                  iterationsTotal;
    private final String               finalText;
    private final List<HelperLemma>    helperLemmas;
    private final Map<String, Integer> annotationLocations;
    private final String               errorMessage;
    private final String               suggestions;
    private final DiagnosticSet        lastDiagnostics;
    private final RepairState          resumableState;

    private RepairReport(String path, boolean success, String finalText, Map<String, Integer> locations,
                         String errorMessage, String suggestions, DiagnosticSet lastDiagnostics,
                         RepairState state) {
        this.path                = path;
        this.success             = success;
        this.iterationsTotal     = state.getIterationsUsed();
        this.finalText           = finalText;
        this.helperLemmas        = List.copyOf(state.getHelperLemmas());
        this.annotationLocations = Map.copyOf(locations);
        this.errorMessage        = errorMessage;
        this.suggestions         = suggestions;
        this.lastDiagnostics     = lastDiagnostics;
        this.resumableState      = state.copy();
    }

    static RepairReport success(String path, String finalText, Map<String, Integer> locations,
                                RepairState state) {
        return new RepairReport(path, true, finalText, locations, null, null, null, state);
    }

    static RepairReport failure(String path, String finalText, Map<String, Integer> locations,
                                RepairState state, String errorMessage, String suggestions,
                                DiagnosticSet lastDiagnostics) {
        return new RepairReport(path, false, finalText, locations, errorMessage, suggestions,
                lastDiagnostics, state);
    }

    public String               getPath()                { return path; }
    public boolean              isSuccess()              { return success; }
    public int                  getIterationsTotal()     { return iterationsTotal; }
    public String               getFinalText()           { return finalText; }
    public List<HelperLemma>    getHelperLemmas()        { return helperLemmas; }
    public Map<String, Integer> getAnnotationLocations() { return annotationLocations; }
    public String               getErrorMessage()        { return errorMessage; }
    public String               getSuggestions()         { return suggestions; }
    public DiagnosticSet        getLastDiagnostics()     { return lastDiagnostics; }
    public RepairState          getResumableState()      { return resumableState; }

    @Override
    public String toString() {
        return String.format("RepairReport{path=%s, success=%b, iterations=%d, lemmas=%d}",
                path, success, iterationsTotal, helperLemmas.size());
    }
}
