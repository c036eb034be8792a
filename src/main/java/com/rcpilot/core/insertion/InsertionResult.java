package com.rcpilot.core.insertion;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one insertion pass.
 *
 *   placed         — inserted by this pass
 *   alreadyPresent — text was in the file verbatim, left alone
 *   unplaced       — no point resolved; the caller decides the fallback
 *   locations      — annotation text → 1-based line in {@link #getText()}
 */
public final class InsertionResult {

    private final String                  text;
    private final List<AnnotationRequest> placed;
    private final List<AnnotationRequest> alreadyPresent;
    private final List<AnnotationRequest> unplaced;
    private final Map<String, Integer>    locations;

    InsertionResult(String text,
                    List<AnnotationRequest> placed,
                    List<AnnotationRequest> alreadyPresent,
                    List<AnnotationRequest> unplaced,
                    Map<String, Integer> locations) {
        this.text           = text;
        this.placed         = Collections.unmodifiableList(placed);
        this.alreadyPresent = Collections.unmodifiableList(alreadyPresent);
        this.unplaced       = Collections.unmodifiableList(unplaced);
        this.locations      = Collections.unmodifiableMap(locations);
    }

    public String                  getText()           { return text; }
    public List<AnnotationRequest> getPlaced()         { return placed; }
    public List<AnnotationRequest> getAlreadyPresent() { return alreadyPresent; }
    public List<AnnotationRequest> getUnplaced()       { return unplaced; }
    public Map<String, Integer>    getLocations()      { return locations; }

    public boolean hasUnplaced() {
        return !unplaced.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("InsertionResult{placed=%d, alreadyPresent=%d, unplaced=%d}",
                placed.size(), alreadyPresent.size(), unplaced.size());
    }
}
