package com.rcpilot.core.agent;

import com.rcpilot.core.insertion.AnnotationRequest;

import java.util.List;

public final class SpecResult {

    private final List<AnnotationRequest> annotations;
    private final String                  explanation;

    public SpecResult(List<AnnotationRequest> annotations, String explanation) {
        this.annotations = annotations != null ? List.copyOf(annotations) : List.of();
        this.explanation = explanation != null ? explanation : "";
    }

    public List<AnnotationRequest> getAnnotations() { return annotations; }
    public String                  getExplanation() { return explanation; }
}
