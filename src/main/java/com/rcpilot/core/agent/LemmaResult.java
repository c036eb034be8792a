package com.rcpilot.core.agent;

import com.rcpilot.core.lemma.HelperLemma;

import java.util.List;

public final class LemmaResult {

    private final List<HelperLemma> lemmas;
    private final List<String>      imports;

    public LemmaResult(List<HelperLemma> lemmas, List<String> imports) {
        this.lemmas  = lemmas != null ? List.copyOf(lemmas) : List.of();
        this.imports = imports != null ? List.copyOf(imports) : List.of();
    }

    public List<HelperLemma> getLemmas()  { return lemmas; }
    public List<String>      getImports() { return imports; }
}
