package com.rcpilot.orchestrator;

import com.rcpilot.core.source.SourceFile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All C sources (.c and .h) of one project, keyed by project-relative path.
 *
 * The key set is fixed at load time. Each SourceFile is mutated only by the
 * flow repairing it; cross-file reads go through original text only.
 */
public class Codebase {

    private static final int MAX_CONTEXT_LINES_PER_FILE = 80;

    private final String                  project;
    private final Map<String, SourceFile> files;

    public Codebase(String project, List<SourceFile> sourceFiles) {
        this.project = project;
        Map<String, SourceFile> byPath = new LinkedHashMap<>();
        for (SourceFile f : sourceFiles) {
            byPath.put(f.getPath(), f);
        }
        this.files = Collections.unmodifiableMap(byPath);
    }

    public String getProject() {
        return project;
    }

    public Optional<SourceFile> find(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public List<SourceFile> getFiles() {
        return new ArrayList<>(files.values());
    }

    /** Files that get a repair flow. Headers only serve as context. */
    public List<String> getRepairTargets() {
        List<String> targets = new ArrayList<>();
        for (String path : files.keySet()) {
            if (path.endsWith(".c")) targets.add(path);
        }
        return targets;
    }

    /**
     * Excerpts of every other file in the project, headers first, for the
     * spec generator prompt.
     */
    public String relatedContext(String path) {
        StringBuilder headers = new StringBuilder();
        StringBuilder sources = new StringBuilder();

        for (SourceFile f : files.values()) {
            if (f.getPath().equals(path)) continue;
            StringBuilder target = f.getPath().endsWith(".h") ? headers : sources;
            target.append("// file: ").append(f.getPath()).append("\n");
            target.append(excerpt(f.getOriginalText())).append("\n");
        }
        return headers.append(sources).toString();
    }

    public int size() {
        return files.size();
    }

    private static String excerpt(String text) {
        String[] lines = text.split("\n", -1);
        if (lines.length <= MAX_CONTEXT_LINES_PER_FILE) return text;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < MAX_CONTEXT_LINES_PER_FILE; i++) {
            sb.append(lines[i]).append("\n");
        }
        sb.append("// [+").append(lines.length - MAX_CONTEXT_LINES_PER_FILE).append(" more lines]");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Codebase{project=" + project + ", files=" + files.size() + "}";
    }
}
