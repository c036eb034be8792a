package com.rcpilot.core.filesystem;

import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.lemma.LemmaFileWriter;

import org.springframework.stereotype.Component;

/**
 * Maps (project, relative source path) to locations under the artifacts root.
 *
 *   artifact   project/rel/path.c
 *   lemma file project/rel/proofs/path/path_lemmas.v
 *   state      project/_rcpilot/state/rel/path.c.json
 *   report     project/rcpilot_report.json
 *
 * The artifact mapping mirrors the normalized relative path, so distinct
 * logical paths never share an artifact. All results are relative to the
 * artifacts root.
 */
@Component
public class ArtifactPathResolver {

    static final String STATE_DIR   = "_rcpilot/state";
    static final String REPORT_FILE = "rcpilot_report.json";

    public String artifactPath(String project, String relativePath) {
        return checkProject(project) + "/" + normalize(project, relativePath);
    }

    public String lemmaFilePath(String project, String relativePath) {
        String rel  = normalize(project, relativePath);
        int    cut  = rel.lastIndexOf('/');
        String dir  = cut >= 0 ? rel.substring(0, cut + 1) : "";
        String stem = stem(rel);
        return checkProject(project) + "/" + dir + "proofs/" + stem + "/" + LemmaFileWriter.fileName(stem);
    }

    public String statePath(String project, String relativePath) {
        return checkProject(project) + "/" + STATE_DIR + "/" + normalize(project, relativePath) + ".json";
    }

    public String reportPath(String project) {
        return checkProject(project) + "/" + REPORT_FILE;
    }

    /**
     * Canonical form of a project-relative path: '/'-separated, no "." segments,
     * no leading "./". Absolute paths and ".." segments are configuration errors.
     */
    public String normalize(String project, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new RepairConfigurationException(relativePath, "Empty source path in project " + project);
        }
        String p = relativePath.trim().replace('\\', '/');
        if (p.startsWith("/") || p.matches("^[A-Za-z]:/.*")) {
            throw new RepairConfigurationException(relativePath, "Absolute source path not allowed: " + relativePath);
        }

        StringBuilder sb = new StringBuilder();
        for (String segment : p.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) continue;
            if (segment.equals("..")) {
                throw new RepairConfigurationException(relativePath,
                        "Source path escapes project " + project + ": " + relativePath);
            }
            if (sb.length() > 0) sb.append('/');
            sb.append(segment);
        }
        if (sb.length() == 0) {
            throw new RepairConfigurationException(relativePath, "Empty source path in project " + project);
        }
        return sb.toString();
    }

    private static String stem(String relativePath) {
        String name = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private String checkProject(String project) {
        if (project == null || project.isBlank() || project.contains("/") || project.contains("\\")
                || project.equals(".") || project.equals("..")) {
            throw new RepairConfigurationException(null, "Invalid project name: " + project);
        }
        return project.trim();
    }
}
