package com.rcpilot.orchestrator;

import com.rcpilot.config.RepairConfig;
import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.filesystem.FileSystemManager;
import com.rcpilot.core.source.SourceFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Discovers a project's C sources below {@code <sources-dir>/<project>}.
 */
@Component
public class CodebaseLoader {

    private static final Logger log = LoggerFactory.getLogger(CodebaseLoader.class);

    private final FileSystemManager sources;

    public CodebaseLoader(RepairConfig config) {
        this.sources = new FileSystemManager(config.getSourcesDir());
    }

    public Codebase load(String project) {
        if (project == null || project.isBlank() || project.contains("/") || project.contains("..")) {
            throw new RepairConfigurationException(null, "Invalid project name: " + project);
        }
        if (!sources.isDirectory(project)) {
            throw new RepairConfigurationException(null,
                    "Project directory not found: " + sources.getRootPath().resolve(project));
        }

        try {
            List<String> paths = sources.findFiles(project, p -> {
                String name = p.getFileName().toString();
                return name.endsWith(".c") || name.endsWith(".h");
            });

            List<SourceFile> files = new ArrayList<>();
            for (String rel : paths) {
                files.add(new SourceFile(rel, sources.readFile(project + "/" + rel)));
            }

            Codebase codebase = new Codebase(project, files);
            log.info("[Loader] Loaded {} ({} repair targets)", codebase, codebase.getRepairTargets().size());
            return codebase;

        } catch (FileSystemManager.FileSystemException e) {
            throw new RepairConfigurationException(null,
                    "Failed to load project " + project + ": " + e.getMessage(), e);
        }
    }
}
