package com.rcpilot.core.filesystem;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.error.RepairPersistenceException;
import com.rcpilot.core.state.RepairState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stores each file's resumable {@link RepairState} as JSON under the project's
 * artifact directory.
 */
@Component
public class RepairStateStore {

    private static final Logger log = LoggerFactory.getLogger(RepairStateStore.class);

    private final FileSystemManager    artifacts;
    private final ArtifactPathResolver paths;
    private final ObjectMapper         objectMapper;

    public RepairStateStore(FileSystemManager artifacts,
                            ArtifactPathResolver paths,
                            ObjectMapper objectMapper) {
        this.artifacts    = artifacts;
        this.paths        = paths;
        this.objectMapper = objectMapper;
    }

    public void save(String project, String relativePath, RepairState state) {
        String target = paths.statePath(project, relativePath);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
            artifacts.writeFile(target, json);
            log.debug("[StateStore] Saved {} ({})", target, state);
        } catch (JsonProcessingException | FileSystemManager.FileSystemException e) {
            throw new RepairPersistenceException(relativePath,
                    "Failed to store repair state: " + e.getMessage(), e);
        }
    }

    /**
     * Load a stored state. A missing file means "start fresh".
     *
     * @throws RepairConfigurationException if a state file exists but cannot be
     *         read; resuming without it would hand the flow a full budget again
     */
    public Optional<RepairState> load(String project, String relativePath) {
        String source = paths.statePath(project, relativePath);
        if (!artifacts.fileExists(source)) {
            return Optional.empty();
        }
        try {
            RepairState state = objectMapper.readValue(artifacts.readFile(source), RepairState.class);
            log.info("[StateStore] Resuming {} from {}", relativePath, state);
            return Optional.of(state);
        } catch (JsonProcessingException | FileSystemManager.FileSystemException e) {
            log.error("[StateStore] Unreadable state {}: {}", source, e.getMessage());
            throw new RepairConfigurationException(relativePath,
                    "Stored repair state " + source + " is unreadable: " + e.getMessage(), e);
        }
    }
}
