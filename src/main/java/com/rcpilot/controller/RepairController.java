package com.rcpilot.controller;

import com.rcpilot.core.error.RepairConfigurationException;
import com.rcpilot.core.error.RepairException;
import com.rcpilot.orchestrator.CodebaseCoordinator;
import com.rcpilot.orchestrator.CodebaseReport;
import com.rcpilot.orchestrator.RepairReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/repair")
public class RepairController {

    private static final Logger log = LoggerFactory.getLogger(RepairController.class);

    private final CodebaseCoordinator coordinator;

    public RepairController(CodebaseCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/project")
    public ResponseEntity<CodebaseReport> repairProject(
            @RequestBody Map<String, Object> request
    ) {

        String project = stringValue(request.get("project"));

        if (project == null || project.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        CodebaseReport report = coordinator.repairProject(project.trim(), isTrue(request.get("resume")));

        return ResponseEntity.ok(report);
    }

    @PostMapping("/file")
    public ResponseEntity<RepairReport> repairFile(
            @RequestBody Map<String, Object> request
    ) {

        String project = stringValue(request.get("project"));
        String path    = stringValue(request.get("path"));

        if (project == null || project.trim().isEmpty() || path == null || path.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        RepairReport report = coordinator.repairFile(project.trim(), path.trim(), isTrue(request.get("resume")));

        return ResponseEntity.ok(report);
    }

    @ExceptionHandler(RepairException.class)
    public ResponseEntity<Map<String, String>> handleRepairException(RepairException e) {
        HttpStatus status = e instanceof RepairConfigurationException
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;

        log.warn("[Controller] {} ({}): {}", status.value(), e.getClass().getSimpleName(), e.getMessage());

        return ResponseEntity.status(status).body(Map.of(
                "error",   e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())));
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean isTrue(Object value) {
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
