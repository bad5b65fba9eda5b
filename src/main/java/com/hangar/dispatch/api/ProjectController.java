package com.hangar.dispatch.api;

import com.hangar.core.model.*;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for project lifecycle operations. Thin: every call goes
 * straight to {@link ProjectOrchestrator}; errors are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private static final Logger log = LoggerFactory.getLogger(ProjectController.class);

    private final ProjectOrchestrator orchestrator;

    public ProjectController(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * GET /api/v1/projects: filtered, newest first.
     */
    @GetMapping
    public ApiResponse<List<ProjectResponse>> list(@RequestParam(required = false) String status,
                                                   @RequestParam(required = false) String clientName,
                                                   @RequestParam(required = false) String search,
                                                   @RequestParam(required = false) Integer limit,
                                                   @RequestParam(required = false) Integer offset) {
        ProjectStatus statusFilter = status != null ? ProjectStatus.fromValue(status) : null;
        var projects = orchestrator.list(new ProjectQuery(statusFilter, clientName, search, limit, offset));
        return ApiResponse.list(projects.stream().map(p -> toResponse(p, null)).toList());
    }

    @GetMapping("/stats")
    public ApiResponse<ProjectStats> stats() {
        return ApiResponse.ok(orchestrator.stats());
    }

    /**
     * POST /api/v1/projects: create and start a project. 201 on success.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ProjectResponse>> create(@RequestBody CreateProjectInput input) {
        log.info("API create request for project '{}'", input.name());
        Project project = orchestrator.create(input);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(toResponse(project, null), "Project created"));
    }

    @GetMapping("/{idOrSlug}")
    public ApiResponse<ProjectResponse> get(@PathVariable String idOrSlug) {
        Project project = orchestrator.get(idOrSlug);
        RuntimeContainerInfo container = null;
        if (!project.isDeleted()) {
            try {
                container = orchestrator.containerInfo(idOrSlug).orElse(null);
            } catch (RuntimeException e) {
                log.debug("Container info unavailable for {}: {}", idOrSlug, e.getMessage());
            }
        }
        return ApiResponse.ok(toResponse(project, container));
    }

    @PatchMapping("/{idOrSlug}")
    public ApiResponse<ProjectResponse> update(@PathVariable String idOrSlug,
                                               @RequestBody UpdateProjectInput input) {
        return ApiResponse.ok(toResponse(orchestrator.update(idOrSlug, input), null), "Project updated");
    }

    @DeleteMapping("/{idOrSlug}")
    public ApiResponse<Void> delete(@PathVariable String idOrSlug,
                                    @RequestParam(defaultValue = "false") boolean keepData) {
        orchestrator.delete(idOrSlug, keepData);
        return ApiResponse.message(keepData ? "Project deleted, data kept" : "Project deleted");
    }

    @PostMapping("/{idOrSlug}/start")
    public ApiResponse<ProjectResponse> start(@PathVariable String idOrSlug) {
        return ApiResponse.ok(toResponse(orchestrator.start(idOrSlug), null), "Project started");
    }

    @PostMapping("/{idOrSlug}/stop")
    public ApiResponse<ProjectResponse> stop(@PathVariable String idOrSlug) {
        return ApiResponse.ok(toResponse(orchestrator.stop(idOrSlug), null), "Project stopped");
    }

    @PostMapping("/{idOrSlug}/restart")
    public ApiResponse<ProjectResponse> restart(@PathVariable String idOrSlug) {
        return ApiResponse.ok(toResponse(orchestrator.restart(idOrSlug), null), "Project restarted");
    }

    @GetMapping("/{idOrSlug}/logs")
    public ApiResponse<String> logs(@PathVariable String idOrSlug,
                                    @RequestParam(defaultValue = "100") int tail) {
        return ApiResponse.ok(orchestrator.logs(idOrSlug, tail));
    }

    @GetMapping("/{idOrSlug}/backups")
    public ApiResponse<List<BackupRecord>> listBackups(@PathVariable String idOrSlug) {
        return ApiResponse.list(orchestrator.listBackups(idOrSlug));
    }

    @PostMapping("/{idOrSlug}/backups")
    public ResponseEntity<ApiResponse<BackupRecord>> createBackup(@PathVariable String idOrSlug) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(orchestrator.createBackup(idOrSlug), "Backup created"));
    }

    @PostMapping("/{idOrSlug}/backups/{filename}/restore")
    public ApiResponse<ProjectResponse> restoreBackup(@PathVariable String idOrSlug,
                                                      @PathVariable String filename) {
        Project project = orchestrator.restoreBackup(idOrSlug, filename);
        return ApiResponse.ok(toResponse(project, null), "Backup restored");
    }

    @DeleteMapping("/{idOrSlug}/backups/{filename}")
    public ApiResponse<Void> deleteBackup(@PathVariable String idOrSlug, @PathVariable String filename) {
        orchestrator.deleteBackup(idOrSlug, filename);
        return ApiResponse.message("Backup deleted");
    }

    /**
     * POST /api/v1/projects/reconcile: re-sync recorded status with Docker.
     */
    @PostMapping("/reconcile")
    public ApiResponse<List<StatusCorrection>> reconcile() {
        return ApiResponse.list(orchestrator.reconcile());
    }

    private ProjectResponse toResponse(Project project, RuntimeContainerInfo container) {
        return ProjectResponse.of(project, orchestrator.urlOf(project), orchestrator.adminUrlOf(project), container);
    }
}
