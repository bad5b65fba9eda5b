package com.hangar.core.health;

import com.hangar.catalog.ProjectCatalog;
import com.hangar.config.StorageLayout;
import com.hangar.core.model.Project;
import com.hangar.core.model.ProjectStatus;
import com.hangar.runtime.ContainerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the Docker daemon, the storage directories and the recorded
 * project states. Each check reports instead of throwing.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ContainerRuntime runtime;
    private final StorageLayout layout;
    private final ProjectCatalog catalog;

    public HealthCheckService(ContainerRuntime runtime, StorageLayout layout, ProjectCatalog catalog) {
        this.runtime = runtime;
        this.layout = layout;
        this.catalog = catalog;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDocker());
        results.add(checkStorage());
        results.add(checkProjects());
        return results;
    }

    private HealthStatus checkDocker() {
        try {
            runtime.ping();
            return HealthStatus.up("docker", "Docker daemon reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return HealthStatus.down("docker", "Docker error: " + e.getMessage());
        }
    }

    private HealthStatus checkStorage() {
        var unwritable = new ArrayList<String>();
        for (Path dir : List.of(layout.dataDir(), layout.backupsDir())) {
            if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
                unwritable.add(dir.toString());
            }
        }
        if (unwritable.isEmpty()) {
            return HealthStatus.up("storage", "Data and backup directories writable",
                    Map.of("dataDir", layout.dataDir().toString(), "backupsDir", layout.backupsDir().toString()));
        }
        return HealthStatus.down("storage", "Not writable: " + String.join(", ", unwritable));
    }

    private HealthStatus checkProjects() {
        List<Project> projects = catalog.getAll().stream().filter(p -> !p.isDeleted()).toList();
        long running = projects.stream().filter(p -> p.getStatus() == ProjectStatus.RUNNING).count();
        long errored = projects.stream().filter(p -> p.getStatus() == ProjectStatus.ERROR).count();
        var metadata = Map.of(
                "total", String.valueOf(projects.size()),
                "running", String.valueOf(running),
                "error", String.valueOf(errored));
        String detail = projects.size() + " projects, " + running + " running, " + errored + " in error";
        if (errored > 0) {
            return new HealthStatus("projects", HealthStatus.Status.DEGRADED, detail, metadata);
        }
        return HealthStatus.up("projects", detail, metadata);
    }
}
