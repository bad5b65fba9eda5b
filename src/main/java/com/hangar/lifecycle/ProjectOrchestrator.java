package com.hangar.lifecycle;

import com.hangar.catalog.ProjectCatalog;
import com.hangar.config.HangarProperties;
import com.hangar.core.error.BootstrapTimeoutException;
import com.hangar.core.error.ConflictException;
import com.hangar.core.error.ResourceNotFoundException;
import com.hangar.core.error.RuntimeUnavailableException;
import com.hangar.core.error.ValidationException;
import com.hangar.core.logging.MdcContext;
import com.hangar.core.metrics.HangarMetrics;
import com.hangar.core.model.*;
import com.hangar.core.util.ByteSizes;
import com.hangar.core.util.SecretGenerator;
import com.hangar.runtime.ContainerRuntime;
import com.hangar.runtime.ResourceLimits;
import com.hangar.vault.CredentialReport;
import com.hangar.vault.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Project lifecycle state machine. Composes the container runtime, the
 * catalog and the credential vault; never touches Docker or the disk itself.
 *
 * <pre>
 * creating -> running | error
 * running  <-> stopped
 * running | stopped | error -> running   (restart)
 * any non-deleted -> deleted              (terminal)
 * </pre>
 *
 * <p>Every operation accepts a project id or a slug. Operations on one
 * project are serialized by {@link ProjectLocks}; creation is serialized
 * across the slug check and the first write so two requests for the same
 * slug cannot both succeed.
 */
@Service
public class ProjectOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProjectOrchestrator.class);

    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_CLIENT_NAME_LENGTH = 100;
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    static final String ADMIN_PATH = "/_/";

    private final ContainerRuntime runtime;
    private final ProjectCatalog catalog;
    private final CredentialVault vault;
    private final CredentialReport credentialReport;
    private final AdminBootstrapper bootstrapper;
    private final ProjectLocks locks;
    private final HangarProperties properties;
    private final Clock clock;
    private final HangarMetrics metrics;

    private final ReentrantLock createLock = new ReentrantLock();

    public ProjectOrchestrator(ContainerRuntime runtime, ProjectCatalog catalog, CredentialVault vault,
                               CredentialReport credentialReport, AdminBootstrapper bootstrapper,
                               ProjectLocks locks, HangarProperties properties, Clock clock,
                               @Autowired(required = false) HangarMetrics metrics) {
        this.runtime = runtime;
        this.catalog = catalog;
        this.vault = vault;
        this.credentialReport = credentialReport;
        this.bootstrapper = bootstrapper;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Seeds the port reservation set from the ports recorded in the catalog,
     * then prepares the runtime, which adds the ports of managed containers.
     * Catalog ports stay reserved even when the runtime is unreachable.
     *
     * @throws RuntimeUnavailableException if the Docker daemon cannot be reached
     */
    public void initialize() {
        List<Integer> recorded = catalog.getAll().stream()
                .filter(p -> !p.isDeleted() && p.getPort() > 0)
                .map(Project::getPort)
                .toList();
        runtime.markPortsInUse(recorded);
        runtime.initialize();
        log.info("Orchestrator initialized with {} projects", catalog.getAll().size());
    }

    // -- create ----------------------------------------------------------

    public Project create(CreateProjectInput input) {
        validateName(input.name());
        validateDetails(input.description(), input.clientName(), input.clientEmail());
        String slug = input.slug() != null && !input.slug().isBlank()
                ? input.slug().trim()
                : SlugGenerator.fromName(input.name());
        SlugGenerator.validate(slug);

        ProjectConfig config = defaultConfig().merge(input.config());
        ResourceLimits.validate(config);

        Project project;
        createLock.lock();
        try {
            if (catalog.getBySlug(slug).filter(p -> !p.isDeleted()).isPresent()) {
                throw new ConflictException("Project with slug '" + slug + "' already exists");
            }
            var draft = new Project();
            draft.setId(newProjectId());
            draft.setName(input.name().trim());
            draft.setSlug(slug);
            draft.setDescription(input.description());
            draft.setClientName(input.clientName());
            draft.setClientEmail(input.clientEmail());
            draft.setStatus(ProjectStatus.CREATING);
            draft.setContainerName("");
            draft.setPort(0);
            draft.setDomain(slug + "." + properties.getDomain().getBaseDomain());
            draft.setConfig(config);
            if (input.metadata() != null) {
                draft.setMetadata(new LinkedHashMap<>(input.metadata()));
            }
            project = catalog.save(draft);
        } finally {
            createLock.unlock();
        }

        MdcContext.setProject(project);
        MdcContext.setOperation("create");
        log.info("Creating project {} ({})", project.getName(), project.getSlug());
        boolean success = false;
        try {
            Project created = locks.withLock(project.getId(), () -> provision(project));
            success = true;
            return created;
        } finally {
            record("create", success);
            MdcContext.clear();
        }
    }

    private Project provision(Project project) {
        Project running;
        try {
            runtime.pullImage(properties.getDocker().getImage());

            ContainerHandle handle = runtime.createContainer(project.getId(), project.getSlug(), project.getConfig());
            project.setContainerName(handle.containerName());
            project.setPort(handle.port());
            catalog.save(project);

            runtime.startContainer(handle.containerName());
            project.setStatus(ProjectStatus.RUNNING);
            running = catalog.save(project);
        } catch (RuntimeException e) {
            log.error("Failed to create project {}: {}", project.getSlug(), e.getMessage(), e);
            project.setStatus(ProjectStatus.ERROR);
            try {
                catalog.save(project);
            } catch (RuntimeException saveFailure) {
                e.addSuppressed(saveFailure);
            }
            throw e;
        }

        bootstrapAdmin(running);
        log.info("Project {} is running on port {}", running.getSlug(), running.getPort());
        return running;
    }

    /**
     * Best effort: a project whose admin could not be provisioned is still usable.
     */
    private void bootstrapAdmin(Project project) {
        if (!properties.getBootstrap().isEnabled()) {
            log.info("Admin bootstrap disabled, skipping for {}", project.getSlug());
            return;
        }
        String email = adminEmailFor(project, null);
        String password = SecretGenerator.password();
        try {
            bootstrapper.bootstrap(project.getContainerName(), email, password);
            vault.store(project.getId(), project.getName(), project.getSlug(),
                    vaultDomain(project), email, password);
        } catch (BootstrapTimeoutException e) {
            log.error("{}. Provision it manually with 'hangar create-admin {}' or "
                            + "'docker exec {} {} superuser upsert <email> <password>'",
                    e.getMessage(), project.getSlug(), project.getContainerName(),
                    properties.getBootstrap().getBinary(), e);
        } catch (RuntimeException e) {
            log.error("Admin bootstrap for {} failed: {}", project.getSlug(), e.getMessage(), e);
        }
    }

    // -- queries ---------------------------------------------------------

    /**
     * @throws ResourceNotFoundException when neither an id nor a slug matches
     */
    public Project get(String idOrSlug) {
        return find(idOrSlug).orElseThrow(() -> new ResourceNotFoundException("Project", idOrSlug));
    }

    public Optional<Project> find(String idOrSlug) {
        if (idOrSlug == null || idOrSlug.isBlank()) {
            return Optional.empty();
        }
        return catalog.get(idOrSlug).or(() -> catalog.getBySlug(idOrSlug));
    }

    /**
     * Newest first. Deleted projects are only listed when asked for by status.
     */
    public List<Project> list(ProjectQuery query) {
        var q = query != null ? query : ProjectQuery.all();
        String client = lower(q.clientName());
        String search = lower(q.search());

        var matches = catalog.getAll().stream()
                .filter(p -> q.status() != null ? p.getStatus() == q.status() : !p.isDeleted())
                .filter(p -> client == null || contains(p.getClientName(), client))
                .filter(p -> search == null || contains(p.getName(), search)
                        || contains(p.getSlug(), search) || contains(p.getDescription(), search))
                .sorted(Comparator.comparing(Project::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();

        int offset = q.offset() != null ? Math.max(0, q.offset()) : 0;
        if (offset >= matches.size()) {
            return List.of();
        }
        int end = q.limit() != null && q.limit() > 0
                ? Math.min(matches.size(), offset + q.limit())
                : matches.size();
        return matches.subList(offset, end);
    }

    private static String lower(String s) {
        return s == null || s.isBlank() ? null : s.toLowerCase(Locale.ROOT);
    }

    private static boolean contains(String haystack, String needleLower) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needleLower);
    }

    public Optional<RuntimeContainerInfo> containerInfo(String idOrSlug) {
        Project project = get(idOrSlug);
        if (!project.hasContainer()) {
            return Optional.empty();
        }
        return runtime.getContainerInfo(project.getContainerName());
    }

    // -- update / delete -------------------------------------------------

    /**
     * Merges the update over the record. Limit changes apply the next time
     * the container is created; the running container is left as it is.
     */
    public Project update(String idOrSlug, UpdateProjectInput input) {
        return withProject("update", idOrSlug, false, project -> {
            if (input.name() != null) {
                validateName(input.name());
                project.setName(input.name().trim());
            }
            validateDetails(input.description(), input.clientName(), input.clientEmail());
            if (input.description() != null) project.setDescription(input.description());
            if (input.clientName() != null) project.setClientName(input.clientName());
            if (input.clientEmail() != null) project.setClientEmail(input.clientEmail());
            if (input.config() != null) {
                ProjectConfig current = project.getConfig() != null ? project.getConfig() : defaultConfig();
                ProjectConfig merged = current.merge(input.config());
                ResourceLimits.validate(merged);
                project.setConfig(merged);
            }
            if (input.metadata() != null) {
                var metadata = new LinkedHashMap<String, Object>(project.getMetadata());
                metadata.putAll(input.metadata());
                project.setMetadata(metadata);
            }
            Project saved = catalog.save(project);
            if (input.name() != null) {
                vault.get(saved.getId()).ifPresent(c ->
                        vault.update(saved.getId(), new CredentialsUpdate(saved.getName(), null, null, null, null)));
            }
            log.info("Updated project {}", saved.getSlug());
            return saved;
        });
    }

    /**
     * Removes the container (failures logged), then either marks the record
     * deleted ({@code keepData}) or purges record, files and credentials.
     */
    public void delete(String idOrSlug, boolean keepData) {
        String projectId = get(idOrSlug).getId();
        withProject("delete", idOrSlug, true, project -> {
            if (project.hasContainer() && !project.isDeleted()) {
                try {
                    runtime.removeContainer(project.getContainerName());
                } catch (RuntimeException e) {
                    log.warn("Could not remove container {}: {}", project.getContainerName(), e.getMessage());
                }
            }
            if (keepData) {
                if (!project.isDeleted()) {
                    project.setStatus(ProjectStatus.DELETED);
                    catalog.save(project);
                }
                log.info("Project {} marked deleted, data kept", project.getSlug());
            } else {
                catalog.delete(project.getId());
                vault.delete(project.getId());
                log.info("Project {} deleted with its data", project.getSlug());
            }
            return null;
        });
        if (!keepData) {
            locks.release(projectId);
        }
    }

    // -- lifecycle -------------------------------------------------------

    /**
     * No-op when the project is already running.
     */
    public Project start(String idOrSlug) {
        return withProject("start", idOrSlug, false, project -> {
            if (project.getStatus() == ProjectStatus.RUNNING) {
                log.info("Project {} is already running", project.getSlug());
                return project;
            }
            requireContainer(project);
            runtime.startContainer(project.getContainerName());
            project.setStatus(ProjectStatus.RUNNING);
            log.info("Started project {}", project.getSlug());
            return catalog.save(project);
        });
    }

    /**
     * No-op when the project is already stopped.
     */
    public Project stop(String idOrSlug) {
        return withProject("stop", idOrSlug, false, project -> {
            if (project.getStatus() == ProjectStatus.STOPPED) {
                log.info("Project {} is already stopped", project.getSlug());
                return project;
            }
            requireContainer(project);
            runtime.stopContainer(project.getContainerName());
            project.setStatus(ProjectStatus.STOPPED);
            log.info("Stopped project {}", project.getSlug());
            return catalog.save(project);
        });
    }

    /**
     * Always restarts the container and leaves the project running.
     */
    public Project restart(String idOrSlug) {
        return withProject("restart", idOrSlug, false, project -> {
            requireContainer(project);
            runtime.restartContainer(project.getContainerName());
            project.setStatus(ProjectStatus.RUNNING);
            log.info("Restarted project {}", project.getSlug());
            return catalog.save(project);
        });
    }

    public String logs(String idOrSlug, int tailLines) {
        if (tailLines < 1) {
            throw new ValidationException("tail must be at least 1, was " + tailLines);
        }
        return withProject("logs", idOrSlug, false, project -> {
            requireContainer(project);
            return runtime.getContainerLogs(project.getContainerName(), tailLines);
        });
    }

    private static void requireContainer(Project project) {
        if (!project.hasContainer()) {
            throw new ConflictException("Project " + project.getSlug()
                    + " has no container (status " + project.getStatus().value() + "); delete and recreate it");
        }
    }

    // -- backups ---------------------------------------------------------

    public List<BackupRecord> listBackups(String idOrSlug) {
        return catalog.listBackups(get(idOrSlug).getId());
    }

    /**
     * Stops a running project for the duration of the backup and always
     * starts it again, whether or not the backup succeeded.
     */
    public BackupRecord createBackup(String idOrSlug) {
        return withProject("backup", idOrSlug, false, project ->
                withContainerStopped(project, "backup", () -> catalog.createBackup(project)));
    }

    /**
     * Same stop/restart discipline as {@link #createBackup}.
     */
    public Project restoreBackup(String idOrSlug, String backup) {
        return withProject("restore", idOrSlug, false, project -> {
            catalog.backupPath(project.getId(), backup);
            withContainerStopped(project, "restore", () -> {
                catalog.restoreBackup(project.getId(), backup);
                return null;
            });
            return catalog.get(project.getId()).orElse(project);
        });
    }

    public void deleteBackup(String idOrSlug, String backup) {
        Project project = get(idOrSlug);
        catalog.deleteBackup(project.getId(), backup);
    }

    private <T> T withContainerStopped(Project project, String kind, Supplier<T> dataOperation) {
        boolean wasRunning = project.getStatus() == ProjectStatus.RUNNING && project.hasContainer();
        long startedAt = clock.millis();
        if (wasRunning) {
            log.info("Stopping {} for {}", project.getSlug(), kind);
            runtime.stopContainer(project.getContainerName());
        }
        RuntimeException failure = null;
        try {
            return dataOperation.get();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            if (wasRunning) {
                resumeAfter(project, kind, failure);
            }
            if (metrics != null) {
                metrics.recordDataOperation(kind, clock.millis() - startedAt);
            }
        }
    }

    private void resumeAfter(Project project, String kind, RuntimeException failure) {
        try {
            runtime.startContainer(project.getContainerName());
            log.info("Started {} again after {}", project.getSlug(), kind);
        } catch (RuntimeException e) {
            log.error("Could not start {} after {}: {}", project.getSlug(), kind, e.getMessage(), e);
            project.setStatus(ProjectStatus.ERROR);
            catalog.save(project);
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                throw e;
            }
        }
    }

    // -- reconciliation --------------------------------------------------

    /**
     * Aligns every non-deleted project's status with what the runtime reports.
     * Never throws; a project that cannot be inspected is marked {@code error}.
     *
     * @return the corrections applied
     */
    public List<StatusCorrection> reconcile() {
        var corrections = new ArrayList<StatusCorrection>();
        for (Project snapshot : catalog.getAll()) {
            if (snapshot.isDeleted()) continue;
            try {
                StatusCorrection correction = locks.withLock(snapshot.getId(), () -> reconcileOne(snapshot.getId()));
                if (correction != null) {
                    corrections.add(correction);
                }
            } catch (RuntimeException e) {
                log.warn("Could not reconcile project {}: {}", snapshot.getSlug(), e.getMessage());
            }
        }
        log.info("Reconciliation finished: {} correction(s)", corrections.size());
        return corrections;
    }

    private StatusCorrection reconcileOne(String projectId) {
        Project project = catalog.get(projectId).orElse(null);
        if (project == null || project.isDeleted()) {
            return null;
        }
        ProjectStatus observed = observedStatus(project);
        ProjectStatus recorded = project.getStatus();
        if (observed == recorded) {
            return null;
        }
        MdcContext.setProject(project);
        MdcContext.setOperation("reconcile");
        try {
            log.info("Correcting status of {}: {} -> {}", project.getSlug(), recorded.value(), observed.value());
            project.setStatus(observed);
            catalog.save(project);
            if (metrics != null) {
                metrics.recordStatusCorrection(recorded.value(), observed.value());
            }
            return new StatusCorrection(project.getId(), project.getSlug(), recorded, observed);
        } finally {
            MdcContext.clear();
        }
    }

    private ProjectStatus observedStatus(Project project) {
        if (!project.hasContainer()) {
            return ProjectStatus.ERROR;
        }
        try {
            return runtime.getContainerInfo(project.getContainerName())
                    .map(info -> info.running() ? ProjectStatus.RUNNING : ProjectStatus.STOPPED)
                    .orElse(ProjectStatus.ERROR);
        } catch (RuntimeException e) {
            log.debug("Inspecting {} failed: {}", project.getContainerName(), e.getMessage());
            return ProjectStatus.ERROR;
        }
    }

    // -- stats and URLs --------------------------------------------------

    public ProjectStats stats() {
        var projects = catalog.getAll().stream().filter(p -> !p.isDeleted()).toList();
        int running = count(projects, ProjectStatus.RUNNING);
        int stopped = count(projects, ProjectStatus.STOPPED);
        int errored = count(projects, ProjectStatus.ERROR);

        long storage = catalog.getStorageStats().totalSize();

        long memory = 0;
        try {
            for (RuntimeContainerInfo info : runtime.listManaged()) {
                if (info.running()) {
                    memory += info.memoryUsageBytes();
                }
            }
        } catch (RuntimeException e) {
            log.warn("Memory usage unavailable: {}", e.getMessage());
        }

        return new ProjectStats(projects.size(), running, stopped, errored,
                storage, ByteSizes.format(storage), memory, ByteSizes.format(memory));
    }

    private static int count(List<Project> projects, ProjectStatus status) {
        return (int) projects.stream().filter(p -> p.getStatus() == status).count();
    }

    public String resolveUrl(String idOrSlug) {
        return urlOf(get(idOrSlug));
    }

    public String resolveAdminUrl(String idOrSlug) {
        return adminUrlOf(get(idOrSlug));
    }

    /**
     * Public domain when one is configured, otherwise the published localhost port.
     */
    public String urlOf(Project project) {
        if (properties.hasPublicDomain() && project.getDomain() != null && !project.getDomain().isBlank()) {
            String scheme = properties.getDomain().isUseHttps() ? "https" : "http";
            return scheme + "://" + project.getDomain();
        }
        return "http://localhost:" + project.getPort();
    }

    public String adminUrlOf(Project project) {
        return urlOf(project) + ADMIN_PATH;
    }

    // -- credentials -----------------------------------------------------

    public Credentials credentials(String idOrSlug) {
        Project project = get(idOrSlug);
        return vault.get(project.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Credentials", project.getSlug()));
    }

    public List<Credentials> allCredentials() {
        return vault.getAll();
    }

    public String exportCredentials() {
        return credentialReport.render(vault.getAll());
    }

    /**
     * Creates or resets the superuser of a running project and records it.
     *
     * @param email    admin email, or {@code null} for the project's default
     * @param password admin password, or {@code null} to generate one
     */
    public Credentials provisionAdmin(String idOrSlug, String email, String password) {
        return withProject("create-admin", idOrSlug, false, project -> {
            if (project.getStatus() != ProjectStatus.RUNNING) {
                throw new ConflictException("Project " + project.getSlug() + " must be running to provision an admin");
            }
            String adminEmail = adminEmailFor(project, email);
            String adminPassword = password != null && !password.isBlank() ? password : SecretGenerator.password();
            bootstrapper.provision(project.getContainerName(), adminEmail, adminPassword);
            return vault.store(project.getId(), project.getName(), project.getSlug(),
                    vaultDomain(project), adminEmail, adminPassword);
        });
    }

    private String adminEmailFor(Project project, String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        if (project.getClientEmail() != null && !project.getClientEmail().isBlank()) {
            return project.getClientEmail();
        }
        return properties.getBootstrap().getAdminEmail();
    }

    private String vaultDomain(Project project) {
        return properties.hasPublicDomain() ? project.getDomain() : urlOf(project);
    }

    // -- helpers ---------------------------------------------------------

    private <T> T withProject(String operation, String idOrSlug, boolean allowDeleted, Function<Project, T> action) {
        Project project = get(idOrSlug);
        MdcContext.setProject(project);
        MdcContext.setOperation(operation);
        boolean success = false;
        try {
            T result = locks.withLock(project.getId(), () -> {
                Project current = catalog.get(project.getId())
                        .orElseThrow(() -> new ResourceNotFoundException("Project", idOrSlug));
                if (current.isDeleted() && !allowDeleted) {
                    throw new ConflictException("Project " + current.getSlug() + " is deleted");
                }
                return action.apply(current);
            });
            success = true;
            return result;
        } finally {
            record(operation, success);
            MdcContext.clear();
        }
    }

    private void record(String operation, boolean success) {
        if (metrics != null) {
            metrics.recordOperation(operation, success);
        }
    }

    private ProjectConfig defaultConfig() {
        var defaults = properties.getDefaults();
        return new ProjectConfig(defaults.getMemoryLimit(), defaults.getCpuLimit(), defaults.isAutoBackup(),
                null, null, EnabledFeatures.allEnabled());
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Project name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Project name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private static void validateDetails(String description, String clientName, String clientEmail) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (clientName != null && clientName.length() > MAX_CLIENT_NAME_LENGTH) {
            throw new ValidationException("Client name must be at most " + MAX_CLIENT_NAME_LENGTH + " characters");
        }
        if (clientEmail != null && !clientEmail.isBlank() && !EMAIL.matcher(clientEmail.trim()).matches()) {
            throw new ValidationException("Invalid client email: " + clientEmail);
        }
    }

    private String newProjectId() {
        String id;
        do {
            id = SecretGenerator.alphanumeric(12);
        } while (catalog.get(id).isPresent());
        return id;
    }
}
