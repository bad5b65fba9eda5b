package com.hangar.catalog;

import com.hangar.config.StorageLayout;
import com.hangar.core.error.ResourceNotFoundException;
import com.hangar.core.error.StorageException;
import com.hangar.core.error.ValidationException;
import com.hangar.core.model.BackupRecord;
import com.hangar.core.model.Project;
import com.hangar.core.model.StorageStats;
import com.hangar.core.persistence.JsonFileStore;
import com.hangar.core.persistence.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Stream;

/**
 * Durable store of project records plus backup archives of each project's
 * directory.
 *
 * <p>Records live in {@code metadata.json} at the data-directory root, loaded
 * once and rewritten whole after every mutation. Callers always receive
 * copies; mutate and {@link #save} to persist.
 */
@Service
public class ProjectCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProjectCatalog.class);

    static final String BACKUP_EXTENSION = ".tar.gz";

    private static final DateTimeFormatter BACKUP_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

    private final StorageLayout layout;
    private final BackupArchiver archiver;
    private final Clock clock;
    private final JsonFileStore<CatalogDocument> store;

    private CatalogDocument document = new CatalogDocument();

    public ProjectCatalog(StorageLayout layout, BackupArchiver archiver, Clock clock) {
        this.layout = layout;
        this.archiver = archiver;
        this.clock = clock;
        this.store = new JsonFileStore<>(layout.catalogFile(), CatalogDocument.class,
                CatalogDocument::new, JsonMappers.create(), clock);
    }

    @PostConstruct
    public synchronized void initialize() {
        try {
            Files.createDirectories(layout.dataDir());
            Files.createDirectories(layout.backupsDir());
            Files.createDirectories(layout.projectsDir());
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories under " + layout.dataDir(), e);
        }
        document = store.load();
        log.info("Catalog loaded: {} projects from {}", document.getProjects().size(), store.getFile());
    }

    /**
     * Upserts by id and stamps {@code updatedAt}.
     */
    public synchronized Project save(Project project) {
        Instant now = clock.instant();
        if (project.getCreatedAt() == null) {
            project.setCreatedAt(now);
        }
        project.setUpdatedAt(now);
        Project previous = document.getProjects().put(project.getId(), project.copy());
        try {
            flush();
        } catch (StorageException e) {
            restore(project.getId(), previous);
            throw e;
        }
        log.debug("Saved project {} ({})", project.getSlug(), project.getStatus());
        return project.copy();
    }

    public synchronized Optional<Project> get(String id) {
        return Optional.ofNullable(document.getProjects().get(id)).map(Project::copy);
    }

    /**
     * A soft-deleted record may share its slug with a live one; the live one wins.
     */
    public synchronized Optional<Project> getBySlug(String slug) {
        Project deletedMatch = null;
        for (Project p : document.getProjects().values()) {
            if (!slug.equals(p.getSlug())) continue;
            if (!p.isDeleted()) {
                return Optional.of(p.copy());
            }
            if (deletedMatch == null) {
                deletedMatch = p;
            }
        }
        return Optional.ofNullable(deletedMatch).map(Project::copy);
    }

    /**
     * Every record, whatever its status.
     */
    public synchronized List<Project> getAll() {
        return document.getProjects().values().stream().map(Project::copy).toList();
    }

    /**
     * Removes the record and the project's directory tree. A failure to delete
     * files is logged; the record is gone either way.
     */
    public void delete(String id) {
        synchronized (this) {
            Project removed = document.getProjects().remove(id);
            if (removed == null) {
                log.debug("Delete of unknown project {} ignored", id);
            }
            try {
                flush();
            } catch (StorageException e) {
                restore(id, removed);
                throw e;
            }
        }
        Path projectDir = layout.projectDir(id);
        try {
            deleteRecursively(projectDir);
            log.info("Deleted project data {}", projectDir);
        } catch (IOException e) {
            log.warn("Failed to delete project data {}: {}", projectDir, e.getMessage());
        }
    }

    private void flush() {
        document.setLastUpdated(clock.instant());
        store.write(document);
    }

    /**
     * Puts back the entry a failed write displaced, so memory matches disk.
     */
    private void restore(String id, Project previous) {
        if (previous == null) {
            document.getProjects().remove(id);
        } else {
            document.getProjects().put(id, previous);
        }
    }

    // -- backups ---------------------------------------------------------

    /**
     * Archives the project's directory. The container must be stopped.
     */
    public BackupRecord createBackup(Project project) {
        Path backupDir = layout.projectBackupDir(project.getId());
        Instant now = clock.instant();
        String filename = project.getSlug() + "-" + BACKUP_TIMESTAMP.format(now) + BACKUP_EXTENSION;
        Path archive = backupDir.resolve(filename);
        Path projectDir = layout.projectDir(project.getId());

        try {
            Files.createDirectories(backupDir);
            Files.createDirectories(projectDir);
        } catch (IOException e) {
            throw new StorageException("Cannot prepare backup directory " + backupDir, e);
        }

        archiver.archive(projectDir, archive);

        long size;
        try {
            size = Files.size(archive);
        } catch (IOException e) {
            throw new StorageException("Backup archive " + archive + " was not written", e);
        }
        log.info("Created backup {} ({} bytes)", filename, size);
        return new BackupRecord(idOf(filename), project.getId(), filename, size, now);
    }

    /**
     * Newest first; empty when the project has never been backed up.
     */
    public List<BackupRecord> listBackups(String projectId) {
        Path backupDir = layout.projectBackupDir(projectId);
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        var backups = new ArrayList<BackupRecord>();
        try (Stream<Path> files = Files.list(backupDir)) {
            for (Path file : files.toList()) {
                String filename = file.getFileName().toString();
                if (!filename.endsWith(BACKUP_EXTENSION) || !Files.isRegularFile(file)) continue;
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                backups.add(new BackupRecord(idOf(filename), projectId, filename,
                        attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
        } catch (IOException e) {
            throw new StorageException("Cannot list backups in " + backupDir, e);
        }
        backups.sort(Comparator.comparing(BackupRecord::createdAt).reversed()
                .thenComparing(BackupRecord::filename, Comparator.reverseOrder()));
        return backups;
    }

    /**
     * Replaces the project's directory with the archive's contents. The
     * container must be stopped.
     *
     * @param backup backup filename, with or without {@code .tar.gz}
     */
    public void restoreBackup(String projectId, String backup) {
        Path archive = backupPath(projectId, backup);
        Path projectDir = layout.projectDir(projectId);
        try {
            deleteRecursively(projectDir);
            Files.createDirectories(projectDir);
        } catch (IOException e) {
            throw new StorageException("Cannot clear " + projectDir + " before restore", e);
        }
        archiver.extract(archive, projectDir);
        log.info("Restored backup {} into {}", archive.getFileName(), projectDir);
    }

    public void deleteBackup(String projectId, String backup) {
        Path archive = backupPath(projectId, backup);
        try {
            Files.delete(archive);
        } catch (IOException e) {
            throw new StorageException("Cannot delete backup " + archive, e);
        }
        log.info("Deleted backup {}", archive.getFileName());
    }

    /**
     * @param backup backup filename, with or without {@code .tar.gz}
     * @throws ValidationException       if the name could escape the backup directory
     * @throws ResourceNotFoundException if there is no such archive
     */
    public Path backupPath(String projectId, String backup) {
        if (backup == null || backup.isBlank()
                || backup.contains("/") || backup.contains("\\") || backup.contains("..")) {
            throw new ValidationException("Invalid backup name: " + backup);
        }
        String filename = backup.endsWith(BACKUP_EXTENSION) ? backup : backup + BACKUP_EXTENSION;
        Path archive = layout.projectBackupDir(projectId).resolve(filename);
        if (!Files.isRegularFile(archive)) {
            throw new ResourceNotFoundException("Backup", filename);
        }
        return archive;
    }

    private static String idOf(String filename) {
        return filename.substring(0, filename.length() - BACKUP_EXTENSION.length());
    }

    // -- storage ---------------------------------------------------------

    /**
     * Bytes under {@code projects/}, per project directory and in total.
     */
    public StorageStats getStorageStats() {
        var sizes = new LinkedHashMap<String, Long>();
        long total = 0;
        Path projectsDir = layout.projectsDir();
        if (!Files.isDirectory(projectsDir)) {
            return new StorageStats(0, sizes);
        }
        try (Stream<Path> dirs = Files.list(projectsDir)) {
            for (Path dir : dirs.filter(Files::isDirectory).sorted().toList()) {
                long size = directorySize(dir);
                sizes.put(dir.getFileName().toString(), size);
                total += size;
            }
        } catch (IOException e) {
            throw new StorageException("Cannot scan " + projectsDir, e);
        }
        return new StorageStats(total, sizes);
    }

    private static long directorySize(Path dir) {
        long[] size = {0};
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    size[0] += attrs.size();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Could not size {}: {}", dir, e.getMessage());
        }
        return size[0];
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
