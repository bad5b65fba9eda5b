package com.hangar.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * On-disk layout shared by the runtime adapter, catalog and vault.
 *
 * <pre>
 * &lt;dataDir&gt;/metadata.json
 * &lt;dataDir&gt;/database-credentials.json
 * &lt;dataDir&gt;/projects/&lt;projectId&gt;/{data,public,migrations,hooks}/
 * &lt;backupsDir&gt;/&lt;projectId&gt;/&lt;slug&gt;-&lt;timestamp&gt;.tar.gz
 * </pre>
 */
@Component
public class StorageLayout {

    public static final String CATALOG_FILE = "metadata.json";
    public static final String VAULT_FILE = "database-credentials.json";

    /** Per-project subdirectories, each bind-mounted into the container. */
    public static final List<String> PROJECT_SUBDIRECTORIES = List.of("data", "public", "migrations", "hooks");

    private final Path dataDir;
    private final Path backupsDir;

    @Autowired
    public StorageLayout(HangarProperties properties) {
        this(Path.of(properties.getStorage().getDataDir()), Path.of(properties.getStorage().getBackupsDir()));
    }

    public StorageLayout(Path dataDir, Path backupsDir) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.backupsDir = backupsDir.toAbsolutePath().normalize();
    }

    public Path dataDir() { return dataDir; }
    public Path backupsDir() { return backupsDir; }
    public Path catalogFile() { return dataDir.resolve(CATALOG_FILE); }
    public Path vaultFile() { return dataDir.resolve(VAULT_FILE); }
    public Path projectsDir() { return dataDir.resolve("projects"); }

    public Path projectDir(String projectId) {
        return projectsDir().resolve(projectId);
    }

    public Path projectSubdirectory(String projectId, String name) {
        return projectDir(projectId).resolve(name);
    }

    public Path projectBackupDir(String projectId) {
        return backupsDir.resolve(projectId);
    }
}
