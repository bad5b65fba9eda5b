package com.hangar.vault;

import com.hangar.config.StorageLayout;
import com.hangar.core.error.ResourceNotFoundException;
import com.hangar.core.error.StorageException;
import com.hangar.core.model.Credentials;
import com.hangar.core.model.CredentialsUpdate;
import com.hangar.core.persistence.JsonFileStore;
import com.hangar.core.persistence.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bootstrap admin credentials, one record per project id, kept apart from the
 * project catalog in {@code database-credentials.json}.
 */
@Service
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final Clock clock;
    private final JsonFileStore<VaultDocument> store;

    private VaultDocument document = new VaultDocument();

    public CredentialVault(StorageLayout layout, Clock clock) {
        this.clock = clock;
        this.store = new JsonFileStore<>(layout.vaultFile(), VaultDocument.class,
                VaultDocument::new, JsonMappers.create(), clock);
    }

    @PostConstruct
    public synchronized void initialize() {
        document = store.load();
        log.info("Credential vault loaded: {} records", document.getDatabases().size());
    }

    /**
     * Upsert. The original {@code createdAt} survives an overwrite.
     */
    public synchronized Credentials store(String projectId, String projectName, String projectSlug,
                                          String domain, String adminEmail, String adminPassword) {
        Instant now = clock.instant();
        Credentials existing = document.getDatabases().get(projectId);
        var credentials = new Credentials(projectId, projectName, projectSlug, domain,
                adminEmail, adminPassword, existing != null ? existing.createdAt() : now, now);
        flush(projectId, existing, credentials);
        log.info("Stored credentials for project {}", projectSlug);
        return credentials;
    }

    public synchronized Optional<Credentials> get(String projectId) {
        return Optional.ofNullable(document.getDatabases().get(projectId));
    }

    public synchronized List<Credentials> getAll() {
        return List.copyOf(document.getDatabases().values());
    }

    /**
     * Replaces the non-null fields of {@code update}.
     *
     * @throws ResourceNotFoundException if no record exists for the project
     */
    public synchronized Credentials update(String projectId, CredentialsUpdate update) {
        Credentials existing = document.getDatabases().get(projectId);
        if (existing == null) {
            throw new ResourceNotFoundException("Credentials", projectId);
        }
        var updated = new Credentials(
                projectId,
                update.projectName() != null ? update.projectName() : existing.projectName(),
                update.projectSlug() != null ? update.projectSlug() : existing.projectSlug(),
                update.domain() != null ? update.domain() : existing.domain(),
                update.adminEmail() != null ? update.adminEmail() : existing.adminEmail(),
                update.adminPassword() != null ? update.adminPassword() : existing.adminPassword(),
                existing.createdAt(),
                clock.instant());
        flush(projectId, existing, updated);
        log.info("Updated credentials for project {}", updated.projectSlug());
        return updated;
    }

    /**
     * No-op when nothing is stored for the project.
     */
    public synchronized void delete(String projectId) {
        Credentials removed = document.getDatabases().get(projectId);
        if (removed != null) {
            flush(projectId, removed, null);
            log.info("Deleted credentials for project {}", removed.projectSlug());
        }
    }

    /**
     * Applies one change and persists it. On a failed write the previous
     * entry is put back before the error propagates.
     *
     * @param replacement new record, or {@code null} to remove
     */
    private void flush(String projectId, Credentials previous, Credentials replacement) {
        if (replacement == null) {
            document.getDatabases().remove(projectId);
        } else {
            document.getDatabases().put(projectId, replacement);
        }
        try {
            document.setLastUpdated(clock.instant());
            store.write(document);
        } catch (StorageException e) {
            if (previous == null) {
                document.getDatabases().remove(projectId);
            } else {
                document.getDatabases().put(projectId, previous);
            }
            throw e;
        }
    }
}
