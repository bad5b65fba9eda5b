package com.hangar.catalog;

import com.hangar.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates and extracts gzip'd tarballs by shelling out to the host {@code tar}
 * binary via {@link ProcessBuilder}.
 */
@Component
public class BackupArchiver {

    private static final Logger log = LoggerFactory.getLogger(BackupArchiver.class);

    private final String tarBinary;

    public BackupArchiver() {
        this("tar");
    }

    public BackupArchiver(String tarBinary) {
        this.tarBinary = tarBinary;
    }

    /**
     * Archives {@code sourceDir} so that the archive holds one top-level
     * directory named after it.
     */
    public void archive(Path sourceDir, Path archive) {
        Path parent = sourceDir.toAbsolutePath().getParent();
        run(List.of(tarBinary, "-czf", archive.toAbsolutePath().toString(),
                "-C", parent.toString(), sourceDir.getFileName().toString()));
    }

    /**
     * Extracts {@code archive} into {@code targetDir}, dropping the archive's
     * top-level directory.
     */
    public void extract(Path archive, Path targetDir) {
        run(List.of(tarBinary, "-xzf", archive.toAbsolutePath().toString(),
                "-C", targetDir.toAbsolutePath().toString(), "--strip-components=1"));
    }

    private void run(List<String> command) {
        log.debug("Running {}", String.join(" ", command));
        try {
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new StorageException("tar exited with code " + exitCode + ": " + output.strip());
            }
        } catch (IOException e) {
            throw new StorageException("Cannot run " + tarBinary + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while running " + tarBinary, e);
        }
    }
}
