package com.hangar.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hangar.core.error.CatalogCorruptException;
import com.hangar.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * One JSON document on disk, loaded whole and rewritten whole.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so
 * a crash mid-write leaves either the old or the new document, never a torn one.
 *
 * @param <T> document type
 */
public class JsonFileStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final Class<T> type;
    private final Supplier<T> emptyDocument;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonFileStore(Path file, Class<T> type, Supplier<T> emptyDocument, ObjectMapper mapper, Clock clock) {
        this.file = file;
        this.type = type;
        this.emptyDocument = emptyDocument;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Reads the document. A missing file yields a freshly written empty
     * document; a malformed one is moved aside and replaced by an empty one.
     *
     * @throws CatalogCorruptException if the file exists but cannot be read
     */
    public T load() {
        if (!Files.exists(file)) {
            log.info("No {} found, creating a new one", file.getFileName());
            T empty = emptyDocument.get();
            write(empty);
            return empty;
        }
        try {
            T document = mapper.readValue(file.toFile(), type);
            if (document == null) {
                // literal "null"
                T empty = emptyDocument.get();
                write(empty);
                return empty;
            }
            return document;
        } catch (JsonProcessingException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
            log.warn("{} is not valid JSON ({}); moving it to {} and starting empty",
                    file, e.getOriginalMessage(), aside.getFileName());
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new CatalogCorruptException("Cannot move malformed " + file + " aside", moveError);
            }
            T empty = emptyDocument.get();
            write(empty);
            return empty;
        } catch (IOException e) {
            throw new CatalogCorruptException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws StorageException if the document cannot be written
     */
    public void write(T document) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot write " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getFile() {
        return file;
    }
}
