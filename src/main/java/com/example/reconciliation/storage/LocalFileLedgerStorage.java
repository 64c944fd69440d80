package com.example.reconciliation.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * {@link LedgerStorage} on the local filesystem. Locations are paths relative to
 * {@code app.storage.base-dir} and may not escape it.
 */
@Component
@Slf4j
public class LocalFileLedgerStorage implements LedgerStorage {

    private final Path baseDir;

    public LocalFileLedgerStorage(@Value("${app.storage.base-dir:./data}") String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
        log.info("Local ledger storage rooted at {}", this.baseDir);
    }

    @Override
    public byte[] read(String location) {
        Path path = resolve(location);
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read {} bytes from {}", content.length, path);
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger: " + location, e);
        }
    }

    @Override
    public void write(String location, byte[] content) {
        Path target = resolve(location);
        Path temp = null;
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, ".report-", ".tmp");
            Files.write(temp, content);
            moveIntoPlace(temp, target);
            log.debug("Wrote {} bytes to {}", content.length, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write report: " + location, e);
        }
    }

    Path resolve(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Storage location must not be blank");
        }
        Path resolved = baseDir.resolve(location).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new IllegalArgumentException("Location escapes storage base directory: " + location);
        }
        return resolved;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary report file {}: {}", temp, e.getMessage());
        }
    }
}
