package com.example.reconciliation.storage;

/**
 * Where ledgers are read from and reports are written to.
 * Locations are opaque to the caller; each implementation defines how it resolves them.
 */
public interface LedgerStorage {

    /**
     * Reads the whole object at {@code location}.
     *
     * @throws java.io.UncheckedIOException if it cannot be read
     */
    byte[] read(String location);

    /**
     * Writes {@code content} to {@code location}. Readers see either the previous object or the
     * complete new one, never a partial write.
     *
     * @throws java.io.UncheckedIOException if it cannot be written
     */
    void write(String location, byte[] content);
}
