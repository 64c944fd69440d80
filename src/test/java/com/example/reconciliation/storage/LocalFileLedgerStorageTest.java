package com.example.reconciliation.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalFileLedgerStorageTest {

    @TempDir
    Path baseDir;

    private LocalFileLedgerStorage storage;

    @BeforeEach
    void setUp() {
        storage = new LocalFileLedgerStorage(baseDir.toString());
    }

    @Test
    @DisplayName("Should read a ledger relative to the base directory")
    void shouldRead() throws IOException {
        Files.createDirectories(baseDir.resolve("in"));
        Files.writeString(baseDir.resolve("in/fba.csv"), "sku,quantity\n");

        assertThat(storage.read("in/fba.csv")).isEqualTo("sku,quantity\n".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should create parent directories and replace an existing report")
    void shouldWriteAndReplace() throws IOException {
        storage.write("out/2024/report.csv", "old".getBytes(StandardCharsets.UTF_8));
        storage.write("out/2024/report.csv", "new".getBytes(StandardCharsets.UTF_8));

        assertThat(Files.readString(baseDir.resolve("out/2024/report.csv"))).isEqualTo("new");
    }

    @Test
    @DisplayName("Should leave no temporary files behind")
    void shouldCleanUpTemporaryFiles() throws IOException {
        storage.write("out/report.csv", "data".getBytes(StandardCharsets.UTF_8));

        try (Stream<Path> files = Files.list(baseDir.resolve("out"))) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("report.csv");
        }
    }

    @Test
    @DisplayName("Missing ledger surfaces as UncheckedIOException")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> storage.read("in/missing.csv"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("in/missing.csv");
    }

    @Test
    @DisplayName("Locations may not escape the base directory")
    void shouldRejectEscapingLocation() {
        assertThatThrownBy(() -> storage.read("../outside.csv"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.write("a/../../outside.csv", new byte[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Blank location is rejected")
    void shouldRejectBlankLocation() {
        assertThatThrownBy(() -> storage.read(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
