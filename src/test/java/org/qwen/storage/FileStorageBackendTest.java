package org.qwen.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileStorageBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void readReturnsEmptyWhenFileIsMissing() throws IOException {
        FileStorageBackend backend = new FileStorageBackend(tempDir.resolve("data.json"));

        assertEquals(Optional.empty(), backend.read());
    }

    @Test
    void writeCreatesParentDirectoriesAndLeavesNoTempFiles() throws IOException {
        Path file = tempDir.resolve("nested/dir/data.json");
        FileStorageBackend backend = new FileStorageBackend(file);

        backend.write("{\"a\":1}");
        backend.write("{\"a\":2}");

        assertEquals("{\"a\":2}", Files.readString(file, StandardCharsets.UTF_8));
        try (Stream<Path> entries = Files.list(file.getParent())) {
            List<String> names = entries.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertEquals(List.of("data.json"), names);
        }
    }

    @Test
    void quarantineKeepsCorruptContentNextToDataFile() throws IOException {
        Path file = tempDir.resolve("data.json");
        FileStorageBackend backend = new FileStorageBackend(file);

        backend.quarantine("{broken");

        try (Stream<Path> entries = Files.list(tempDir)) {
            List<Path> backups = entries
                    .filter(p -> p.getFileName().toString().startsWith("data.json.corrupt-"))
                    .collect(Collectors.toList());
            assertEquals(1, backups.size());
            assertEquals("{broken", Files.readString(backups.get(0), StandardCharsets.UTF_8));
        }
        assertTrue(Files.notExists(file));
    }
}
