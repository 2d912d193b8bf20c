package org.qwen.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 本地 JSON 文件，写入先落临时文件再原子替换
 */
@Slf4j
public class FileStorageBackend implements StorageBackend {

    private final Path filePath;

    public FileStorageBackend(Path filePath) {
        this.filePath = filePath.toAbsolutePath();
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public Optional<String> read() throws IOException {
        try {
            return Optional.of(Files.readString(filePath, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public void write(String document) throws IOException {
        Path dir = filePath.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, filePath.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, document, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public void quarantine(String rawDocument) throws IOException {
        Path backup = filePath.resolveSibling(filePath.getFileName() + ".corrupt-" + System.currentTimeMillis());
        Files.writeString(backup, rawDocument, StandardCharsets.UTF_8);
        log.error("数据文件已损坏，原始内容已备份至: {}", backup);
    }
}
