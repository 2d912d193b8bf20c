package org.qwen.storage;

import java.util.Optional;

/**
 * 仅内存保存，进程重启后丢失
 */
public class MemoryStorageBackend implements StorageBackend {

    private volatile String document;

    @Override
    public String name() {
        return "none";
    }

    @Override
    public Optional<String> read() {
        return Optional.ofNullable(document);
    }

    @Override
    public void write(String document) {
        this.document = document;
    }
}
