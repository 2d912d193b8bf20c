package org.qwen.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * 持久化后端：整份文档读写，不支持局部更新
 */
public interface StorageBackend {

    String name();

    /**
     * 读取序列化后的文档，不存在时返回 empty
     */
    Optional<String> read() throws IOException;

    /**
     * 覆盖写入整份文档
     */
    void write(String document) throws IOException;

    /**
     * 保留无法解析的原始内容，默认不处理
     */
    default void quarantine(String rawDocument) throws IOException {
    }
}
