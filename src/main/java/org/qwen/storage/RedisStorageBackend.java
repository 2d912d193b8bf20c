package org.qwen.storage;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.IOException;
import java.util.Optional;

/**
 * Redis 单键保存整份文档
 */
public class RedisStorageBackend implements StorageBackend {

    private final StringRedisTemplate redisTemplate;
    private final String key;

    public RedisStorageBackend(StringRedisTemplate redisTemplate, String key) {
        this.redisTemplate = redisTemplate;
        this.key = key;
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public Optional<String> read() throws IOException {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            throw new IOException("读取Redis键失败: " + key, e);
        }
    }

    @Override
    public void write(String document) throws IOException {
        try {
            redisTemplate.opsForValue().set(key, document);
        } catch (RuntimeException e) {
            throw new IOException("写入Redis键失败: " + key, e);
        }
    }

    @Override
    public void quarantine(String rawDocument) throws IOException {
        try {
            redisTemplate.opsForValue().set(key + ":corrupt:" + System.currentTimeMillis(), rawDocument);
        } catch (RuntimeException e) {
            throw new IOException("备份损坏的Redis数据失败", e);
        }
    }
}
