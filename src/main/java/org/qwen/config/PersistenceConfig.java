package org.qwen.config;

import lombok.extern.slf4j.Slf4j;
import org.qwen.storage.FileStorageBackend;
import org.qwen.storage.MemoryStorageBackend;
import org.qwen.storage.RedisStorageBackend;
import org.qwen.storage.StorageBackend;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Paths;
import java.util.Locale;

@Slf4j
@Configuration
public class PersistenceConfig {

    @Bean
    public StorageBackend storageBackend(QwenProperties qwenProperties,
                                         ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        String mode = qwenProperties.getDataSaveMode() == null
                ? "none" : qwenProperties.getDataSaveMode().trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "file":
                return new FileStorageBackend(Paths.get(qwenProperties.getDataFilePath()));
            case "redis":
                StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
                if (redisTemplate == null) {
                    throw new IllegalStateException("持久化模式为 redis，但未配置 Redis 连接");
                }
                return new RedisStorageBackend(redisTemplate, qwenProperties.getRedisKey());
            case "none":
                return new MemoryStorageBackend();
            default:
                log.warn("未知的持久化模式: {}，使用内存模式", mode);
                return new MemoryStorageBackend();
        }
    }
}
