package org.qwen.config;

import org.junit.jupiter.api.Test;
import org.qwen.storage.FileStorageBackend;
import org.qwen.storage.MemoryStorageBackend;
import org.qwen.storage.RedisStorageBackend;
import org.qwen.storage.StorageBackend;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PersistenceConfigTest {

    private final PersistenceConfig persistenceConfig = new PersistenceConfig();

    @Test
    void selectsBackendByMode() {
        ObjectProvider<StringRedisTemplate> redisProvider = redisProvider(mock(StringRedisTemplate.class));

        assertInstanceOf(MemoryStorageBackend.class, persistenceConfig.storageBackend(properties("none"), redisProvider));
        assertInstanceOf(FileStorageBackend.class, persistenceConfig.storageBackend(properties(" FILE "), redisProvider));
        StorageBackend redis = persistenceConfig.storageBackend(properties("redis"), redisProvider);
        assertInstanceOf(RedisStorageBackend.class, redis);
        assertEquals("redis", redis.name());
    }

    @Test
    void unknownModeFallsBackToMemory() {
        StorageBackend backend = persistenceConfig.storageBackend(properties("mongo"), redisProvider(null));

        assertInstanceOf(MemoryStorageBackend.class, backend);
    }

    @Test
    void redisModeRequiresConnection() {
        assertThrows(IllegalStateException.class,
                () -> persistenceConfig.storageBackend(properties("redis"), redisProvider(null)));
    }

    private static QwenProperties properties(String mode) {
        QwenProperties qwenProperties = new QwenProperties();
        qwenProperties.setDataSaveMode(mode);
        return qwenProperties;
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<StringRedisTemplate> redisProvider(StringRedisTemplate template) {
        ObjectProvider<StringRedisTemplate> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(template);
        return provider;
    }
}
