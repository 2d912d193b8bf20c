package org.qwen.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisStorageBackendTest {

    private ValueOperations<String, String> valueOperations;
    private RedisStorageBackend backend;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        backend = new RedisStorageBackend(redisTemplate, "qwen_proxy_data");
    }

    @Test
    void readsAndWritesSingleKey() throws IOException {
        when(valueOperations.get("qwen_proxy_data")).thenReturn("{\"accounts\":[]}");

        assertEquals(Optional.of("{\"accounts\":[]}"), backend.read());

        backend.write("{}");
        verify(valueOperations).set("qwen_proxy_data", "{}");
    }

    @Test
    void missingKeyReadsAsEmpty() throws IOException {
        assertEquals(Optional.empty(), backend.read());
    }

    @Test
    void redisErrorsSurfaceAsIoException() {
        when(valueOperations.get(anyString())).thenThrow(new QueryTimeoutException("timeout"));
        doThrow(new QueryTimeoutException("timeout")).when(valueOperations).set(eq("qwen_proxy_data"), anyString());

        assertThrows(IOException.class, () -> backend.read());
        assertThrows(IOException.class, () -> backend.write("{}"));
    }

    @Test
    void quarantineWritesSideKey() throws IOException {
        backend.quarantine("{broken");

        verify(valueOperations).set(startsWith("qwen_proxy_data:corrupt:"), eq("{broken"));
    }
}
