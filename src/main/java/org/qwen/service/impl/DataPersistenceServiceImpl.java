package org.qwen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.qwen.domain.Account;
import org.qwen.domain.PersistedDocument;
import org.qwen.domain.ProxyStatus;
import org.qwen.service.IDataPersistenceService;
import org.qwen.storage.StorageBackend;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class DataPersistenceServiceImpl implements IDataPersistenceService {

    private final StorageBackend backend;
    private final ObjectMapper objectMapper;
    // 保护缓存读写与初始化，保证 save 完整序列化后才对读者可见
    private final ReentrantLock lock = new ReentrantLock();

    private volatile PersistedDocument cache;
    // 后端读取失败后置位，直到再次读取成功
    private volatile boolean degraded;

    public DataPersistenceServiceImpl(StorageBackend backend, ObjectMapper objectMapper) {
        this.backend = backend;
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public PersistedDocument load() {
        lock.lock();
        try {
            return current().copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 返回内部缓存，调用方需持有锁或只读使用；后端不可读期间每次调用都会重试读取
     */
    private PersistedDocument current() {
        PersistedDocument current = cache;
        if (current != null && !degraded) {
            return current;
        }
        lock.lock();
        try {
            if (cache == null || degraded) {
                readFromBackend();
            }
            return cache;
        } finally {
            lock.unlock();
        }
    }

    private void readFromBackend() {
        Optional<String> raw;
        try {
            raw = backend.read();
        } catch (IOException e) {
            if (cache == null) {
                log.error("读取持久化数据失败，暂用内存默认数据，恢复读取前不写入后端 (模式: {})", backend.name(), e);
                cache = getDefault();
            } else {
                log.warn("持久化数据仍不可读 (模式: {}): {}", backend.name(), e.getMessage());
            }
            degraded = true;
            return;
        }

        boolean recovered = degraded;
        degraded = false;
        cache = parse(raw);
        if (recovered) {
            log.warn("持久化后端已恢复读取，不可读期间的内存修改已丢弃 (模式: {})", backend.name());
        } else {
            log.info("数据持久化模块初始化完成 (模式: {})", backend.name());
        }
    }

    /**
     * 解析后端文档：不存在或损坏时写入默认文档
     */
    private PersistedDocument parse(Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            log.info("持久化数据不存在，正在创建默认数据 (模式: {})", backend.name());
            PersistedDocument defaults = getDefault();
            writeThrough(defaults);
            return defaults;
        }

        try {
            PersistedDocument document = objectMapper.readValue(raw.get(), PersistedDocument.class);
            if (document == null) {
                throw new IllegalStateException("文档内容为 null");
            }
            int dropped = document.normalize();
            if (dropped > 0) {
                log.warn("持久化数据中有 {} 条无效记录，已忽略 (模式: {})", dropped, backend.name());
            }
            return document;
        } catch (JsonProcessingException | IllegalStateException e) {
            log.error("持久化数据无法解析，已重置为默认数据，原有数据将丢失 (模式: {})", backend.name(), e);
            try {
                backend.quarantine(raw.get());
            } catch (IOException ex) {
                log.error("备份损坏数据失败 (模式: {})", backend.name(), ex);
            }
            PersistedDocument defaults = getDefault();
            writeThrough(defaults);
            return defaults;
        }
    }

    @Override
    public void save(PersistedDocument document) {
        lock.lock();
        try {
            PersistedDocument snapshot = document.copy();
            cache = snapshot;
            writeThrough(snapshot);
        } finally {
            lock.unlock();
        }
    }

    private void writeThrough(PersistedDocument document) {
        if (degraded) {
            log.warn("持久化后端当前不可读，跳过写入以免覆盖已有数据 (模式: {})", backend.name());
            return;
        }
        try {
            backend.write(objectMapper.writeValueAsString(document));
        } catch (IOException e) {
            log.error("保存数据失败 (模式: {})", backend.name(), e);
        }
    }

    @Override
    public PersistedDocument getDefault() {
        return PersistedDocument.empty();
    }

    @Override
    public void awaitReady() {
        current();
    }

    @Override
    public boolean isReady() {
        return cache != null;
    }

    @Override
    public String getMode() {
        return backend.name();
    }

    @Override
    public List<Account> loadAccounts() {
        lock.lock();
        try {
            List<Account> accounts = new ArrayList<>();
            current().getAccounts().forEach(account -> accounts.add(account.copy()));
            return accounts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按邮箱合并，非空字段覆盖已有值
     */
    @Override
    public void saveAccount(Account account) {
        lock.lock();
        try {
            PersistedDocument document = current();
            Account existing = document.getAccounts().stream()
                    .filter(acc -> acc.getEmail().equals(account.getEmail()))
                    .findFirst()
                    .orElse(null);
            if (existing == null) {
                document.getAccounts().add(account.copy());
            } else {
                if (account.getPassword() != null) {
                    existing.setPassword(account.getPassword());
                }
                if (account.getToken() != null) {
                    existing.setToken(account.getToken());
                }
                if (account.getTokenExpiresAt() != null) {
                    existing.setTokenExpiresAt(account.getTokenExpiresAt());
                }
            }
            save(document);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeAccount(String email) {
        lock.lock();
        try {
            PersistedDocument document = current();
            boolean removed = false;
            Iterator<Account> iterator = document.getAccounts().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getEmail().equals(email)) {
                    iterator.remove();
                    removed = true;
                }
            }
            if (removed) {
                document.getProxyBindings().remove(email);
                save(document);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> loadProxyBindings() {
        lock.lock();
        try {
            return new LinkedHashMap<>(current().getProxyBindings());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveProxyBinding(String email, String proxyUrl) {
        lock.lock();
        try {
            PersistedDocument document = current();
            document.getProxyBindings().put(email, proxyUrl);
            save(document);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeProxyBinding(String email) {
        lock.lock();
        try {
            PersistedDocument document = current();
            if (document.getProxyBindings().containsKey(email)) {
                document.getProxyBindings().remove(email);
                save(document);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, ProxyStatus> loadProxyStatuses() {
        lock.lock();
        try {
            Map<String, ProxyStatus> statuses = new LinkedHashMap<>();
            current().getProxyStatuses().forEach((proxy, status) -> statuses.put(proxy, status.copy()));
            return statuses;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveProxyStatuses(Map<String, ProxyStatus> statuses) {
        lock.lock();
        try {
            PersistedDocument document = current();
            Map<String, ProxyStatus> copy = new LinkedHashMap<>();
            statuses.forEach((proxy, status) -> copy.put(proxy, status.copy()));
            document.setProxyStatuses(copy);
            save(document);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> loadSettings() {
        lock.lock();
        try {
            return new LinkedHashMap<>(current().getSettings());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> getSetting(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(current().getSettings().get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveSetting(String key, String value) {
        lock.lock();
        try {
            PersistedDocument document = current();
            document.getSettings().put(key, value);
            save(document);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeSetting(String key) {
        lock.lock();
        try {
            PersistedDocument document = current();
            if (!document.getSettings().containsKey(key)) {
                return false;
            }
            document.getSettings().remove(key);
            save(document);
            return true;
        } finally {
            lock.unlock();
        }
    }
}
