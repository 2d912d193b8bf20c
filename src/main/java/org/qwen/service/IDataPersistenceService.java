package org.qwen.service;

import org.qwen.domain.Account;
import org.qwen.domain.PersistedDocument;
import org.qwen.domain.ProxyStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface IDataPersistenceService {

    /**
     * 加载文档，首次调用完成初始化，之后直接返回缓存
     */
    PersistedDocument load();

    /**
     * 整份覆盖保存；写入失败只记录日志，缓存仍以本次内容为准
     */
    void save(PersistedDocument document);

    PersistedDocument getDefault();

    /**
     * 阻塞直到初始化完成
     */
    void awaitReady();

    boolean isReady();

    String getMode();

    List<Account> loadAccounts();

    void saveAccount(Account account);

    boolean removeAccount(String email);

    Map<String, String> loadProxyBindings();

    void saveProxyBinding(String email, String proxyUrl);

    void removeProxyBinding(String email);

    Map<String, ProxyStatus> loadProxyStatuses();

    void saveProxyStatuses(Map<String, ProxyStatus> statuses);

    Map<String, String> loadSettings();

    Optional<String> getSetting(String key);

    void saveSetting(String key, String value);

    boolean removeSetting(String key);
}
