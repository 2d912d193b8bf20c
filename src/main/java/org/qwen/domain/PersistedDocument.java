package org.qwen.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 持久化根文档：账号、代理绑定、代理状态、设置
 */
@Data
public class PersistedDocument {

    private List<Account> accounts = new ArrayList<>();

    // email -> proxyUrl（可为 null，表示直连）
    private Map<String, String> proxyBindings = new LinkedHashMap<>();

    private Map<String, ProxyStatus> proxyStatuses = new LinkedHashMap<>();

    private Map<String, String> settings = new LinkedHashMap<>();

    public static PersistedDocument empty() {
        return new PersistedDocument();
    }

    /**
     * 补齐缺失的顶层键，并剔除空账号、无邮箱账号和空代理状态
     *
     * @return 被剔除的记录数
     */
    public int normalize() {
        if (accounts == null) {
            accounts = new ArrayList<>();
        }
        if (proxyBindings == null) {
            proxyBindings = new LinkedHashMap<>();
        }
        if (proxyStatuses == null) {
            proxyStatuses = new LinkedHashMap<>();
        }
        if (settings == null) {
            settings = new LinkedHashMap<>();
        }
        int before = accounts.size() + proxyStatuses.size();
        accounts.removeIf(account -> !isValid(account));
        proxyStatuses.values().removeIf(Objects::isNull);
        return before - accounts.size() - proxyStatuses.size();
    }

    /**
     * 深拷贝，不修改当前对象；无效记录不会进入副本
     */
    public PersistedDocument copy() {
        PersistedDocument copy = new PersistedDocument();
        if (accounts != null) {
            accounts.stream()
                    .filter(PersistedDocument::isValid)
                    .forEach(account -> copy.accounts.add(account.copy()));
        }
        if (proxyBindings != null) {
            copy.proxyBindings.putAll(proxyBindings);
        }
        if (proxyStatuses != null) {
            proxyStatuses.forEach((proxy, status) -> {
                if (status != null) {
                    copy.proxyStatuses.put(proxy, status.copy());
                }
            });
        }
        if (settings != null) {
            copy.settings.putAll(settings);
        }
        return copy;
    }

    private static boolean isValid(Account account) {
        return account != null && account.getEmail() != null && !account.getEmail().isBlank();
    }
}
