package org.qwen.service.impl;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.QwenProperties;
import org.qwen.domain.Account;
import org.qwen.domain.ProxyStatus;
import org.qwen.domain.TokenInfo;
import org.qwen.domain.exception.AuthException;
import org.qwen.service.IAccountService;
import org.qwen.service.IDataPersistenceService;
import org.qwen.service.ITokenService;
import org.qwen.utils.ProxyUrlUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AccountServiceImpl implements IAccountService {

    // 登录失败后的重试间隔，避免每次分发都重复登录
    private static final long LOGIN_RETRY_INTERVAL_MS = 5 * 60 * 1000;

    private final IDataPersistenceService persistenceService;
    private final ITokenService tokenService;
    private final QwenProperties qwenProperties;

    // 轮询游标、账号列表、绑定表、状态表统一由该锁保护
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Account> accounts = new ArrayList<>();
    private final Map<String, String> proxyBindings = new LinkedHashMap<>();
    private final Map<String, ProxyStatus> proxyStatuses = new LinkedHashMap<>();
    private final List<String> proxyPool;
    private int cursor;

    private final Map<String, Long> loginFailures = new ConcurrentHashMap<>();
    // 定时任务：代理恢复 + 令牌提前刷新
    private final ScheduledExecutorService maintenanceScheduler = Executors.newSingleThreadScheduledExecutor();

    public AccountServiceImpl(IDataPersistenceService persistenceService,
                              ITokenService tokenService,
                              QwenProperties qwenProperties) {
        this.persistenceService = persistenceService;
        this.tokenService = tokenService;
        this.qwenProperties = qwenProperties;
        this.proxyPool = qwenProperties.getProxies() == null ? List.of() : qwenProperties.getProxies().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(proxy -> !proxy.isEmpty())
                .distinct()
                .collect(Collectors.toUnmodifiableList());

        hydrate();
        maintenanceScheduler.scheduleAtFixedRate(this::recoverProxies, 5, 5, TimeUnit.MINUTES);
        maintenanceScheduler.scheduleAtFixedRate(this::refreshExpiringTokens, 1, 1, TimeUnit.HOURS);
    }

    /**
     * 从持久化层加载账号、绑定与代理状态
     */
    private void hydrate() {
        persistenceService.awaitReady();
        lock.lock();
        try {
            accounts.addAll(persistenceService.loadAccounts());
            proxyBindings.putAll(persistenceService.loadProxyBindings());
            proxyStatuses.putAll(persistenceService.loadProxyStatuses());
            long now = nowSeconds();
            long valid = accounts.stream().filter(acc -> acc.hasUsableToken(now)).count();
            log.info("账号管理初始化完成，账号数: {}，令牌有效: {}，代理数: {}", accounts.size(), valid, proxyPool.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Account> getNextAccount() {
        int total;
        lock.lock();
        try {
            total = accounts.size();
        } finally {
            lock.unlock();
        }

        for (int i = 0; i < total; i++) {
            Account candidate;
            lock.lock();
            try {
                if (accounts.isEmpty()) {
                    break;
                }
                int index = cursor % accounts.size();
                cursor = (index + 1) % accounts.size();
                candidate = accounts.get(index).copy();
            } finally {
                lock.unlock();
            }

            if (candidate.hasUsableToken(nowSeconds())) {
                return Optional.of(candidate);
            }
            if (candidate.canLogin() && loginAllowed(candidate.getEmail())) {
                log.info("账号{}令牌缺失或已过期，尝试刷新", candidate.getEmail());
                Optional<Account> refreshed = refreshToken(candidate);
                if (refreshed.isPresent()) {
                    return refreshed;
                }
            }
        }
        log.error("没有可用的账号令牌，账号总数: {}", total);
        return Optional.empty();
    }

    @Override
    public String getProxyForAccount(String email) {
        lock.lock();
        try {
            if (proxyPool.isEmpty()) {
                return null;
            }
            String bound = proxyBindings.get(email);
            if (bound != null && proxyPool.contains(bound)) {
                return bound;
            }
            String selected = selectProxy(null);
            if (selected == null) {
                log.warn("没有健康的代理可分配[账号: {}]，使用直连", email);
                return null;
            }
            proxyBindings.put(email, selected);
            persistenceService.saveProxyBinding(email, selected);
            log.info("账号{}绑定代理{}", email, ProxyUrlUtils.hostForLog(selected));
            return selected;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void handleNetworkFailure(String email, String proxyUrl) {
        if (proxyUrl == null) {
            return;
        }
        lock.lock();
        try {
            ProxyStatus status = proxyStatuses.computeIfAbsent(proxyUrl, k -> ProxyStatus.healthy());
            status.markFailure(System.currentTimeMillis());
            log.warn("代理{}标记为不健康，连续失败次数: {}", ProxyUrlUtils.hostForLog(proxyUrl), status.getFailureCount());

            boolean stillBound = Objects.equals(proxyBindings.get(email), proxyUrl);
            String replacement = null;
            if (stillBound) {
                replacement = selectProxy(proxyUrl);
                proxyBindings.put(email, replacement);
                log.info("账号{}代理已更换: {} -> {}", email,
                        ProxyUrlUtils.hostForLog(proxyUrl), ProxyUrlUtils.hostForLog(replacement));
            } else {
                log.info("账号{}已不再绑定代理{}，仅更新代理状态", email, ProxyUrlUtils.hostForLog(proxyUrl));
            }

            persistenceService.saveProxyStatuses(proxyStatuses);
            if (stillBound) {
                persistenceService.saveProxyBinding(email, replacement);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markProxySuccess(String proxyUrl) {
        if (proxyUrl == null) {
            return;
        }
        lock.lock();
        try {
            ProxyStatus status = proxyStatuses.computeIfAbsent(proxyUrl, k -> ProxyStatus.healthy());
            boolean changed = !status.isHealthy() || status.getFailureCount() > 0;
            status.markSuccess(System.currentTimeMillis());
            // 状态未变化时只更新内存，避免每次请求都写盘
            if (changed) {
                persistenceService.saveProxyStatuses(proxyStatuses);
                log.info("代理{}恢复健康", ProxyUrlUtils.hostForLog(proxyUrl));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 选择健康代理：最近失败时间最早的优先，其次绑定账号数最少，最后按配置顺序
     */
    private String selectProxy(String excluded) {
        Map<String, Long> bindingCounts = proxyBindings.values().stream()
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(proxy -> proxy, Collectors.counting()));

        return proxyPool.stream()
                .filter(proxy -> !proxy.equals(excluded))
                .filter(proxy -> statusOf(proxy).isHealthy())
                .min(Comparator.<String>comparingLong(proxy -> statusOf(proxy).getLastFailureAt())
                        .thenComparingLong(proxy -> bindingCounts.getOrDefault(proxy, 0L))
                        .thenComparingInt(proxyPool::indexOf))
                .orElse(null);
    }

    private ProxyStatus statusOf(String proxy) {
        ProxyStatus status = proxyStatuses.get(proxy);
        return status != null ? status : ProxyStatus.healthy();
    }

    @Override
    public List<Account> listAccounts() {
        lock.lock();
        try {
            return accounts.stream().map(Account::copy).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Account addAccount(String email, String password) {
        Account account = new Account(email, password);
        try {
            String token = tokenService.login(email, password);
            TokenInfo tokenInfo = tokenService.validateToken(token);
            account.setToken(token);
            account.setTokenExpiresAt(tokenInfo.getExpiresAt());
            loginFailures.remove(email);
        } catch (AuthException e) {
            log.warn("账号{}登录失败，以空令牌保存: {}", email, e.getMessage());
            loginFailures.put(email, System.currentTimeMillis());
        }

        lock.lock();
        try {
            accounts.removeIf(acc -> acc.getEmail().equals(email));
            accounts.add(account.copy());
            persistenceService.removeAccount(email);
            persistenceService.saveAccount(account);
            proxyBindings.remove(email);
            log.info("账号{}已添加，当前账号数: {}", email, accounts.size());
        } finally {
            lock.unlock();
        }
        return account.copy();
    }

    @Override
    public boolean removeAccount(String email) {
        lock.lock();
        try {
            int index = -1;
            for (int i = 0; i < accounts.size(); i++) {
                if (accounts.get(i).getEmail().equals(email)) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                return false;
            }
            accounts.remove(index);
            if (index < cursor) {
                cursor--;
            }
            cursor = accounts.isEmpty() ? 0 : cursor % accounts.size();
            proxyBindings.remove(email);
            loginFailures.remove(email);
            persistenceService.removeAccount(email);
            log.info("账号{}已删除，剩余账号数: {}", email, accounts.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Account> refreshAccountToken(String email) {
        Account account;
        lock.lock();
        try {
            account = accounts.stream()
                    .filter(acc -> acc.getEmail().equals(email))
                    .findFirst()
                    .map(Account::copy)
                    .orElse(null);
        } finally {
            lock.unlock();
        }
        if (account == null || !account.canLogin()) {
            return Optional.empty();
        }
        return refreshToken(account);
    }

    /**
     * 刷新令牌即将过期的账号
     */
    @Override
    public void refreshExpiringTokens() {
        long threshold = nowSeconds() + TimeUnit.HOURS.toSeconds(qwenProperties.getTokenRefreshAheadHours());
        List<Account> expiring = listAccounts().stream()
                .filter(Account::canLogin)
                .filter(acc -> acc.getTokenExpiresAt() == null || acc.getTokenExpiresAt() < threshold)
                .collect(Collectors.toList());
        if (expiring.isEmpty()) {
            return;
        }
        log.info("开始刷新即将过期的令牌，账号数: {}", expiring.size());
        int refreshed = 0;
        for (Account account : expiring) {
            if (refreshToken(account).isPresent()) {
                refreshed++;
            }
        }
        log.info("令牌刷新完成，成功: {}/{}", refreshed, expiring.size());
    }

    /**
     * 恢复失效时间超过阈值的代理
     */
    @Override
    public void recoverProxies() {
        long recoveryMs = TimeUnit.MINUTES.toMillis(qwenProperties.getProxyRecoveryMinutes());
        long now = System.currentTimeMillis();
        lock.lock();
        try {
            int recovered = 0;
            for (Map.Entry<String, ProxyStatus> entry : proxyStatuses.entrySet()) {
                ProxyStatus status = entry.getValue();
                if (!status.isHealthy() && now - status.getLastFailureAt() >= recoveryMs) {
                    status.setHealthy(true);
                    status.setFailureCount(0);
                    recovered++;
                    log.info("代理{}已恢复为健康状态", ProxyUrlUtils.hostForLog(entry.getKey()));
                }
            }
            if (recovered > 0) {
                persistenceService.saveProxyStatuses(proxyStatuses);
            }
        } finally {
            lock.unlock();
        }
    }

    private Optional<Account> refreshToken(Account account) {
        String email = account.getEmail();
        try {
            String token = tokenService.login(email, account.getPassword());
            TokenInfo tokenInfo = tokenService.validateToken(token);
            if (tokenInfo.getExpiresAt() <= nowSeconds()) {
                log.warn("账号{}新令牌已过期，放弃使用", email);
                loginFailures.put(email, System.currentTimeMillis());
                return Optional.empty();
            }
            loginFailures.remove(email);

            Account updated;
            lock.lock();
            try {
                Account stored = accounts.stream()
                        .filter(acc -> acc.getEmail().equals(email))
                        .findFirst()
                        .orElse(null);
                if (stored == null) {
                    log.info("账号{}刷新期间已被删除", email);
                    return Optional.empty();
                }
                stored.setToken(token);
                stored.setTokenExpiresAt(tokenInfo.getExpiresAt());
                updated = stored.copy();
                persistenceService.saveAccount(updated);
            } finally {
                lock.unlock();
            }
            log.info("账号{}令牌已刷新，过期时间: {}", email, tokenInfo.getExpiresAt());
            return Optional.of(updated);
        } catch (AuthException e) {
            log.warn("账号{}令牌刷新失败: {}", email, e.getMessage());
            loginFailures.put(email, System.currentTimeMillis());
            return Optional.empty();
        }
    }

    private boolean loginAllowed(String email) {
        Long lastFailure = loginFailures.get(email);
        return lastFailure == null || System.currentTimeMillis() - lastFailure >= LOGIN_RETRY_INTERVAL_MS;
    }

    @Override
    public Map<String, String> getProxyBindings() {
        lock.lock();
        try {
            return new LinkedHashMap<>(proxyBindings);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, ProxyStatus> getProxyStatuses() {
        lock.lock();
        try {
            Map<String, ProxyStatus> statuses = new LinkedHashMap<>();
            proxyPool.forEach(proxy -> statuses.put(proxy, statusOf(proxy).copy()));
            return statuses;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String healthSummary() {
        lock.lock();
        try {
            long now = nowSeconds();
            long validAccounts = accounts.stream().filter(acc -> acc.hasUsableToken(now)).count();
            long healthyProxies = proxyPool.stream().filter(proxy -> statusOf(proxy).isHealthy()).count();
            return String.format("Qwen代理服务运行正常，有效账号数: %d/%d，健康代理数: %d/%d",
                    validAccounts, accounts.size(), healthyProxies, proxyPool.size());
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        maintenanceScheduler.shutdownNow();
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}
