package org.qwen.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.qwen.config.QwenProperties;
import org.qwen.domain.Account;
import org.qwen.domain.ProxyStatus;
import org.qwen.domain.TokenInfo;
import org.qwen.domain.exception.AuthException;
import org.qwen.service.ITokenService;
import org.qwen.storage.MemoryStorageBackend;
import org.qwen.storage.StorageBackend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 账号轮询、代理绑定以及网络失败后的代理切换
 */
class AccountServiceImplTest {

    private static final String PROXY_1 = "socks5://10.0.0.1:1080";
    private static final String PROXY_2 = "socks5://10.0.0.2:1080";
    private static final String PROXY_3 = "socks5://10.0.0.3:1080";

    private DataPersistenceServiceImpl persistenceService;
    private ITokenService tokenService;
    private QwenProperties qwenProperties;
    private final List<AccountServiceImpl> created = new ArrayList<>();

    @BeforeEach
    void setUp() {
        persistenceService = new DataPersistenceServiceImpl(new MemoryStorageBackend(), new ObjectMapper());
        tokenService = mock(ITokenService.class);
        qwenProperties = new QwenProperties();
    }

    @AfterEach
    void tearDown() {
        created.forEach(AccountServiceImpl::shutdown);
    }

    @Test
    void rotationVisitsEveryValidAccountBeforeRepeating() {
        persistenceService.saveAccount(validAccount("a@example.com"));
        persistenceService.saveAccount(validAccount("b@example.com"));
        persistenceService.saveAccount(validAccount("c@example.com"));
        AccountServiceImpl service = newService();

        Set<String> firstRound = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            firstRound.add(service.getNextAccount().orElseThrow().getEmail());
        }

        assertEquals(Set.of("a@example.com", "b@example.com", "c@example.com"), firstRound);
        assertEquals("a@example.com", service.getNextAccount().orElseThrow().getEmail());
    }

    @Test
    void accountsWithoutUsableTokenAreSkipped() {
        when(tokenService.login(anyString(), anyString())).thenThrow(new AuthException("rejected"));
        persistenceService.saveAccount(validAccount("a@example.com"));
        persistenceService.saveAccount(new Account("b@example.com", "pw", "old-token", nowSeconds() - 10));
        persistenceService.saveAccount(new Account("c@example.com", null, null, null));
        persistenceService.saveAccount(validAccount("d@example.com"));
        AccountServiceImpl service = newService();

        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            picked.add(service.getNextAccount().orElseThrow().getEmail());
        }

        assertEquals(List.of("a@example.com", "d@example.com", "a@example.com", "d@example.com"), picked);
        // 退避窗口内不再重试失败的登录
        verify(tokenService, times(1)).login("b@example.com", "pw");
    }

    @Test
    void expiredTokenIsRefreshedBeforeAccountIsReturned() {
        long newExpiry = nowSeconds() + 3600;
        when(tokenService.login("a@example.com", "pw")).thenReturn("fresh-token");
        when(tokenService.validateToken("fresh-token")).thenReturn(new TokenInfo(newExpiry));
        persistenceService.saveAccount(new Account("a@example.com", "pw", "stale-token", nowSeconds() - 1));
        AccountServiceImpl service = newService();

        Account account = service.getNextAccount().orElseThrow();

        assertEquals("fresh-token", account.getToken());
        assertEquals(newExpiry, account.getTokenExpiresAt());
        Account persisted = persistenceService.loadAccounts().get(0);
        assertEquals("fresh-token", persisted.getToken());
        assertEquals(newExpiry, persisted.getTokenExpiresAt());
    }

    @Test
    void noUsableAccountYieldsEmpty() {
        persistenceService.saveAccount(new Account("a@example.com", null, "old", nowSeconds() - 100));
        AccountServiceImpl service = newService();

        assertEquals(Optional.empty(), service.getNextAccount());
        assertEquals(Optional.empty(), newServiceWithoutAccounts().getNextAccount());
        verify(tokenService, never()).login(anyString(), anyString());
    }

    @Test
    void proxiesAreAssignedOnFirstAccessAndPersisted() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2, PROXY_3));
        AccountServiceImpl service = newService();

        String a = service.getProxyForAccount("a@example.com");
        String b = service.getProxyForAccount("b@example.com");
        String c = service.getProxyForAccount("c@example.com");

        assertEquals(Set.of(PROXY_1, PROXY_2, PROXY_3), Set.of(a, b, c));
        assertEquals(a, service.getProxyForAccount("a@example.com"));
        assertEquals(a, persistenceService.loadProxyBindings().get("a@example.com"));
    }

    @Test
    void noConfiguredProxiesMeansDirectConnection() {
        AccountServiceImpl service = newService();

        assertNull(service.getProxyForAccount("a@example.com"));
        assertTrue(persistenceService.loadProxyBindings().isEmpty());
    }

    @Test
    void networkFailureRebindsToAnotherHealthyProxy() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2, PROXY_3));
        AccountServiceImpl service = newService();
        String original = service.getProxyForAccount("a@example.com");

        service.handleNetworkFailure("a@example.com", original);

        String replacement = service.getProxyForAccount("a@example.com");
        assertNotEquals(original, replacement);
        assertEquals(replacement, persistenceService.loadProxyBindings().get("a@example.com"));
        ProxyStatus status = persistenceService.loadProxyStatuses().get(original);
        assertFalse(status.isHealthy());
        assertEquals(1, status.getFailureCount());
        assertTrue(status.getLastFailureAt() > 0);
    }

    @Test
    void replacementPrefersLeastRecentlyFailedProxy() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2, PROXY_3));
        Map<String, ProxyStatus> statuses = new LinkedHashMap<>();
        statuses.put(PROXY_2, new ProxyStatus(true, 0, System.currentTimeMillis() - 1000, 0L));
        statuses.put(PROXY_3, new ProxyStatus(true, 0, System.currentTimeMillis() - 60_000, 0L));
        persistenceService.saveProxyStatuses(statuses);
        persistenceService.saveProxyBinding("a@example.com", PROXY_1);
        AccountServiceImpl service = newService();

        service.handleNetworkFailure("a@example.com", PROXY_1);

        assertEquals(PROXY_3, service.getProxyForAccount("a@example.com"));
    }

    @Test
    void staleProxyFailureOnlyUpdatesStatus() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2, PROXY_3));
        persistenceService.saveProxyBinding("a@example.com", PROXY_1);
        AccountServiceImpl service = newService();
        service.handleNetworkFailure("a@example.com", PROXY_1);
        String current = service.getProxyForAccount("a@example.com");

        service.handleNetworkFailure("a@example.com", PROXY_1);

        assertEquals(current, service.getProxyForAccount("a@example.com"));
        assertEquals(2, service.getProxyStatuses().get(PROXY_1).getFailureCount());
    }

    @Test
    void exhaustedPoolFallsBackToNoProxy() {
        qwenProperties.setProxies(List.of(PROXY_1));
        AccountServiceImpl service = newService();
        assertEquals(PROXY_1, service.getProxyForAccount("a@example.com"));

        service.handleNetworkFailure("a@example.com", PROXY_1);

        assertNull(service.getProxyForAccount("a@example.com"));
        assertTrue(persistenceService.loadProxyBindings().containsKey("a@example.com"));
        assertNull(persistenceService.loadProxyBindings().get("a@example.com"));
    }

    @Test
    void successRestoresProxyHealth() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2));
        AccountServiceImpl service = newService();
        service.handleNetworkFailure("a@example.com", PROXY_1);

        service.markProxySuccess(PROXY_1);

        ProxyStatus status = persistenceService.loadProxyStatuses().get(PROXY_1);
        assertTrue(status.isHealthy());
        assertEquals(0, status.getFailureCount());
    }

    @Test
    void recoverProxiesOnlyRevivesProxiesPastCooldown() {
        qwenProperties.setProxies(List.of(PROXY_1, PROXY_2));
        qwenProperties.setProxyRecoveryMinutes(30);
        long now = System.currentTimeMillis();
        Map<String, ProxyStatus> statuses = new LinkedHashMap<>();
        statuses.put(PROXY_1, new ProxyStatus(false, 3, now - TimeUnit.MINUTES.toMillis(31), 0L));
        statuses.put(PROXY_2, new ProxyStatus(false, 1, now, 0L));
        persistenceService.saveProxyStatuses(statuses);
        AccountServiceImpl service = newService();

        service.recoverProxies();

        Map<String, ProxyStatus> persisted = persistenceService.loadProxyStatuses();
        assertTrue(persisted.get(PROXY_1).isHealthy());
        assertFalse(persisted.get(PROXY_2).isHealthy());
    }

    @Test
    void addAccountLogsInAndRemoveAccountDropsIt() {
        long expiry = nowSeconds() + 7200;
        when(tokenService.login("new@example.com", "pw")).thenReturn("jwt");
        when(tokenService.validateToken("jwt")).thenReturn(new TokenInfo(expiry));
        AccountServiceImpl service = newService();

        Account added = service.addAccount("new@example.com", "pw");

        assertEquals("jwt", added.getToken());
        assertEquals("new@example.com", service.getNextAccount().orElseThrow().getEmail());
        assertEquals(1, persistenceService.loadAccounts().size());

        assertTrue(service.removeAccount("new@example.com"));
        assertFalse(service.removeAccount("new@example.com"));
        assertTrue(service.listAccounts().isEmpty());
        assertTrue(persistenceService.loadAccounts().isEmpty());
    }

    @Test
    void addAccountKeepsAccountWhenLoginFails() {
        when(tokenService.login("bad@example.com", "pw")).thenThrow(new AuthException("rejected"));
        AccountServiceImpl service = newService();

        Account added = service.addAccount("bad@example.com", "pw");

        assertNull(added.getToken());
        assertEquals(1, service.listAccounts().size());
    }

    @Test
    void refreshExpiringTokensOnlyTouchesAccountsInsideWindow() {
        qwenProperties.setTokenRefreshAheadHours(24);
        long soon = nowSeconds() + 3600;
        long later = nowSeconds() + TimeUnit.DAYS.toSeconds(7);
        persistenceService.saveAccount(new Account("soon@example.com", "pw", "t1", soon));
        persistenceService.saveAccount(new Account("later@example.com", "pw", "t2", later));
        when(tokenService.login("soon@example.com", "pw")).thenReturn("t1-new");
        when(tokenService.validateToken("t1-new")).thenReturn(new TokenInfo(later));
        AccountServiceImpl service = newService();

        service.refreshExpiringTokens();

        verify(tokenService, times(1)).login("soon@example.com", "pw");
        verify(tokenService, never()).login("later@example.com", "pw");
        assertEquals("t1-new", persistenceService.loadAccounts().get(0).getToken());
    }

    @Test
    void startsFromStoredDocumentWithNullEntries() throws IOException {
        String stored = "{\"accounts\":[null,{\"email\":\"a@example.com\",\"token\":\"t\",\"expires\":"
                + (nowSeconds() + 3600) + "}],\"proxyStatuses\":{\"" + PROXY_1 + "\":null}}";
        StorageBackend backend = mock(StorageBackend.class);
        when(backend.name()).thenReturn("mock");
        when(backend.read()).thenReturn(Optional.of(stored));
        persistenceService = new DataPersistenceServiceImpl(backend, new ObjectMapper());
        qwenProperties.setProxies(List.of(PROXY_1));

        AccountServiceImpl service = newService();

        assertEquals("a@example.com", service.getNextAccount().orElseThrow().getEmail());
        assertTrue(service.getProxyStatuses().get(PROXY_1).isHealthy());
    }

    private AccountServiceImpl newService() {
        AccountServiceImpl service = new AccountServiceImpl(persistenceService, tokenService, qwenProperties);
        created.add(service);
        return service;
    }

    private AccountServiceImpl newServiceWithoutAccounts() {
        DataPersistenceServiceImpl empty = new DataPersistenceServiceImpl(new MemoryStorageBackend(), new ObjectMapper());
        AccountServiceImpl service = new AccountServiceImpl(empty, tokenService, qwenProperties);
        created.add(service);
        return service;
    }

    private static Account validAccount(String email) {
        return new Account(email, null, "token-" + email, nowSeconds() + 3600);
    }

    private static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}
