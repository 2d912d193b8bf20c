package org.qwen.service;

import org.qwen.domain.Account;
import org.qwen.domain.ProxyStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface IAccountService {

    /**
     * 轮询下一个令牌可用的账号；令牌缺失或过期的账号先尝试刷新，刷新失败则跳过
     */
    Optional<Account> getNextAccount();

    /**
     * 账号当前绑定的代理，首次访问时从健康代理中分配；返回 null 表示直连
     */
    String getProxyForAccount(String email);

    /**
     * 标记代理失效并为账号更换代理
     */
    void handleNetworkFailure(String email, String proxyUrl);

    void markProxySuccess(String proxyUrl);

    List<Account> listAccounts();

    /**
     * 登录并保存账号，登录失败时以空令牌保存
     */
    Account addAccount(String email, String password);

    boolean removeAccount(String email);

    Optional<Account> refreshAccountToken(String email);

    void refreshExpiringTokens();

    void recoverProxies();

    Map<String, String> getProxyBindings();

    Map<String, ProxyStatus> getProxyStatuses();

    String healthSummary();
}
