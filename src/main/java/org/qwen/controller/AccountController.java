package org.qwen.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.ApiKeyValidator;
import org.qwen.domain.Account;
import org.qwen.domain.dto.AccountRequest;
import org.qwen.domain.exception.ServiceException;
import org.qwen.domain.model.R;
import org.qwen.domain.vo.AccountView;
import org.qwen.domain.vo.ProxyOverview;
import org.qwen.service.IAccountService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
public class AccountController {

    private final IAccountService accountService;
    private final ApiKeyValidator apiKeyValidator;

    public AccountController(IAccountService accountService, ApiKeyValidator apiKeyValidator) {
        this.accountService = accountService;
        this.apiKeyValidator = apiKeyValidator;
    }

    @GetMapping("/accounts")
    public R<List<AccountView>> listAccounts(HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        Map<String, String> bindings = accountService.getProxyBindings();
        long now = System.currentTimeMillis() / 1000;
        return R.ok(accountService.listAccounts().stream()
                .map(account -> AccountView.of(account, bindings.get(account.getEmail()), now))
                .collect(Collectors.toList()));
    }

    @PostMapping("/accounts")
    public R<AccountView> addAccount(@Validated @RequestBody AccountRequest request, HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        log.info("添加账号: {}", request.getEmail());
        Account account = accountService.addAccount(request.getEmail().trim(), request.getPassword());
        return R.ok(AccountView.of(account, null, System.currentTimeMillis() / 1000));
    }

    @DeleteMapping("/accounts/{email}")
    public R<Boolean> removeAccount(@PathVariable String email, HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        if (!accountService.removeAccount(email)) {
            throw new ServiceException(404, "账号不存在: " + email);
        }
        return R.ok(true);
    }

    @PostMapping("/accounts/{email}/refresh")
    public R<AccountView> refreshAccount(@PathVariable String email, HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        Account account = accountService.refreshAccountToken(email)
                .orElseThrow(() -> new ServiceException("账号令牌刷新失败: " + email));
        String proxy = accountService.getProxyBindings().get(email);
        return R.ok(AccountView.of(account, proxy, System.currentTimeMillis() / 1000));
    }

    @GetMapping("/proxies")
    public R<ProxyOverview> listProxies(HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        return R.ok(new ProxyOverview(accountService.getProxyStatuses(), accountService.getProxyBindings()));
    }
}
