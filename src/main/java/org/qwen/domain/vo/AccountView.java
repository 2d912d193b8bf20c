package org.qwen.domain.vo;

import lombok.Data;
import org.qwen.domain.Account;

/**
 * 账号对外视图（不含密码与完整令牌）
 */
@Data
public class AccountView {

    private String email;

    private boolean tokenPresent;

    private Long tokenExpiresAt;

    private boolean valid;

    private String proxy;

    public static AccountView of(Account account, String proxy, long nowEpochSeconds) {
        AccountView view = new AccountView();
        view.setEmail(account.getEmail());
        view.setTokenPresent(account.getToken() != null && !account.getToken().isEmpty());
        view.setTokenExpiresAt(account.getTokenExpiresAt());
        view.setValid(account.hasUsableToken(nowEpochSeconds));
        view.setProxy(proxy);
        return view;
    }
}
