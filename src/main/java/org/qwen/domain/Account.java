package org.qwen.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 上游账号：登录凭据 + 当前令牌
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String email;

    private String password;

    private String token;

    // 令牌过期时间（秒级时间戳）
    @JsonAlias("expires")
    private Long tokenExpiresAt;

    public Account(String email, String password) {
        this.email = email;
        this.password = password;
    }

    /**
     * 令牌存在且未过期
     */
    @JsonIgnore
    public boolean hasUsableToken(long nowEpochSeconds) {
        return token != null && !token.isEmpty()
                && tokenExpiresAt != null && tokenExpiresAt > nowEpochSeconds;
    }

    @JsonIgnore
    public boolean canLogin() {
        return password != null && !password.isEmpty();
    }

    public Account copy() {
        return new Account(email, password, token, tokenExpiresAt);
    }
}
