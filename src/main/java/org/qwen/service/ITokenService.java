package org.qwen.service;

import org.qwen.domain.TokenInfo;

public interface ITokenService {

    /**
     * 登录上游获取令牌，失败抛出 AuthException
     */
    String login(String email, String password);

    /**
     * 本地解码令牌过期时间，不访问网络
     */
    TokenInfo validateToken(String token);
}
