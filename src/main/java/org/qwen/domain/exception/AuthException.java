package org.qwen.domain.exception;

/**
 * 上游登录失败或令牌无法解析
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
