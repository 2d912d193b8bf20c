package org.qwen.domain.exception;

import lombok.Getter;

/**
 * 上游调用失败，错误类别在传输层确定
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final UpstreamErrorKind kind;

    private final int statusCode; // 仅 HTTP_STATUS 有意义，其余为 -1

    public UpstreamException(UpstreamErrorKind kind, String message) {
        this(kind, -1, message, null);
    }

    public UpstreamException(UpstreamErrorKind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public UpstreamException(UpstreamErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static UpstreamException httpStatus(int statusCode) {
        return new UpstreamException(UpstreamErrorKind.HTTP_STATUS, statusCode,
                "Request failed with status code " + statusCode, null);
    }

    public static UpstreamException malformed(String message) {
        return new UpstreamException(UpstreamErrorKind.MALFORMED_RESPONSE, message);
    }

    public boolean isTransient() {
        return kind == UpstreamErrorKind.TRANSIENT_NETWORK;
    }

    public enum UpstreamErrorKind {
        // 连接重置/拒绝、超时、DNS 失败等，视为代理引起
        TRANSIENT_NETWORK,
        HTTP_STATUS,
        MALFORMED_RESPONSE,
        // 其他传输层错误（协议错误、代理地址无效等）
        OTHER
    }
}
