package org.qwen.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 代理健康状态
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProxyStatus {

    private boolean healthy = true;

    private int failureCount; // 连续失败次数

    private long lastFailureAt; // 最后失败时间戳（毫秒）

    private long lastSuccessAt; // 最后成功时间戳（毫秒）

    public static ProxyStatus healthy() {
        return new ProxyStatus();
    }

    public void markFailure(long now) {
        this.healthy = false;
        this.failureCount++;
        this.lastFailureAt = now;
    }

    public void markSuccess(long now) {
        this.healthy = true;
        this.failureCount = 0;
        this.lastSuccessAt = now;
    }

    public ProxyStatus copy() {
        return new ProxyStatus(healthy, failureCount, lastFailureAt, lastSuccessAt);
    }
}
