package org.qwen.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 令牌解码结果
 */
@Data
@AllArgsConstructor
public class TokenInfo {

    private long expiresAt; // 秒级时间戳

}
