package org.qwen.service;

import org.qwen.domain.vo.UpstreamResponse;

public interface IUpstreamClient {

    /**
     * 以 JSON 形式 POST 到上游。任意 HTTP 状态都作为响应返回；
     * 传输层失败抛出 UpstreamException，并带上错误类别
     *
     * @param token    Bearer 令牌，可为 null
     * @param proxyUrl 代理地址，null 表示直连
     */
    UpstreamResponse post(String url, String token, Object body, String proxyUrl);
}
