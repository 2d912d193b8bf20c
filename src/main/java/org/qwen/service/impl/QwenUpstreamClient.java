package org.qwen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.NoHttpResponseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.qwen.config.ProxyHttpClientFactory;
import org.qwen.config.QwenProperties;
import org.qwen.domain.exception.UpstreamException;
import org.qwen.domain.exception.UpstreamException.UpstreamErrorKind;
import org.qwen.domain.vo.UpstreamResponse;
import org.qwen.service.IUpstreamClient;
import org.qwen.utils.ProxyUrlUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Service
public class QwenUpstreamClient implements IUpstreamClient {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/141.0.0.0 Safari/537.36 Edg/141.0.0.0";

    private final ProxyHttpClientFactory clientFactory;
    private final QwenProperties qwenProperties;
    private final ObjectMapper objectMapper;

    public QwenUpstreamClient(ProxyHttpClientFactory clientFactory,
                              QwenProperties qwenProperties,
                              ObjectMapper objectMapper) {
        this.clientFactory = clientFactory;
        this.qwenProperties = qwenProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public UpstreamResponse post(String url, String token, Object body, String proxyUrl) {
        CloseableHttpClient httpClient;
        try {
            httpClient = clientFactory.clientFor(proxyUrl);
        } catch (IllegalArgumentException e) {
            throw new UpstreamException(UpstreamErrorKind.OTHER, "代理地址无效: " + e.getMessage(), e);
        }

        HttpPost httpPost = buildHttpPost(url, token);
        try {
            httpPost.setEntity(new StringEntity(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new UpstreamException(UpstreamErrorKind.OTHER, "序列化请求体失败", e);
        }

        try {
            return httpClient.execute(httpPost, response -> {
                String responseBody = response.getEntity() == null
                        ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                return new UpstreamResponse(response.getCode(), responseBody);
            });
        } catch (IOException e) {
            UpstreamErrorKind kind = classify(e);
            log.debug("上游请求异常[代理: {}, 类别: {}]: {}", ProxyUrlUtils.hostForLog(proxyUrl), kind, e.toString());
            throw new UpstreamException(kind, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 按异常类型判定错误类别，连接重置/拒绝、超时、DNS 失败都属于网络瞬时错误
     */
    static UpstreamErrorKind classify(IOException e) {
        if (e instanceof ConnectException
                || e instanceof SocketException
                || e instanceof InterruptedIOException
                || e instanceof UnknownHostException
                || e instanceof NoHttpResponseException
                || e instanceof ConnectionClosedException) {
            return UpstreamErrorKind.TRANSIENT_NETWORK;
        }
        Throwable cause = e.getCause();
        if (cause instanceof IOException && cause != e) {
            return classify((IOException) cause);
        }
        return UpstreamErrorKind.OTHER;
    }

    private HttpPost buildHttpPost(String url, String token) {
        HttpPost httpPost = new HttpPost(url);
        if (token != null) {
            httpPost.setHeader("Authorization", "Bearer " + token);
        }
        httpPost.setHeader("Content-Type", "application/json");
        httpPost.setHeader("User-Agent", USER_AGENT);
        httpPost.setHeader("Accept", "*/*");
        httpPost.setHeader("Connection", "keep-alive");
        String itna = qwenProperties.getSsxmodItna();
        if (itna != null && !itna.isEmpty()) {
            String itna2 = qwenProperties.getSsxmodItna2() == null ? "" : qwenProperties.getSsxmodItna2();
            httpPost.setHeader("Cookie", "ssxmod_itna=" + itna + ";ssxmod_itna2=" + itna2);
        }
        return httpPost;
    }
}
