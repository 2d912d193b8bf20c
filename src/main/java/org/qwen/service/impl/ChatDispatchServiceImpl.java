package org.qwen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.QwenProperties;
import org.qwen.domain.Account;
import org.qwen.domain.exception.UpstreamException;
import org.qwen.domain.vo.ChatDispatchResult;
import org.qwen.domain.vo.UpstreamResponse;
import org.qwen.service.IAccountService;
import org.qwen.service.IChatDispatchService;
import org.qwen.service.IUpstreamClient;
import org.qwen.utils.ProxyUrlUtils;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class ChatDispatchServiceImpl implements IChatDispatchService {

    private static final String DEFAULT_MODEL = "qwen3-max";

    private final IAccountService accountService;
    private final IUpstreamClient upstreamClient;
    private final QwenProperties qwenProperties;
    private final ObjectMapper objectMapper;

    public ChatDispatchServiceImpl(IAccountService accountService,
                                   IUpstreamClient upstreamClient,
                                   QwenProperties qwenProperties,
                                   ObjectMapper objectMapper) {
        this.accountService = accountService;
        this.upstreamClient = upstreamClient;
        this.qwenProperties = qwenProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChatDispatchResult sendChatRequest(ObjectNode body) {
        int maxRetries = qwenProperties.getMaxRetries();
        String model = body.path("model").asText(DEFAULT_MODEL);
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            Optional<Account> accountInfo = accountService.getNextAccount();
            if (accountInfo.isEmpty()) {
                log.error("无法获取有效的账户信息");
                return ChatDispatchResult.failure();
            }

            Account account = accountInfo.get();
            String email = account.getEmail();
            String token = account.getToken();
            // 每次循环重新获取代理，可能已在 handleNetworkFailure 中更换
            String proxy = accountService.getProxyForAccount(email);

            Optional<String> chatId = generateChatId(token, model, email, proxy);
            if (chatId.isEmpty()) {
                // 会话创建内部已处理代理失败与重试
                log.error("无法生成 chat_id，终止聊天请求");
                return ChatDispatchResult.failure();
            }
            // 会话创建过程中可能换过代理
            proxy = accountService.getProxyForAccount(email);

            try {
                log.info("发送聊天请求[账号: {}, 代理: {}, 尝试: {}/{}]",
                        email, ProxyUrlUtils.hostForLog(proxy), attempt, maxRetries);
                ObjectNode payload = body.deepCopy();
                payload.put("chat_id", chatId.get());
                // 统一以非流式方式向上游取完整结果
                payload.put("stream", false);
                String url = qwenProperties.getBaseUrl() + "/api/v2/chat/completions?chat_id="
                        + URLEncoder.encode(chatId.get(), StandardCharsets.UTF_8);

                UpstreamResponse response = upstreamClient.post(url, token, payload, proxy);
                if (!response.isOk()) {
                    throw UpstreamException.httpStatus(response.getStatusCode());
                }
                accountService.markProxySuccess(proxy);
                return ChatDispatchResult.success(parseBody(response.getBody()), token);
            } catch (UpstreamException e) {
                lastError = e;
                log.error("发送聊天请求失败[账号: {} ({}), 尝试: {}/{}]: {}",
                        email, ProxyUrlUtils.hostForLog(proxy), attempt, maxRetries, e.getMessage());
                if (proxy != null && e.isTransient()) {
                    log.warn("检测到网络错误，可能由代理引起，正在更换代理并重试...");
                    accountService.handleNetworkFailure(email, proxy);
                    continue;
                }
                break;
            }
        }

        log.error("聊天请求最终失败，最后一次错误: {}", lastError == null ? "无" : lastError.getMessage());
        return ChatDispatchResult.failure();
    }

    @Override
    public Optional<String> generateChatId(String token, String model, String email, String proxyUrl) {
        int maxRetries = qwenProperties.getMaxRetries();
        String currentProxy = proxyUrl;
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                UpstreamResponse response = upstreamClient.post(
                        qwenProperties.getBaseUrl() + "/api/v2/chats/new", token, buildNewChatPayload(model), currentProxy);
                if (!response.isOk()) {
                    throw UpstreamException.httpStatus(response.getStatusCode());
                }
                String chatId = parseBody(response.getBody()).path("data").path("id").asText("");
                if (chatId.isEmpty()) {
                    throw UpstreamException.malformed("生成chat_id时响应数据无效");
                }
                return Optional.of(chatId);
            } catch (UpstreamException e) {
                lastError = e;
                log.error("生成chat_id失败[账号: {} ({}), 尝试: {}/{}]: {}",
                        email, ProxyUrlUtils.hostForLog(currentProxy), attempt, maxRetries, e.getMessage());
                if (currentProxy != null && e.isTransient()) {
                    log.warn("检测到网络错误，可能由代理引起，正在更换代理并重试...");
                    accountService.handleNetworkFailure(email, currentProxy);
                    currentProxy = accountService.getProxyForAccount(email);
                    continue;
                }
                break;
            }
        }

        log.error("生成chat_id最终失败，最后一次错误: {}", lastError == null ? "无" : lastError.getMessage());
        return Optional.empty();
    }

    private Map<String, Object> buildNewChatPayload(String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", "New Chat");
        payload.put("models", List.of(model));
        payload.put("chat_mode", "local");
        payload.put("chat_type", qwenProperties.getChatType());
        payload.put("timestamp", System.currentTimeMillis());
        return payload;
    }

    private JsonNode parseBody(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw UpstreamException.malformed("上游响应不是有效的JSON");
        }
    }
}
