package org.qwen.config;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.qwen.domain.exception.ServiceException;
import org.qwen.service.IDataPersistenceService;
import org.springframework.stereotype.Component;

/**
 * 校验调用方 API Key，设置项 apiKey 优先于配置文件
 */
@Slf4j
@Component
public class ApiKeyValidator {

    public static final String API_KEY_SETTING = "apiKey";

    private final QwenProperties qwenProperties;
    private final IDataPersistenceService persistenceService;

    public ApiKeyValidator(QwenProperties qwenProperties, IDataPersistenceService persistenceService) {
        this.qwenProperties = qwenProperties;
        this.persistenceService = persistenceService;
    }

    public void validate(HttpServletRequest request) {
        String apiKey = extractApiKey(request);
        String expected = persistenceService.getSetting(API_KEY_SETTING).orElse(qwenProperties.getApiKey());
        if (apiKey == null || !apiKey.equals(expected)) {
            throw new ServiceException(401, "无效的API密钥");
        }
    }

    private String extractApiKey(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7).trim();
        }

        String apiKeyFromQuery = request.getParameter("api_key");
        if (apiKeyFromQuery != null && !apiKeyFromQuery.trim().isEmpty()) {
            return apiKeyFromQuery.trim();
        }

        String apiKeyFromHeader = request.getHeader("X-API-Key");
        if (apiKeyFromHeader != null && !apiKeyFromHeader.trim().isEmpty()) {
            return apiKeyFromHeader.trim();
        }

        log.warn("未提供有效的API密钥[{} {}]", request.getMethod(), request.getRequestURI());
        return null;
    }
}
