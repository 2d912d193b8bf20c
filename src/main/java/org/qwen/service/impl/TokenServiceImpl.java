package org.qwen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.QwenProperties;
import org.qwen.domain.TokenInfo;
import org.qwen.domain.exception.AuthException;
import org.qwen.domain.exception.UpstreamException;
import org.qwen.domain.vo.UpstreamResponse;
import org.qwen.service.ITokenService;
import org.qwen.service.IUpstreamClient;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

@Slf4j
@Service
public class TokenServiceImpl implements ITokenService {

    private final IUpstreamClient upstreamClient;
    private final QwenProperties qwenProperties;
    private final ObjectMapper objectMapper;

    public TokenServiceImpl(IUpstreamClient upstreamClient,
                            QwenProperties qwenProperties,
                            ObjectMapper objectMapper) {
        this.upstreamClient = upstreamClient;
        this.qwenProperties = qwenProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String login(String email, String password) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("email", email);
        payload.put("password", sha256Hex(password));

        UpstreamResponse response;
        try {
            response = upstreamClient.post(qwenProperties.getBaseUrl() + "/api/v1/auths/signin", null, payload, null);
        } catch (UpstreamException e) {
            throw new AuthException("登录请求失败[账号: " + email + "]: " + e.getMessage(), e);
        }

        if (!response.isOk()) {
            throw new AuthException("登录被拒绝[账号: " + email + "]，状态码: " + response.getStatusCode());
        }

        try {
            JsonNode tokenNode = objectMapper.readTree(response.getBody()).path("token");
            if (!tokenNode.isTextual() || tokenNode.asText().isEmpty()) {
                throw new AuthException("登录响应缺少token字段[账号: " + email + "]");
            }
            log.info("账号{}登录成功", email);
            return tokenNode.asText();
        } catch (JsonProcessingException e) {
            throw new AuthException("解析登录响应失败[账号: " + email + "]", e);
        }
    }

    @Override
    public TokenInfo validateToken(String token) {
        if (token == null) {
            throw new AuthException("令牌为空");
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            throw new AuthException("令牌格式错误");
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode expNode = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8)).path("exp");
            if (!expNode.canConvertToLong()) {
                throw new AuthException("令牌缺少exp声明");
            }
            return new TokenInfo(expNode.asLong());
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new AuthException("令牌解码失败", e);
        }
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }
}
