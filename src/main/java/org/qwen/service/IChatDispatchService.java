package org.qwen.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.qwen.domain.vo.ChatDispatchResult;

import java.util.Optional;

public interface IChatDispatchService {

    /**
     * 发送聊天请求：选账号、建会话、发补全，网络错误时换代理重试。
     * 不抛出异常，失败统一返回 status=false
     */
    ChatDispatchResult sendChatRequest(ObjectNode body);

    /**
     * 创建上游会话，返回会话 ID；重试耗尽或遇到不可重试错误时返回 empty
     */
    Optional<String> generateChatId(String token, String model, String email, String proxyUrl);
}
