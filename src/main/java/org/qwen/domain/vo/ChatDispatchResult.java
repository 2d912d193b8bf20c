package org.qwen.domain.vo;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 聊天分发结果：失败时 response 恒为 null
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatDispatchResult {

    private boolean status;

    private JsonNode response;

    private String currentToken;

    public static ChatDispatchResult success(JsonNode response, String currentToken) {
        return new ChatDispatchResult(true, response, currentToken);
    }

    public static ChatDispatchResult failure() {
        return new ChatDispatchResult(false, null, null);
    }
}
