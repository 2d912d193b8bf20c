package org.qwen.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.ApiKeyValidator;
import org.qwen.domain.exception.ServiceException;
import org.qwen.domain.model.R;
import org.qwen.domain.vo.ChatDispatchResult;
import org.qwen.service.IAccountService;
import org.qwen.service.IChatDispatchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api")
public class ChatController {

    private final IChatDispatchService chatDispatchService;
    private final IAccountService accountService;
    private final ApiKeyValidator apiKeyValidator;

    public ChatController(IChatDispatchService chatDispatchService,
                          IAccountService accountService,
                          ApiKeyValidator apiKeyValidator) {
        this.chatDispatchService = chatDispatchService;
        this.accountService = accountService;
        this.apiKeyValidator = apiKeyValidator;
    }

    @PostMapping("/v1/chat/completions")
    public ResponseEntity<Object> chatCompletions(@RequestBody ObjectNode body, HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        if (!body.hasNonNull("messages")) {
            throw new ServiceException(400, "请求消息列表不能为空");
        }
        log.info("收到聊天请求，模型: {}", body.path("model").asText("default"));

        ChatDispatchResult result = chatDispatchService.sendChatRequest(body);
        if (!result.isStatus()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(R.fail(502, "上游服务暂时不可用"));
        }
        return ResponseEntity.ok(result.getResponse());
    }

    @GetMapping("/health")
    public R<String> health() {
        return R.ok(accountService.healthSummary());
    }
}
