package org.qwen.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.qwen.config.ApiKeyValidator;
import org.qwen.domain.dto.SettingRequest;
import org.qwen.domain.exception.ServiceException;
import org.qwen.domain.model.R;
import org.qwen.service.IDataPersistenceService;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final IDataPersistenceService persistenceService;
    private final ApiKeyValidator apiKeyValidator;

    public SettingsController(IDataPersistenceService persistenceService, ApiKeyValidator apiKeyValidator) {
        this.persistenceService = persistenceService;
        this.apiKeyValidator = apiKeyValidator;
    }

    @GetMapping
    public R<Map<String, String>> getSettings(HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        return R.ok(persistenceService.loadSettings());
    }

    @PutMapping
    public R<Map<String, String>> saveSetting(@Validated @RequestBody SettingRequest request,
                                              HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        persistenceService.saveSetting(request.getKey().trim(), request.getValue());
        log.info("设置项已更新: {}", request.getKey());
        return R.ok(persistenceService.loadSettings());
    }

    @DeleteMapping("/{key}")
    public R<Boolean> removeSetting(@PathVariable String key, HttpServletRequest httpRequest) {
        apiKeyValidator.validate(httpRequest);
        if (!persistenceService.removeSetting(key)) {
            throw new ServiceException(404, "设置项不存在: " + key);
        }
        return R.ok(true);
    }
}
