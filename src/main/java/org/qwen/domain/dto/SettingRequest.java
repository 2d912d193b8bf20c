package org.qwen.domain.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SettingRequest {

    @NotBlank(message = "设置项名称不能为空")
    private String key;

    private String value;
}
