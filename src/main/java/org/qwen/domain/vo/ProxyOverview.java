package org.qwen.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.qwen.domain.ProxyStatus;

import java.util.Map;

@Data
@AllArgsConstructor
public class ProxyOverview {

    private Map<String, ProxyStatus> statuses;

    private Map<String, String> bindings;
}
