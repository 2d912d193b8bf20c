package org.qwen.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UpstreamResponse {

    private int statusCode;

    private String body;

    public boolean isOk() {
        return statusCode == 200;
    }
}
