package org.qwen.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public ProxyHttpClientFactory proxyHttpClientFactory(QwenProperties qwenProperties) {
        return new ProxyHttpClientFactory(qwenProperties.getTimeout());
    }
}
