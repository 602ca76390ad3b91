package com.alibaba.cloud.ai.organizer.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatClient 配置
 * 默认客户端走 spring.ai.openai; 其他提供方 (Ollama、Anthropic) 的端点在 organizer.providers 中配置
 *
 * @author RobustH
 */
@Slf4j
@Configuration
public class AiClientConfig {

    @Value("${spring.ai.openai.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${spring.ai.openai.chat.options.model:gpt-4o-mini}")
    private String defaultModel;

    @Bean
    public ChatClient organizerChatClient(ChatClient.Builder builder) {
        log.info("ChatClient 已初始化: 地址={}, 默认模型={}", baseUrl, defaultModel);
        return builder.build();
    }
}
