package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 按模型提供方选择 ChatClient
 * 每个提供方对应 organizer.providers 中的一个 OpenAI 兼容端点, 客户端在首次使用时创建;
 * 未配置的 openai 使用自动配置的默认客户端, 其他未配置的提供方一律拒绝
 *
 * @author RobustH
 */
@Slf4j
@Component
public class ChatClientRegistry {

    public static final String DEFAULT_PROVIDER = "openai";

    private final ChatClient defaultClient;
    private final OrganizerProperties properties;
    private final Function<OrganizerProperties.Provider, ChatClient> clientFactory;
    private final Map<String, ChatClient> clients = new ConcurrentHashMap<>();

    @Autowired
    public ChatClientRegistry(ChatClient defaultClient, OrganizerProperties properties) {
        this(defaultClient, properties, ChatClientRegistry::createClient);
    }

    public ChatClientRegistry(ChatClient defaultClient, OrganizerProperties properties,
                              Function<OrganizerProperties.Provider, ChatClient> clientFactory) {
        this.defaultClient = defaultClient;
        this.properties = properties;
        this.clientFactory = clientFactory;
    }

    /**
     * 返回提供方对应的客户端
     *
     * @param provider 提供方名称, 为空时视为 openai
     * @throws AnalysisException 提供方未配置
     */
    public ChatClient forProvider(String provider) {
        String name = normalize(provider);
        OrganizerProperties.Provider endpoint = properties.getProviders().get(name);
        if (endpoint == null) {
            if (DEFAULT_PROVIDER.equals(name)) {
                return defaultClient;
            }
            throw new AnalysisException("不支持的模型提供方: " + name
                    + " (已配置: " + properties.getProviders().keySet() + ")");
        }
        return clients.computeIfAbsent(name, key -> {
            log.info("创建 ChatClient: 提供方={}, 地址={}", key, endpoint.getBaseUrl());
            return clientFactory.apply(endpoint);
        });
    }

    static String normalize(String provider) {
        if (provider == null || provider.isBlank()) {
            return DEFAULT_PROVIDER;
        }
        return provider.strip().toLowerCase(Locale.ROOT);
    }

    private static ChatClient createClient(OrganizerProperties.Provider endpoint) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(endpoint.getBaseUrl())
                .apiKey(endpoint.getApiKey())
                .build();
        return ChatClient.create(OpenAiChatModel.builder().openAiApi(api).build());
    }
}
