package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ChatClientRegistryTest {

    private ChatClient defaultClient;
    private ChatClient ollamaClient;
    private OrganizerProperties properties;
    private List<String> created;
    private ChatClientRegistry registry;

    @BeforeEach
    void setUp() {
        defaultClient = mock(ChatClient.class);
        ollamaClient = mock(ChatClient.class);
        properties = new OrganizerProperties();
        OrganizerProperties.Provider ollama = new OrganizerProperties.Provider();
        ollama.setBaseUrl("http://localhost:11434");
        properties.getProviders().put("ollama", ollama);
        created = new ArrayList<>();
        registry = new ChatClientRegistry(defaultClient, properties, endpoint -> {
            created.add(endpoint.getBaseUrl());
            return ollamaClient;
        });
    }

    @Test
    void openaiAndBlankProviderUseDefaultClient() {
        assertThat(registry.forProvider("openai")).isSameAs(defaultClient);
        assertThat(registry.forProvider(null)).isSameAs(defaultClient);
        assertThat(registry.forProvider(" ")).isSameAs(defaultClient);
        assertThat(created).isEmpty();
    }

    @Test
    void configuredProviderIsCreatedOnceAndReused() {
        assertThat(registry.forProvider("ollama")).isSameAs(ollamaClient);
        assertThat(registry.forProvider(" OLLAMA ")).isSameAs(ollamaClient);
        assertThat(created).containsExactly("http://localhost:11434");
    }

    @Test
    void configuredOpenaiEndpointReplacesDefaultClient() {
        OrganizerProperties.Provider proxy = new OrganizerProperties.Provider();
        proxy.setBaseUrl("http://proxy.internal");
        properties.getProviders().put("openai", proxy);

        assertThat(registry.forProvider("openai")).isSameAs(ollamaClient);
        assertThat(created).containsExactly("http://proxy.internal");
    }

    @Test
    void unknownProviderIsRejected() {
        assertThatThrownBy(() -> registry.forProvider("anthropic"))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("anthropic")
                .hasMessageContaining("ollama");
    }
}
