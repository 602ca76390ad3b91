package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelConnectivityCheckerTest {

    private ChatClient chatClient;
    private ModelConnectivityChecker checker;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        checker = new ModelConnectivityChecker(new ChatClientRegistry(chatClient, new OrganizerProperties()));
    }

    @Test
    void answeringModelIsAvailable() {
        when(chatClient.prompt().options(any()).user(anyString()).call().content()).thenReturn("ok");

        assertThat(checker.isAvailable(model("openai"))).isTrue();
    }

    @Test
    void failingCallMarksModelUnavailable() {
        when(chatClient.prompt().options(any()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("401 Unauthorized"));

        assertThat(checker.isAvailable(model("openai"))).isFalse();
    }

    @Test
    void unconfiguredProviderIsUnavailable() {
        assertThat(checker.isAvailable(model("anthropic"))).isFalse();
    }

    private static ModelInfo model(String provider) {
        return ModelInfo.builder().name("m").provider(provider).modelName("m-1").build();
    }
}
