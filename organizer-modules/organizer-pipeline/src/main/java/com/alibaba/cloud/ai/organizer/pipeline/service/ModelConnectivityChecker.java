package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

/**
 * 模型可用性检查器
 * 用一个最小的提示词调用模型, 调用失败即视为不可用 (不影响其他模型)
 *
 * @author RobustH
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelConnectivityChecker {

    private static final String PING_PROMPT = "Reply with the single word: ok";

    private final ChatClientRegistry chatClients;

    /**
     * 返回模型是否可用
     */
    public boolean isAvailable(ModelInfo model) {
        try {
            String reply = chatClients.forProvider(model.getProvider()).prompt()
                    .options(ChatOptions.builder().model(model.getModelName()).build())
                    .user(PING_PROMPT)
                    .call()
                    .content();
            boolean available = reply != null;
            log.info("模型连通性: {} ({}) -> {}", model.getName(), model.getModelName(), available ? "正常" : "无回复");
            return available;
        } catch (Exception e) {
            log.warn("模型不可用: {} ({}), 原因: {}", model.getName(), model.getModelName(), e.getMessage());
            return false;
        }
    }
}
