package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 可用的 AI 模型
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    /**
     * 目录中的名称, MIME 映射引用这个名字
     */
    private String name;

    /**
     * 提供方: openai 或 organizer.providers 中配置的名称
     */
    private String provider;

    /**
     * 发送给服务端的模型ID
     */
    private String modelName;

    /**
     * 能力: text, image, audio, video
     */
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    private String description;

    /**
     * 本地模型 (例如 Ollama), 映射时优先
     */
    private boolean local;

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }
}
