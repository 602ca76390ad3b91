package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 第二阶段结果: 模型目录、MIME 到模型的映射、连通性
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryResult {

    @Builder.Default
    private List<ModelInfo> availableModels = new ArrayList<>();

    /**
     * MIME 类型 -> 模型名称
     */
    @Builder.Default
    private Map<String, String> mimeToModel = new TreeMap<>();

    /**
     * 模型名称 -> 是否连通
     */
    @Builder.Default
    private Map<String, Boolean> connectivity = new TreeMap<>();

    /**
     * 查找某个 MIME 类型对应的可用模型
     *
     * @return 模型; 没有映射、模型不在目录中或不连通时为 null
     */
    public ModelInfo resolveModel(String mimeType) {
        String name = mimeToModel.get(mimeType);
        if (name == null || !Boolean.TRUE.equals(connectivity.get(name))) {
            return null;
        }
        for (ModelInfo model : availableModels) {
            if (model.getName().equals(name)) {
                return model;
            }
        }
        return null;
    }
}
