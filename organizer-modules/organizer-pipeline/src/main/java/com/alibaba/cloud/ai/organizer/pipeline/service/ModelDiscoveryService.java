package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 第二阶段: 模型发现和 MIME 映射
 * 模型目录来自配置; 每个 MIME 类型按能力选择模型, 本地模型优先
 *
 * @author RobustH
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelDiscoveryService {

    public static final String CAPABILITY_TEXT = "text";
    public static final String CAPABILITY_IMAGE = "image";
    public static final String CAPABILITY_AUDIO = "audio";
    public static final String CAPABILITY_VIDEO = "video";

    private static final Set<String> TEXT_LIKE_APPLICATION_TYPES = Set.of(
            "application/json", "application/xml", "application/pdf", "application/yaml",
            "application/toml", "application/sql", "application/x-sh"
    );

    private final OrganizerProperties properties;
    private final ModelConnectivityChecker connectivityChecker;

    /**
     * 配置的模型目录
     */
    public List<ModelInfo> catalog() {
        return new ArrayList<>(properties.getModels().getCatalog());
    }

    public DiscoveryResult discover(DiscoveryRequest request) {
        List<ModelInfo> models = request.getCatalog();
        List<String> mimeTypes = request.getScan().getUniqueMimeTypes();
        log.info("开始模型发现: 模型={}, MIME 类型={}", models.size(), mimeTypes.size());

        if (models.isEmpty()) {
            log.warn("没有配置任何模型, 所有文件都将在分析阶段失败");
        }

        Map<String, String> mapping = createMapping(mimeTypes, models);
        Map<String, Boolean> connectivity = verifyConnectivity(models, mapping);

        log.info("模型发现完成: 映射={}, 可用模型={}", mapping.size(),
                connectivity.values().stream().filter(Boolean::booleanValue).count());
        return DiscoveryResult.builder()
                .availableModels(new ArrayList<>(models))
                .mimeToModel(mapping)
                .connectivity(connectivity)
                .build();
    }

    /**
     * 按能力为每个 MIME 类型选择模型
     */
    Map<String, String> createMapping(List<String> mimeTypes, List<ModelInfo> models) {
        Map<String, String> mapping = new TreeMap<>();
        if (models.isEmpty()) {
            return mapping;
        }
        ModelInfo textModel = pick(models, CAPABILITY_TEXT);
        ModelInfo fallback = textModel != null ? textModel : models.get(0);

        for (String mimeType : mimeTypes) {
            ModelInfo chosen;
            if (mimeType.startsWith("image/")) {
                chosen = pick(models, CAPABILITY_IMAGE);
            } else if (mimeType.startsWith("audio/")) {
                chosen = pick(models, CAPABILITY_AUDIO);
            } else if (mimeType.startsWith("video/")) {
                chosen = pick(models, CAPABILITY_VIDEO);
            } else if (mimeType.startsWith("text/") || TEXT_LIKE_APPLICATION_TYPES.contains(mimeType)) {
                chosen = textModel;
            } else {
                chosen = null;
            }
            mapping.put(mimeType, (chosen != null ? chosen : fallback).getName());
        }
        return mapping;
    }

    private Map<String, Boolean> verifyConnectivity(List<ModelInfo> models, Map<String, String> mapping) {
        Map<String, Boolean> connectivity = new TreeMap<>();
        boolean verify = properties.getModels().isVerifyConnectivity();
        for (ModelInfo model : models) {
            // 只验证实际被映射到的模型
            if (verify && mapping.containsValue(model.getName())) {
                connectivity.put(model.getName(), connectivityChecker.isAvailable(model));
            } else {
                connectivity.put(model.getName(), Boolean.TRUE);
            }
        }
        return connectivity;
    }

    private static ModelInfo pick(List<ModelInfo> models, String capability) {
        ModelInfo remote = null;
        for (ModelInfo model : models) {
            if (!model.hasCapability(capability)) {
                continue;
            }
            if (model.isLocal()) {
                return model;
            }
            if (remote == null) {
                remote = model;
            }
        }
        return remote;
    }
}
