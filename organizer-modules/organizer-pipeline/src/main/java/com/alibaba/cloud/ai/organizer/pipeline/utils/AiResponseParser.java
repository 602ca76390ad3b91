package com.alibaba.cloud.ai.organizer.pipeline.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型回复解析
 * 模型经常把 JSON 包在 ``` 代码块里, 或输出 \_ 这种非法转义
 *
 * @author RobustH
 */
@Slf4j
public final class AiResponseParser {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private AiResponseParser() {
    }

    /**
     * 从回复中取出 JSON 文本
     */
    public static String extractJson(String response) {
        if (response == null) {
            return "";
        }
        String text;
        int fence = response.indexOf(JSON_FENCE);
        if (fence >= 0) {
            text = between(response, fence + JSON_FENCE.length());
        } else if ((fence = response.indexOf(FENCE)) >= 0) {
            text = between(response, fence + FENCE.length());
        } else {
            text = response.strip();
        }
        return text.replace("\\_", "_");
    }

    /**
     * 解析为 JSON 对象
     *
     * @throws IllegalArgumentException 不是合法的 JSON 对象
     */
    public static JsonNode parseObject(ObjectMapper objectMapper, String response) {
        String json = extractJson(response);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("模型回复不是合法 JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("模型回复不是 JSON 对象");
        }
        return node;
    }

    /**
     * 读取字符串列表; 兼容数组和逗号分隔的字符串两种写法
     */
    public static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText().strip();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            return values;
        }
        for (String part : node.asText().split(",")) {
            String value = part.strip();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static String between(String response, int start) {
        int end = response.indexOf(FENCE, start);
        return (end < 0 ? response.substring(start) : response.substring(start, end)).strip();
    }
}
