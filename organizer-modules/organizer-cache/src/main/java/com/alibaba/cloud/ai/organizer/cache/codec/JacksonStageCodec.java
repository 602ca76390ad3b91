package com.alibaba.cloud.ai.organizer.cache.codec;

import com.alibaba.cloud.ai.organizer.cache.exception.CacheCorruptionException;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.List;

/**
 * 带 schema 版本的 Jackson 编解码器
 * 负载格式: {"schema": "...", "version": n, "data": {...}}; schema 或版本不一致在解码时即被发现
 *
 * @param <T> 阶段结果类型
 * @author RobustH
 */
public class JacksonStageCodec<T> implements StageCodec<T> {

    private static final String SCHEMA = "schema";
    private static final String VERSION = "version";
    private static final String DATA = "data";

    private final ObjectMapper objectMapper;
    private final String schema;
    private final int version;
    private final JavaType type;

    public JacksonStageCodec(ObjectMapper objectMapper, String schema, int version, JavaType type) {
        this.objectMapper = objectMapper;
        this.schema = schema;
        this.version = version;
        this.type = type;
    }

    public static <T> JacksonStageCodec<T> of(ObjectMapper objectMapper, String schema, int version, Class<T> type) {
        return new JacksonStageCodec<>(objectMapper, schema, version, objectMapper.constructType(type));
    }

    public static <E> JacksonStageCodec<List<E>> listOf(ObjectMapper objectMapper, String schema, int version, Class<E> elementType) {
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        return new JacksonStageCodec<>(objectMapper, schema, version, listType);
    }

    @Override
    public byte[] encode(T value) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put(SCHEMA, schema);
        envelope.put(VERSION, version);
        envelope.set(DATA, objectMapper.valueToTree(value));
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new CacheException("编码阶段结果失败: schema=" + schema, e);
        }
    }

    @Override
    public T decode(byte[] payload) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new CacheCorruptionException("负载不是合法 JSON: schema=" + schema, e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new CacheCorruptionException("负载缺少信封: schema=" + schema);
        }

        String actualSchema = envelope.path(SCHEMA).asText(null);
        int actualVersion = envelope.path(VERSION).asInt(-1);
        if (!schema.equals(actualSchema) || actualVersion != version) {
            throw new CacheCorruptionException(String.format(
                    "schema 不匹配: 期望 %s v%d, 实际 %s v%d", schema, version, actualSchema, actualVersion));
        }

        JsonNode data = envelope.get(DATA);
        if (data == null || data.isNull()) {
            throw new CacheCorruptionException("负载缺少数据: schema=" + schema);
        }
        try {
            return objectMapper.readerFor(type).readValue(data);
        } catch (IOException | IllegalArgumentException e) {
            throw new CacheCorruptionException("解码阶段结果失败: schema=" + schema, e);
        }
    }

    public String getSchema() {
        return schema;
    }

    public int getVersion() {
        return version;
    }
}
