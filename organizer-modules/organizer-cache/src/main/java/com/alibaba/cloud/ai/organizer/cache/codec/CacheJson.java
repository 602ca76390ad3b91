package com.alibaba.cloud.ai.organizer.cache.codec;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * 缓存使用的 ObjectMapper
 * 属性和 Map 键按字母排序, 同一对象总是编码为相同的字节 (内容指纹依赖这一点)
 *
 * @author RobustH
 */
public final class CacheJson {

    private CacheJson() {
    }

    public static ObjectMapper deterministicMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false)
                .build();
    }
}
