package com.alibaba.cloud.ai.organizer.cache.codec;

/**
 * 阶段结果与缓存负载字节之间的编解码
 *
 * @param <T> 阶段结果类型
 * @author RobustH
 */
public interface StageCodec<T> {

    byte[] encode(T value);

    /**
     * 解码负载
     *
     * @throws com.alibaba.cloud.ai.organizer.cache.exception.CacheCorruptionException 格式错误或 schema 不匹配
     */
    T decode(byte[] payload);
}
