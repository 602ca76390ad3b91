package com.alibaba.cloud.ai.organizer.cache.exception;

/**
 * 缓存记录损坏 (格式错误、截断、schema 不匹配)
 * 只在缓存层内部抛出, 由调用方降级为缓存未命中
 *
 * @author RobustH
 */
public class CacheCorruptionException extends CacheException {

    public CacheCorruptionException(String message) {
        super(message);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
