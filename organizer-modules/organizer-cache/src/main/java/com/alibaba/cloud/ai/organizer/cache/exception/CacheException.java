package com.alibaba.cloud.ai.organizer.cache.exception;

/**
 * 缓存层异常基类
 *
 * @author RobustH
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
