package com.alibaba.cloud.ai.organizer.cache.exception;

/**
 * 缓存写入失败 (磁盘满、无权限、目录缺失)
 * 致命错误, 立即终止流水线
 *
 * @author RobustH
 */
public class CacheWriteException extends CacheException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
