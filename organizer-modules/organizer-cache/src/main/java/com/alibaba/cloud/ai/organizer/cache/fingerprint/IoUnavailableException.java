package com.alibaba.cloud.ai.organizer.cache.fingerprint;

import com.alibaba.cloud.ai.organizer.cache.exception.CacheException;

/**
 * 无法读取主体属性 (文件不存在、无权限等)
 * 调用方将其视为"必须重新计算"
 *
 * @author RobustH
 */
public class IoUnavailableException extends CacheException {

    public IoUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
