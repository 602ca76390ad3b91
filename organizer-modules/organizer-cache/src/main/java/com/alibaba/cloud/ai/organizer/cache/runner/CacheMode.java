package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 本次运行的缓存读写开关
 *
 * @author RobustH
 */
@Getter
@ToString
@AllArgsConstructor
public class CacheMode {

    /**
     * false 表示绕过 CacheStore.get, 总是重新计算 (--no-cache)
     */
    private final boolean readEnabled;

    /**
     * false 表示不写入缓存 (--no-cache-write)
     */
    private final boolean writeEnabled;

    public static CacheMode readWrite() {
        return new CacheMode(true, true);
    }

    public static CacheMode writeOnly() {
        return new CacheMode(false, true);
    }

    public static CacheMode disabled() {
        return new CacheMode(false, false);
    }
}
