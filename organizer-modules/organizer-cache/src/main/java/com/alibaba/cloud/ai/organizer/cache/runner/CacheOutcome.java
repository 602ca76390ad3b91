package com.alibaba.cloud.ai.organizer.cache.runner;

/**
 * 一次缓存查找的结果
 *
 * @author RobustH
 */
public enum CacheOutcome {

    HIT,

    MISS,

    /** 读取被禁用, 没有查找 */
    BYPASSED;

    public boolean isHit() {
        return this == HIT;
    }
}
