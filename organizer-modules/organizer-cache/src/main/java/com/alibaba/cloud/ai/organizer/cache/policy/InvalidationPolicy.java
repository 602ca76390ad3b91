package com.alibaba.cloud.ai.organizer.cache.policy;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.alibaba.cloud.ai.organizer.cache.store.CacheEntry;

/**
 * 缓存失效策略
 *
 * @author RobustH
 */
public interface InvalidationPolicy {

    /**
     * 判断已存储的条目对当前主体是否仍然有效
     *
     * @param entry              缓存条目
     * @param currentFingerprint 主体当前指纹; 无法计算时为 null
     * @return 有效返回 true
     */
    boolean isValid(CacheEntry entry, Fingerprint currentFingerprint);
}
