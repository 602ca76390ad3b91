package com.alibaba.cloud.ai.organizer.cache.policy;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.alibaba.cloud.ai.organizer.cache.store.CacheEntry;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于指纹相等的失效策略
 * 没有基于时间的过期: 只有源数据变化或显式清理才会使条目失效
 *
 * @author RobustH
 */
@Slf4j
public class FingerprintInvalidationPolicy implements InvalidationPolicy {

    @Override
    public boolean isValid(CacheEntry entry, Fingerprint currentFingerprint) {
        if (entry == null || currentFingerprint == null) {
            // 主体已消失: 强制重新计算, 由计算步骤暴露真实错误
            return false;
        }
        boolean valid = currentFingerprint.equals(entry.getFingerprint());
        if (!valid) {
            log.debug("缓存已失效: key={}, stored={}, current={}",
                    entry.getKey(), entry.getFingerprint(), currentFingerprint);
        }
        return valid;
    }
}
