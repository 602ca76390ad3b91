package com.alibaba.cloud.ai.organizer.cache.store;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存条目
 * 写入后不可变; 同一个键的再次写入会整体替换旧条目. 没有过期字段, 有效性只由指纹比较决定
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    public static final int FORMAT_VERSION = 1;

    private int formatVersion;

    private CacheKey key;

    private Fingerprint fingerprint;

    /**
     * 写入时间 (毫秒), 仅用于展示
     */
    private long writtenAt;

    /**
     * 编码后的阶段结果 (JSON 中以 Base64 存储)
     */
    private byte[] payload;
}
