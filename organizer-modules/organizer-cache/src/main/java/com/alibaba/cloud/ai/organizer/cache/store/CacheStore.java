package com.alibaba.cloud.ai.organizer.cache.store;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 持久化缓存存储
 * 每个键一个条目; put 是改变 get 结果的唯一途径 (显式删除除外), 没有后台淘汰或 TTL 清理
 *
 * @author RobustH
 */
public interface CacheStore {

    /**
     * 读取条目
     *
     * @param key 缓存键
     * @return 条目; 键不存在或记录损坏时为空 (损坏记录只记录警告, 不抛异常)
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * 原子写入条目, 覆盖同一键的旧条目
     *
     * @throws com.alibaba.cloud.ai.organizer.cache.exception.CacheWriteException 写入失败时
     */
    void put(CacheKey key, byte[] payload, Fingerprint fingerprint);

    /**
     * 删除单个条目
     *
     * @return 删除的条目数 (0 或 1)
     */
    int delete(CacheKey key);

    /**
     * 删除某阶段的所有条目 (全局 + 逐项)
     *
     * @return 删除的条目数
     */
    int deleteStage(String stageId);

    /**
     * 删除全部条目
     *
     * @return 删除的条目数
     */
    int deleteAll();

    /**
     * 统计每个阶段的条目数和总字节数
     */
    CacheStats stats();

    /**
     * 缓存根目录
     */
    Path directory();
}
