package com.alibaba.cloud.ai.organizer.cache.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * 缓存统计 (只读取目录元数据, 不解码负载)
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private String directory;

    @Builder.Default
    private Map<String, StageStats> stages = new TreeMap<>();

    private long totalEntries;

    private long totalBytes;

    public double totalMegabytes() {
        return Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }

    public StageStats stage(String stageId) {
        return stages.getOrDefault(stageId, new StageStats());
    }

    /**
     * 单个阶段的统计
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StageStats {

        private long globalEntries;

        private long itemEntries;

        private long bytes;

        public long getEntries() {
            return globalEntries + itemEntries;
        }
    }
}
