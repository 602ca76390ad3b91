package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.cache.runner.CacheOutcome;
import lombok.Data;

/**
 * 单个阶段的运行摘要
 *
 * @author RobustH
 */
@Data
public class StageReport {

    private final PipelineStageId stage;

    private StageStatus status = StageStatus.PENDING;

    /**
     * 整阶段的缓存结果; 逐项阶段在快速路径命中时为 HIT
     */
    private CacheOutcome outcome;

    /**
     * 是否为逐项阶段 (只有这类阶段有下面三个计数)
     */
    private boolean granular;

    private int itemHits;

    private int itemMisses;

    private int itemFailures;

    private long elapsedMillis;

    private String error;
}
