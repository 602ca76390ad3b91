package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.Getter;

/**
 * 逐项处理在两个工作项之间被中断
 * 已经完成的工作项都已写入缓存, 重启后只会计算剩余部分
 *
 * @author RobustH
 */
@Getter
public class StageInterruptedException extends RuntimeException {

    private final String stageId;
    private final int completedItems;
    private final int totalItems;

    public StageInterruptedException(String stageId, int completedItems, int totalItems) {
        super(String.format("阶段 %s 在 %d/%d 项后被中断", stageId, completedItems, totalItems));
        this.stageId = stageId;
        this.completedItems = completedItems;
        this.totalItems = totalItems;
    }
}
