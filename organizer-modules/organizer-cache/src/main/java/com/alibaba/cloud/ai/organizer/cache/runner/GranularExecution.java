package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 逐项阶段的执行结果: 由缓存命中项和新计算项拼装而成
 *
 * @param <R> 单项结果
 * @author RobustH
 */
@Getter
@Builder
@ToString(exclude = "results")
public class GranularExecution<R> {

    private final String stageId;

    /**
     * 成功的结果, 按工作项ID排序
     */
    private final List<R> results;

    private final List<ItemFailure> failures;

    private final int itemHits;

    private final int itemMisses;

    /**
     * 是否直接使用了整阶段快速路径条目
     */
    private final boolean fastPath;

    private final Duration elapsed;

    public boolean isFullyCached() {
        return itemMisses == 0 && failures.isEmpty();
    }
}
