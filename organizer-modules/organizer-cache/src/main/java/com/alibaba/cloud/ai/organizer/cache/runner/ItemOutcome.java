package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个工作项的处理结果, 逐项处理时回调给监听器
 *
 * @author RobustH
 */
@Getter
@ToString
@AllArgsConstructor
public class ItemOutcome {

    private final String itemId;

    private final Status status;

    /**
     * 在排序后列表中的位置 (从 1 开始)
     */
    private final int index;

    private final int total;

    /**
     * 失败原因, 仅 FAILED 时非空
     */
    private final String error;

    public enum Status {
        HIT,
        COMPUTED,
        FAILED
    }
}
