package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 整阶段执行结果
 *
 * @param <O> 阶段输出
 * @author RobustH
 */
@Getter
@ToString(exclude = "result")
@AllArgsConstructor
public class StageExecution<O> {

    private final String stageId;

    private final O result;

    private final CacheOutcome outcome;

    private final Duration elapsed;
}
