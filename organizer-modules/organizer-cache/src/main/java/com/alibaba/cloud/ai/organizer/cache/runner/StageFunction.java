package com.alibaba.cloud.ai.organizer.cache.runner;

/**
 * 阶段计算函数: 纯函数, 不感知缓存
 *
 * @param <I> 输入类型 (逐项模式下为单个工作项)
 * @param <O> 输出类型
 * @author RobustH
 */
@FunctionalInterface
public interface StageFunction<I, O> {

    /**
     * @throws StageComputeException 或任意 RuntimeException 表示计算失败
     */
    O compute(I input);
}
