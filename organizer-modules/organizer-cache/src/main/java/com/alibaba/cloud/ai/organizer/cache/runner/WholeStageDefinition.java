package com.alibaba.cloud.ai.organizer.cache.runner;

import com.alibaba.cloud.ai.organizer.cache.codec.StageCodec;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.function.Function;

/**
 * 整阶段缓存的阶段定义
 *
 * @param <I> 阶段输入
 * @param <O> 阶段输出
 * @author RobustH
 */
@Getter
@Builder
public class WholeStageDefinition<I, O> {

    @NonNull
    private final String stageId;

    /**
     * 缓存键身份 (通常是源目录)
     */
    @NonNull
    private final String identity;

    /**
     * 计算阶段主体的当前指纹; 主体不可用时抛出 IoUnavailableException
     */
    @NonNull
    private final Function<I, Fingerprint> subject;

    @NonNull
    private final StageCodec<O> codec;

    @NonNull
    private final StageFunction<I, O> compute;
}
