package com.alibaba.cloud.ai.organizer.cache.runner;

import com.alibaba.cloud.ai.organizer.cache.codec.StageCodec;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.function.Function;

/**
 * 逐项缓存的阶段定义
 *
 * @param <T> 工作项
 * @param <R> 单项结果
 * @author RobustH
 */
@Getter
@Builder
public class GranularStageDefinition<T, R> {

    @NonNull
    private final String stageId;

    /**
     * 整阶段快速路径条目的身份
     */
    @NonNull
    private final String identity;

    /**
     * 工作项ID (文件路径), 同时决定处理顺序
     */
    @NonNull
    private final Function<T, String> itemId;

    @NonNull
    private final Function<T, Fingerprint> itemFingerprint;

    @NonNull
    private final StageCodec<R> itemCodec;

    @NonNull
    private final StageCodec<List<R>> aggregateCodec;

    @NonNull
    private final StageFunction<T, R> compute;
}
