package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 一次流水线运行的参数
 *
 * @author RobustH
 */
@Getter
@Builder
@ToString
public class PipelineRequest {

    private final Path source;

    /**
     * 目标根目录; 为空时第五阶段不运行
     */
    private final Path destination;

    /**
     * 运行前清理缓存的阶段
     */
    @Builder.Default
    private final Set<PipelineStageId> clearStages = EnumSet.noneOf(PipelineStageId.class);

    /**
     * 运行前清理全部缓存
     */
    private final boolean clearAll;

    /**
     * 在这个阶段之前停止 (--skip-stageN); 为空表示运行全部阶段
     */
    private final PipelineStageId stopBefore;

    private final boolean dryRun;

    private final boolean overwrite;

    /**
     * 扫描时跳过的目录
     */
    @Builder.Default
    private final List<Path> skipDirectories = List.of();

    public boolean runs(PipelineStageId stage) {
        if (stopBefore != null && stage.compareTo(stopBefore) >= 0) {
            return false;
        }
        return stage != PipelineStageId.STAGE5 || destination != null;
    }
}
