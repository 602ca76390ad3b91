package com.alibaba.cloud.ai.organizer.cli;

import com.alibaba.cloud.ai.organizer.cache.runner.CacheMode;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineRequest;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineStageId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 解析并校验后的命令行参数
 *
 * @author RobustH
 */
@Getter
@Builder
@ToString
public class CommandLineOptions {

    private final Path source;

    private final Path destination;

    private final Path cacheDir;

    private final boolean noCache;

    private final boolean noCacheWrite;

    /**
     * --clear-cache 是否出现
     */
    private final boolean clearRequested;

    private final boolean clearAll;

    @Builder.Default
    private final Set<PipelineStageId> clearStages = EnumSet.noneOf(PipelineStageId.class);

    private final boolean cacheStats;

    private final PipelineStageId stopBefore;

    private final boolean dryRun;

    private final boolean overwrite;

    public CacheMode cacheMode() {
        return new CacheMode(!noCache, !noCacheWrite);
    }

    /**
     * 只清理缓存, 不运行流水线
     */
    public boolean isClearOnly() {
        return clearRequested && source == null;
    }

    public PipelineRequest toRequest() {
        List<Path> skip = new ArrayList<>();
        skip.add(cacheDir);
        if (destination != null) {
            skip.add(destination);
        }
        return PipelineRequest.builder()
                .source(source)
                .destination(destination)
                .clearAll(clearAll)
                .clearStages(clearStages.isEmpty() ? EnumSet.noneOf(PipelineStageId.class) : EnumSet.copyOf(clearStages))
                .stopBefore(stopBefore)
                .dryRun(dryRun)
                .overwrite(overwrite)
                .skipDirectories(skip)
                .build();
    }
}
