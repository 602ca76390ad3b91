package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisFailure;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 一次运行的报告: 各阶段摘要、逐项失败和已经得到的阶段结果 (未运行的阶段为 null)
 *
 * @author RobustH
 */
@Getter
@Builder
public class PipelineReport {

    private final List<StageReport> stages;

    private final List<AnalysisFailure> itemFailures;

    private final ScanResult scan;

    private final DiscoveryResult discovery;

    private final AnalysisResult analysis;

    private final TaxonomyResult taxonomy;

    private final MoveResult move;

    public StageReport stage(PipelineStageId id) {
        return stages.get(id.ordinal());
    }

    /**
     * 没有阶段失败
     */
    public boolean isSuccess() {
        return stages.stream().noneMatch(report -> report.getStatus() == StageStatus.FAILED);
    }
}
