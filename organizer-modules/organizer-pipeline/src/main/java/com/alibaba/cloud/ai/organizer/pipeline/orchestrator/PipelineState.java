package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.cache.runner.CacheOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.GranularExecution;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemFailure;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.StageExecution;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisFailure;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单次运行的内存状态, 从不持久化
 * 进程中途退出时它随之丢失, 但缓存本身保持一致, 下次运行重新构建
 *
 * @author RobustH
 */
@Slf4j
public class PipelineState {

    private final Map<PipelineStageId, StageReport> reports = new EnumMap<>(PipelineStageId.class);

    private final List<ItemOutcome> itemOutcomes = new ArrayList<>();

    private final List<AnalysisFailure> itemFailures = new ArrayList<>();

    @Getter
    @Setter
    private ScanResult scan;

    @Getter
    @Setter
    private DiscoveryResult discovery;

    @Getter
    @Setter
    private AnalysisResult analysis;

    @Getter
    @Setter
    private TaxonomyResult taxonomy;

    @Getter
    @Setter
    private MoveResult move;

    public PipelineState() {
        for (PipelineStageId id : PipelineStageId.values()) {
            reports.put(id, new StageReport(id));
        }
    }

    public void start(PipelineStageId id) {
        StageReport report = transition(id, StageStatus.PENDING, StageStatus.RUNNING);
        report.setGranular(false);
        log.info("========== {} 开始 ==========", id);
    }

    public void startGranular(PipelineStageId id) {
        start(id);
        reports.get(id).setGranular(true);
    }

    public void completeWhole(PipelineStageId id, StageExecution<?> execution) {
        StageStatus status = execution.getOutcome().isHit() ? StageStatus.CACHED : StageStatus.COMPUTED;
        StageReport report = transition(id, StageStatus.RUNNING, status);
        report.setOutcome(execution.getOutcome());
        report.setElapsedMillis(execution.getElapsed().toMillis());
        log.info("========== {} 完成: {} ({} ms) ==========", id, status, report.getElapsedMillis());
    }

    public void completeGranular(PipelineStageId id, GranularExecution<?> execution) {
        StageStatus status = execution.isFullyCached() ? StageStatus.CACHED : StageStatus.COMPUTED;
        StageReport report = transition(id, StageStatus.RUNNING, status);
        report.setOutcome(execution.isFastPath() ? CacheOutcome.HIT : CacheOutcome.MISS);
        report.setItemHits(execution.getItemHits());
        report.setItemMisses(execution.getItemMisses());
        report.setItemFailures(execution.getFailures().size());
        report.setElapsedMillis(execution.getElapsed().toMillis());
        for (ItemFailure failure : execution.getFailures()) {
            itemFailures.add(new AnalysisFailure(failure.getItemId(), failure.getError()));
        }
        log.info("========== {} 完成: {}, 命中={}, 未命中={}, 失败={} ({} ms) ==========", id, status,
                report.getItemHits(), report.getItemMisses(), report.getItemFailures(), report.getElapsedMillis());
    }

    public void fail(PipelineStageId id, Throwable cause, long elapsedMillis) {
        StageReport report = transition(id, StageStatus.RUNNING, StageStatus.FAILED);
        report.setError(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        report.setElapsedMillis(elapsedMillis);
        log.error("========== {} 失败: {} ==========", id, report.getError());
    }

    public void recordItem(ItemOutcome outcome) {
        itemOutcomes.add(outcome);
    }

    public StageReport report(PipelineStageId id) {
        return reports.get(id);
    }

    public List<ItemOutcome> getItemOutcomes() {
        return Collections.unmodifiableList(itemOutcomes);
    }

    public PipelineReport toReport() {
        return PipelineReport.builder()
                .stages(List.copyOf(reports.values()))
                .itemFailures(List.copyOf(itemFailures))
                .scan(scan)
                .discovery(discovery)
                .analysis(analysis)
                .taxonomy(taxonomy)
                .move(move)
                .build();
    }

    private StageReport transition(PipelineStageId id, StageStatus from, StageStatus to) {
        StageReport report = reports.get(id);
        if (report.getStatus() != from) {
            throw new IllegalStateException(String.format("阶段 %s 不能从 %s 转换到 %s", id, report.getStatus(), to));
        }
        report.setStatus(to);
        return report;
    }
}
