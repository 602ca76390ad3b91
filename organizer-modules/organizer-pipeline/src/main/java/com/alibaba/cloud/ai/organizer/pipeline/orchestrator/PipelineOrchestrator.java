package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.FingerprintComputer;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.IoUnavailableException;
import com.alibaba.cloud.ai.organizer.cache.runner.GranularExecution;
import com.alibaba.cloud.ai.organizer.cache.runner.GranularStageDefinition;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemFailure;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.StageExecution;
import com.alibaba.cloud.ai.organizer.cache.runner.StageRunner;
import com.alibaba.cloud.ai.organizer.cache.runner.WholeStageDefinition;
import com.alibaba.cloud.ai.organizer.cache.store.CacheStore;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisFailure;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 流水线编排器
 * 按顺序执行五个阶段, 每个阶段的结果 (缓存或新计算) 作为下一阶段的输入
 *
 * @author RobustH
 */
@Slf4j
public class PipelineOrchestrator {

    private final StageRunner stageRunner;
    private final PipelineStages stages;
    private final PipelineCodecs codecs;
    private final FingerprintComputer fingerprintComputer;
    private final Consumer<ItemOutcome> progressListener;

    public PipelineOrchestrator(StageRunner stageRunner, PipelineStages stages, PipelineCodecs codecs,
                                FingerprintComputer fingerprintComputer) {
        this(stageRunner, stages, codecs, fingerprintComputer, outcome -> { });
    }

    public PipelineOrchestrator(StageRunner stageRunner, PipelineStages stages, PipelineCodecs codecs,
                                FingerprintComputer fingerprintComputer, Consumer<ItemOutcome> progressListener) {
        this.stageRunner = stageRunner;
        this.stages = stages;
        this.codecs = codecs;
        this.fingerprintComputer = fingerprintComputer;
        this.progressListener = progressListener;
    }

    /**
     * 执行流水线
     *
     * @param request 运行参数
     * @return 运行报告
     * @throws StageFailedException 整阶段失败 (包括缓存写入失败和中断)
     */
    public PipelineReport run(PipelineRequest request) {
        PipelineState state = new PipelineState();
        Path source = request.getSource().toAbsolutePath().normalize();
        String identity = source.toString();
        log.info("流水线开始: 源目录={}, 缓存模式={}", source, stageRunner.getCacheMode());

        clearCaches(request);

        // 1. 扫描
        ScanRequest scanRequest = new ScanRequest(source, new ArrayList<>(request.getSkipDirectories()));
        ScanResult scan = runWhole(state, PipelineStageId.STAGE1,
                WholeStageDefinition.<ScanRequest, ScanResult>builder()
                        .stageId(PipelineStageId.STAGE1.id())
                        .identity(identity)
                        .subject(input -> withSettings(PipelineStageId.STAGE1, directoryFingerprint(input)))
                        .codec(codecs.getScan())
                        .compute(stages::scan)
                        .build(),
                scanRequest);
        state.setScan(scan);
        if (!request.runs(PipelineStageId.STAGE2)) {
            return finish(state);
        }

        // 2. 模型发现
        DiscoveryRequest discoveryRequest = new DiscoveryRequest(scan, stages.modelCatalog());
        DiscoveryResult discovery = runWhole(state, PipelineStageId.STAGE2,
                WholeStageDefinition.<DiscoveryRequest, DiscoveryResult>builder()
                        .stageId(PipelineStageId.STAGE2.id())
                        .identity(identity)
                        .subject(input -> withSettings(PipelineStageId.STAGE2, contentFingerprint(input)))
                        .codec(codecs.getDiscovery())
                        .compute(stages::discover)
                        .build(),
                discoveryRequest);
        state.setDiscovery(discovery);
        if (!request.runs(PipelineStageId.STAGE3)) {
            return finish(state);
        }

        // 3. 逐文件分析
        AnalysisResult analysis = runAnalysis(state, identity, scan, discovery);
        state.setAnalysis(analysis);
        if (!request.runs(PipelineStageId.STAGE4)) {
            return finish(state);
        }

        // 4. 分类规划 (只使用成功的分析)
        TaxonomyResult taxonomy = runWhole(state, PipelineStageId.STAGE4,
                WholeStageDefinition.<AnalysisResult, TaxonomyResult>builder()
                        .stageId(PipelineStageId.STAGE4.id())
                        .identity(identity)
                        .subject(input -> withSettings(PipelineStageId.STAGE4, contentFingerprint(input)))
                        .codec(codecs.getTaxonomy())
                        .compute(stages::plan)
                        .build(),
                analysis);
        state.setTaxonomy(taxonomy);
        if (!request.runs(PipelineStageId.STAGE5)) {
            if (request.getDestination() == null && request.getStopBefore() == null) {
                log.info("未指定目标目录, 跳过 {}", PipelineStageId.STAGE5);
            }
            return finish(state);
        }

        // 5. 移动文件
        MoveRequest moveRequest = new MoveRequest(taxonomy,
                request.getDestination().toAbsolutePath().normalize().toString(),
                request.isDryRun(), request.isOverwrite());
        MoveResult move = runWhole(state, PipelineStageId.STAGE5,
                WholeStageDefinition.<MoveRequest, MoveResult>builder()
                        .stageId(PipelineStageId.STAGE5.id())
                        .identity(identity)
                        .subject(input -> withSettings(PipelineStageId.STAGE5, contentFingerprint(input)))
                        .codec(codecs.getMove())
                        .compute(stages::move)
                        .build(),
                moveRequest);
        state.setMove(move);
        return finish(state);
    }

    private AnalysisResult runAnalysis(PipelineState state, String identity, ScanResult scan, DiscoveryResult discovery) {
        GranularStageDefinition<FileInfo, FileAnalysis> definition =
                GranularStageDefinition.<FileInfo, FileAnalysis>builder()
                        .stageId(PipelineStageId.STAGE3.id())
                        .identity(identity)
                        .itemId(FileInfo::getFilePath)
                        .itemFingerprint(file -> withSettings(PipelineStageId.STAGE3,
                                fingerprintComputer.fingerprintFile(Path.of(file.getFilePath()))))
                        .itemCodec(codecs.getFileAnalysis())
                        .aggregateCodec(codecs.getFileAnalysisList())
                        .compute(file -> stages.analyze(file, discovery))
                        .build();

        GranularExecution<FileAnalysis> execution = execute(state, PipelineStageId.STAGE3, true, () ->
                stageRunner.runGranular(definition, scan.getFiles(), outcome -> {
                    state.recordItem(outcome);
                    progressListener.accept(outcome);
                }));
        state.completeGranular(PipelineStageId.STAGE3, execution);

        List<AnalysisFailure> failures = new ArrayList<>(execution.getFailures().size());
        for (ItemFailure failure : execution.getFailures()) {
            failures.add(new AnalysisFailure(failure.getItemId(), failure.getError()));
        }
        return AnalysisResult.builder()
                .sourceDirectory(scan.getSourceDirectory())
                .analyses(new ArrayList<>(execution.getResults()))
                .failures(failures)
                .totalAnalyzed(execution.getResults().size())
                .totalErrors(failures.size())
                .build();
    }

    private <I, O> O runWhole(PipelineState state, PipelineStageId id, WholeStageDefinition<I, O> definition, I input) {
        StageExecution<O> execution = execute(state, id, false, () -> stageRunner.runWholeStage(definition, input));
        state.completeWhole(id, execution);
        return execution.getResult();
    }

    /**
     * 执行一个阶段; 任何异常都使该阶段 FAILED 并终止流水线
     */
    private <T> T execute(PipelineState state, PipelineStageId id, boolean granular, Supplier<T> body) {
        if (granular) {
            state.startGranular(id);
        } else {
            state.start(id);
        }
        long start = System.nanoTime();
        try {
            return body.get();
        } catch (RuntimeException e) {
            state.fail(id, e, (System.nanoTime() - start) / 1_000_000);
            throw new StageFailedException(id, state.toReport(), e);
        }
    }

    private void clearCaches(PipelineRequest request) {
        CacheStore store = stageRunner.getCacheStore();
        if (request.isClearAll()) {
            int removed = store.deleteAll();
            log.info("已清理全部缓存: {} 个条目", removed);
            return;
        }
        for (PipelineStageId id : PipelineStageId.values()) {
            if (request.getClearStages().contains(id)) {
                int removed = store.deleteStage(id.id());
                log.info("已清理 {} 的缓存: {} 个条目", id, removed);
            }
        }
    }

    private Fingerprint directoryFingerprint(ScanRequest request) {
        List<Path> files;
        try {
            files = stages.enumerate(request);
        } catch (UncheckedIOException e) {
            throw new IoUnavailableException("无法枚举源目录: " + request.getSource(), e);
        }
        return fingerprintComputer.fingerprintDirectory(request.getSource(), files);
    }

    /**
     * 把阶段配置并入主体指纹; 配置改变时该阶段的缓存随之失效
     */
    private Fingerprint withSettings(PipelineStageId id, Fingerprint subject) {
        Map<String, Object> settings = stages.settings(id);
        if (settings == null || settings.isEmpty()) {
            return subject;
        }
        return fingerprintComputer.fingerprintAggregate(List.of(subject, contentFingerprint(settings)));
    }

    private Fingerprint contentFingerprint(Object input) {
        return fingerprintComputer.fingerprintBytes(codecs.canonicalBytes(input));
    }

    private PipelineReport finish(PipelineState state) {
        PipelineReport report = state.toReport();
        log.info("流水线结束: 逐项失败={}", report.getItemFailures().size());
        return report;
    }
}
