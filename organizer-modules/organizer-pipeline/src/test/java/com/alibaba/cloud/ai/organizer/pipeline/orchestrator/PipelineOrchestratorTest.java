package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.cache.codec.CacheJson;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheWriteException;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.FingerprintComputer;
import com.alibaba.cloud.ai.organizer.cache.policy.FingerprintInvalidationPolicy;
import com.alibaba.cloud.ai.organizer.cache.runner.CacheMode;
import com.alibaba.cloud.ai.organizer.cache.runner.CacheOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.StageInterruptedException;
import com.alibaba.cloud.ai.organizer.cache.runner.StageRunner;
import com.alibaba.cloud.ai.organizer.cache.store.FileSystemCacheStore;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAssignment;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileCategory;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveOperation;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyNode;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOrchestratorTest {

    @TempDir
    Path source;

    @TempDir
    Path cacheDir;

    private final PipelineCodecs codecs = new PipelineCodecs();
    private FakeStages stages;

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @BeforeEach
    void setUp() throws IOException {
        stages = new FakeStages();
        for (String name : List.of("a.txt", "b.txt", "c.txt")) {
            Files.writeString(source.resolve(name), "content of " + name);
        }
    }

    private PipelineOrchestrator orchestrator(CacheMode mode) {
        return orchestrator(mode, outcome -> { });
    }

    private PipelineOrchestrator orchestrator(CacheMode mode, java.util.function.Consumer<ItemOutcome> listener) {
        return orchestrator(cacheDir, mode, listener);
    }

    private PipelineOrchestrator orchestrator(Path directory, CacheMode mode,
                                              java.util.function.Consumer<ItemOutcome> listener) {
        FingerprintComputer computer = new FingerprintComputer();
        StageRunner runner = new StageRunner(new FileSystemCacheStore(directory, CacheJson.deterministicMapper()),
                new FingerprintInvalidationPolicy(), computer, mode);
        return new PipelineOrchestrator(runner, stages, codecs, computer, listener);
    }

    private PipelineRequest.PipelineRequestBuilder request() {
        return PipelineRequest.builder()
                .source(source)
                .destination(source.resolveSibling(source.getFileName() + "-organized"));
    }

    private PipelineReport run(PipelineRequest request) {
        return orchestrator(CacheMode.readWrite()).run(request);
    }

    @Test
    void secondRunIsServedEntirelyFromCache() {
        PipelineReport first = run(request().build());
        Map<String, Integer> afterFirst = stages.snapshot();

        PipelineReport second = run(request().build());

        assertThat(stages.snapshot()).isEqualTo(afterFirst);
        assertThat(second.getStages()).extracting(StageReport::getStatus).containsOnly(StageStatus.CACHED);
        assertThat(second.stage(PipelineStageId.STAGE3).getOutcome()).isEqualTo(CacheOutcome.HIT);
        assertThat(codecs.getScan().encode(second.getScan())).isEqualTo(codecs.getScan().encode(first.getScan()));
        assertThat(codecs.getTaxonomy().encode(second.getTaxonomy()))
                .isEqualTo(codecs.getTaxonomy().encode(first.getTaxonomy()));
        assertThat(codecs.getMove().encode(second.getMove())).isEqualTo(codecs.getMove().encode(first.getMove()));
    }

    @Test
    void firstRunComputesEveryStage() {
        PipelineReport report = run(request().build());

        assertThat(report.getStages()).extracting(StageReport::getStatus).containsOnly(StageStatus.COMPUTED);
        assertThat(report.isSuccess()).isTrue();
        assertThat(stages.count("analyze")).isEqualTo(3);
        assertThat(report.getMove().getSuccessfulMoves()).isEqualTo(3);
        assertThat(report.stage(PipelineStageId.STAGE3).isGranular()).isTrue();
        assertThat(report.stage(PipelineStageId.STAGE3).getItemMisses()).isEqualTo(3);
    }

    @Test
    void clearingOneStageRecomputesOnlyThatStage() {
        run(request().build());
        Map<String, Integer> afterFirst = stages.snapshot();

        PipelineReport report = run(request().clearStages(EnumSet.of(PipelineStageId.STAGE3)).build());

        assertThat(stages.count("scan")).isEqualTo(afterFirst.get("scan"));
        assertThat(stages.count("discover")).isEqualTo(afterFirst.get("discover"));
        assertThat(stages.count("analyze")).isEqualTo(afterFirst.get("analyze") + 3);
        assertThat(stages.count("plan")).isEqualTo(afterFirst.get("plan"));
        assertThat(report.stage(PipelineStageId.STAGE1).getStatus()).isEqualTo(StageStatus.CACHED);
        assertThat(report.stage(PipelineStageId.STAGE3).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(report.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.CACHED);
    }

    @Test
    void clearAllRecomputesEverything() {
        run(request().build());

        PipelineReport report = run(request().clearAll(true).build());

        assertThat(report.getStages()).extracting(StageReport::getStatus).containsOnly(StageStatus.COMPUTED);
        assertThat(stages.count("scan")).isEqualTo(2);
        assertThat(stages.count("analyze")).isEqualTo(6);
    }

    @Test
    void noCacheModeRecomputesButKeepsCacheFresh() {
        run(request().build());

        PipelineReport bypassed = orchestrator(CacheMode.writeOnly()).run(request().build());
        PipelineReport cached = run(request().build());

        assertThat(bypassed.stage(PipelineStageId.STAGE1).getOutcome()).isEqualTo(CacheOutcome.BYPASSED);
        assertThat(bypassed.stage(PipelineStageId.STAGE1).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(stages.count("analyze")).isEqualTo(6);
        assertThat(cached.getStages()).extracting(StageReport::getStatus).containsOnly(StageStatus.CACHED);
    }

    @Test
    void modifiedFileIsReanalyzedAlone() throws IOException {
        run(request().build());
        Path b = source.resolve("b.txt");
        long before = Files.getLastModifiedTime(b).toMillis();
        Files.writeString(b, "edited content of b");
        Files.setLastModifiedTime(b, FileTime.fromMillis(before + 10_000));

        PipelineReport report = run(request().build());

        assertThat(stages.analyzed).containsExactly(
                source.resolve("a.txt").toString(), source.resolve("b.txt").toString(),
                source.resolve("c.txt").toString(), source.resolve("b.txt").toString());
        assertThat(report.stage(PipelineStageId.STAGE1).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(report.stage(PipelineStageId.STAGE3).getItemHits()).isEqualTo(2);
        assertThat(report.stage(PipelineStageId.STAGE3).getItemMisses()).isEqualTo(1);
    }

    @Test
    void changedScanSettingsRecomputeScan() {
        run(request().build());
        stages.settings.put(PipelineStageId.STAGE1, Map.of("excludePatterns", List.of("*.bin")));

        PipelineReport report = run(request().build());

        assertThat(report.stage(PipelineStageId.STAGE1).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(stages.count("scan")).isEqualTo(2);
        // 扫描结果没有变化, 后续阶段仍然命中
        assertThat(report.stage(PipelineStageId.STAGE2).getStatus()).isEqualTo(StageStatus.CACHED);
        assertThat(stages.count("analyze")).isEqualTo(3);
    }

    @Test
    void changedTaxonomySettingsRecomputeOnlyTaxonomy() {
        run(request().build());
        stages.settings.put(PipelineStageId.STAGE4, Map.of("maxTaxonomyFiles", 10));

        PipelineReport report = run(request().build());

        assertThat(report.stage(PipelineStageId.STAGE3).getStatus()).isEqualTo(StageStatus.CACHED);
        assertThat(report.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(stages.count("plan")).isEqualTo(2);
        assertThat(report.stage(PipelineStageId.STAGE5).getStatus()).isEqualTo(StageStatus.CACHED);
    }

    @Test
    void changedAnalysisSettingsReanalyzeEveryFile() {
        run(request().build());
        stages.settings.put(PipelineStageId.STAGE3, Map.of("maxContentChars", 500));

        PipelineReport report = run(request().build());

        assertThat(report.stage(PipelineStageId.STAGE3).getItemMisses()).isEqualTo(3);
        assertThat(stages.count("analyze")).isEqualTo(6);
    }

    @Test
    void stopBeforeLeavesLaterStagesPending() {
        PipelineReport report = run(request().stopBefore(PipelineStageId.STAGE4).build());

        assertThat(report.stage(PipelineStageId.STAGE3).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(report.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.PENDING);
        assertThat(report.stage(PipelineStageId.STAGE5).getStatus()).isEqualTo(StageStatus.PENDING);
        assertThat(report.getTaxonomy()).isNull();
        assertThat(stages.count("plan")).isZero();
        assertThat(stages.count("move")).isZero();
    }

    @Test
    void missingDestinationSkipsMoveStage() {
        PipelineReport report = run(PipelineRequest.builder().source(source).build());

        assertThat(report.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(report.stage(PipelineStageId.STAGE5).getStatus()).isEqualTo(StageStatus.PENDING);
        assertThat(report.getMove()).isNull();
        assertThat(stages.count("move")).isZero();
    }

    @Test
    void wholeStageFailureStopsPipelineAndIsRetriedNextRun() {
        stages.failPlan = true;

        assertThatThrownBy(() -> run(request().build()))
                .isInstanceOf(StageFailedException.class)
                .satisfies(e -> {
                    StageFailedException failure = (StageFailedException) e;
                    assertThat(failure.getStage()).isEqualTo(PipelineStageId.STAGE4);
                    PipelineReport report = failure.getReport();
                    assertThat(report.stage(PipelineStageId.STAGE3).getStatus()).isEqualTo(StageStatus.COMPUTED);
                    assertThat(report.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.FAILED);
                    assertThat(report.stage(PipelineStageId.STAGE4).getError()).contains("taxonomy model offline");
                    assertThat(report.stage(PipelineStageId.STAGE5).getStatus()).isEqualTo(StageStatus.PENDING);
                    assertThat(report.isSuccess()).isFalse();
                });

        stages.failPlan = false;
        PipelineReport retry = run(request().build());

        assertThat(retry.stage(PipelineStageId.STAGE3).getStatus()).isEqualTo(StageStatus.CACHED);
        assertThat(retry.stage(PipelineStageId.STAGE4).getStatus()).isEqualTo(StageStatus.COMPUTED);
        assertThat(stages.count("analyze")).isEqualTo(3);
        assertThat(stages.count("move")).isEqualTo(1);
    }

    @Test
    void failedItemsAreIsolatedAndRetried() throws IOException {
        Files.writeString(source.resolve("d.txt"), "d");
        Files.writeString(source.resolve("e.txt"), "e");
        stages.failingFiles.add("c.txt");

        PipelineReport report = run(request().build());

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getItemFailures()).hasSize(1);
        assertThat(report.getItemFailures().get(0).getFilePath()).isEqualTo(source.resolve("c.txt").toString());
        assertThat(report.stage(PipelineStageId.STAGE3).getItemFailures()).isEqualTo(1);
        assertThat(report.getAnalysis().getTotalAnalyzed()).isEqualTo(4);
        assertThat(stages.lastPlannedAnalyses).isEqualTo(4);
        assertThat(report.getTaxonomy().getFailures()).hasSize(1);

        stages.failingFiles.clear();
        stages.analyzed.clear();
        PipelineReport retry = run(request().build());

        assertThat(stages.analyzed).containsExactly(source.resolve("c.txt").toString());
        assertThat(retry.getItemFailures()).isEmpty();
        assertThat(stages.lastPlannedAnalyses).isEqualTo(5);
    }

    @Test
    void progressListenerSeesEveryItem() {
        List<ItemOutcome> outcomes = new ArrayList<>();

        orchestrator(CacheMode.readWrite(), outcomes::add).run(request().build());

        assertThat(outcomes).extracting(ItemOutcome::getStatus).containsOnly(ItemOutcome.Status.COMPUTED);
        assertThat(outcomes).extracting(ItemOutcome::getTotal).containsOnly(3);
    }

    @Test
    void cacheWriteFailureAbortsPipeline() throws IOException {
        Path occupied = Files.writeString(cacheDir.resolve("occupied"), "not a directory");

        assertThatThrownBy(() -> orchestrator(occupied, CacheMode.readWrite(), outcome -> { }).run(request().build()))
                .isInstanceOf(StageFailedException.class)
                .hasCauseInstanceOf(CacheWriteException.class)
                .satisfies(e -> {
                    PipelineReport report = ((StageFailedException) e).getReport();
                    assertThat(report.stage(PipelineStageId.STAGE1).getStatus()).isEqualTo(StageStatus.FAILED);
                    assertThat(report.stage(PipelineStageId.STAGE2).getStatus()).isEqualTo(StageStatus.PENDING);
                });
        assertThat(stages.count("scan")).isEqualTo(1);
        assertThat(stages.count("discover")).isZero();
    }

    @Test
    void cacheWriteIsSkippedWhenWritesDisabled() throws IOException {
        Path occupied = Files.writeString(cacheDir.resolve("occupied"), "not a directory");

        PipelineReport report = orchestrator(occupied, new CacheMode(true, false), outcome -> { })
                .run(request().build());

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getStages()).extracting(StageReport::getStatus).containsOnly(StageStatus.COMPUTED);
    }

    @Test
    void interruptedAnalysisResumesWhereItStopped() {
        stages.interruptAfterFirstAnalysis = true;

        assertThatThrownBy(() -> run(request().build()))
                .isInstanceOf(StageFailedException.class)
                .hasCauseInstanceOf(StageInterruptedException.class)
                .satisfies(e -> assertThat(((StageFailedException) e).getStage()).isEqualTo(PipelineStageId.STAGE3));
        assertThat(Thread.interrupted()).isTrue();
        assertThat(stages.analyzed).containsExactly(source.resolve("a.txt").toString());

        stages.analyzed.clear();
        PipelineReport resumed = run(request().build());

        assertThat(stages.analyzed).containsExactly(
                source.resolve("b.txt").toString(), source.resolve("c.txt").toString());
        assertThat(resumed.stage(PipelineStageId.STAGE3).getItemHits()).isEqualTo(1);
        assertThat(resumed.isSuccess()).isTrue();
    }

    @Test
    void missingSourceFailsFirstStage() {
        PipelineRequest request = PipelineRequest.builder().source(source.resolve("absent")).build();

        assertThatThrownBy(() -> run(request))
                .isInstanceOf(StageFailedException.class)
                .satisfies(e -> assertThat(((StageFailedException) e).getStage()).isEqualTo(PipelineStageId.STAGE1));
    }

    /**
     * 记录调用次数的阶段实现
     */
    static class FakeStages implements PipelineStages {

        private final Map<String, Integer> counts = new TreeMap<>();
        final List<String> analyzed = new ArrayList<>();
        final Set<String> failingFiles = new HashSet<>();
        final Map<PipelineStageId, Map<String, Object>> settings = new EnumMap<>(PipelineStageId.class);
        boolean failPlan;
        boolean interruptAfterFirstAnalysis;
        int lastPlannedAnalyses = -1;

        int count(String stage) {
            return counts.getOrDefault(stage, 0);
        }

        Map<String, Integer> snapshot() {
            return new TreeMap<>(counts);
        }

        private void called(String stage) {
            counts.merge(stage, 1, Integer::sum);
        }

        @Override
        public Map<String, Object> settings(PipelineStageId stage) {
            return new TreeMap<>(settings.getOrDefault(stage, Map.of()));
        }

        @Override
        public List<Path> enumerate(ScanRequest request) {
            try (Stream<Path> files = Files.list(request.getSource())) {
                return files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public ScanResult scan(ScanRequest request) {
            called("scan");
            List<FileInfo> files = new ArrayList<>();
            for (Path file : enumerate(request)) {
                try {
                    files.add(FileInfo.builder()
                            .fileName(file.getFileName().toString())
                            .filePath(file.toString())
                            .mimeType("text/plain")
                            .category(FileCategory.DOCUMENT)
                            .fileSize(Files.size(file))
                            .modifiedAt(Files.getLastModifiedTime(file).toMillis())
                            .build());
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return ScanResult.builder()
                    .sourceDirectory(request.getSource().toString())
                    .totalFiles(files.size())
                    .files(files)
                    .uniqueMimeTypes(new ArrayList<>(List.of("text/plain")))
                    .build();
        }

        @Override
        public List<ModelInfo> modelCatalog() {
            return List.of(ModelInfo.builder().name("local-text").provider("ollama").modelName("llama3")
                    .capabilities(new ArrayList<>(List.of("text"))).local(true).build());
        }

        @Override
        public DiscoveryResult discover(DiscoveryRequest request) {
            called("discover");
            return DiscoveryResult.builder()
                    .availableModels(new ArrayList<>(request.getCatalog()))
                    .mimeToModel(new TreeMap<>(Map.of("text/plain", "local-text")))
                    .connectivity(new TreeMap<>(Map.of("local-text", Boolean.TRUE)))
                    .build();
        }

        @Override
        public FileAnalysis analyze(FileInfo file, DiscoveryResult discovery) {
            called("analyze");
            analyzed.add(file.getFilePath());
            if (failingFiles.contains(file.getFileName())) {
                throw new IllegalStateException("analysis failed for " + file.getFileName());
            }
            if (interruptAfterFirstAnalysis) {
                interruptAfterFirstAnalysis = false;
                Thread.currentThread().interrupt();
            }
            return FileAnalysis.builder()
                    .filePath(file.getFilePath())
                    .fileName(file.getFileName())
                    .mimeType(file.getMimeType())
                    .assignedModel(discovery.resolveModel(file.getMimeType()).getName())
                    .proposedFilename("renamed-" + file.getFileName())
                    .description("about " + file.getFileName())
                    .tags(new ArrayList<>(List.of("docs")))
                    .build();
        }

        @Override
        public TaxonomyResult plan(AnalysisResult analysis) {
            called("plan");
            if (failPlan) {
                throw new IllegalStateException("taxonomy model offline");
            }
            lastPlannedAnalyses = analysis.getAnalyses().size();
            List<FileAssignment> assignments = new ArrayList<>();
            for (FileAnalysis item : analysis.getAnalyses()) {
                assignments.add(new FileAssignment(item.getFilePath(), "Docs", item.getProposedFilename(), "text"));
            }
            return TaxonomyResult.builder()
                    .sourceDirectory(analysis.getSourceDirectory())
                    .nodes(new ArrayList<>(List.of(TaxonomyNode.builder().path("Docs").category("Docs")
                            .fileCount(assignments.size()).build())))
                    .assignments(assignments)
                    .failures(new ArrayList<>(analysis.getFailures()))
                    .build();
        }

        @Override
        public MoveResult move(MoveRequest request) {
            called("move");
            List<MoveOperation> operations = new ArrayList<>();
            for (FileAssignment assignment : request.getTaxonomy().getAssignments()) {
                operations.add(MoveOperation.builder()
                        .sourcePath(assignment.getFilePath())
                        .targetPath(assignment.getTargetPath())
                        .targetFilename(assignment.getProposedFilename())
                        .category(MoveOperation.ORGANIZED)
                        .success(true)
                        .build());
            }
            return MoveResult.builder()
                    .destination(request.getDestination())
                    .dryRun(true)
                    .operations(operations)
                    .successfulMoves(operations.size())
                    .build();
        }
    }
}
