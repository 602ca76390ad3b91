package com.alibaba.cloud.ai.organizer.cli;

import com.alibaba.cloud.ai.organizer.cache.codec.CacheJson;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheException;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.FingerprintComputer;
import com.alibaba.cloud.ai.organizer.cache.policy.FingerprintInvalidationPolicy;
import com.alibaba.cloud.ai.organizer.cache.runner.StageRunner;
import com.alibaba.cloud.ai.organizer.cache.store.CacheStore;
import com.alibaba.cloud.ai.organizer.cache.store.FileSystemCacheStore;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineCodecs;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineOrchestrator;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineReport;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineRequest;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineStageId;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineStages;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.StageFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * 命令行入口
 * 退出码: 0 成功; 1 阶段失败、缓存写入失败或缓存目录不可访问; 2 参数或配置错误
 *
 * @author RobustH
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrganizerCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    /**
     * 收到终止信号后等待当前工作项结束的最长时间
     */
    private static final long SHUTDOWN_GRACE_MILLIS = 30_000;

    private final PipelineCommandLine commandLine;
    private final PipelineStages stages;
    private final ConsoleReporter reporter;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        CommandLineOptions options;
        try {
            options = commandLine.parse(args);
        } catch (PipelineConfigException e) {
            log.error("配置错误: {}", e.getMessage());
            reporter.error(e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }
        log.debug("命令行参数: {}", options);
        exitCode = execute(options);
    }

    private int execute(CommandLineOptions options) {
        CacheStore store = openStore(options);
        try {
            if (options.isCacheStats()) {
                reporter.printStats(store.stats());
                return EXIT_OK;
            }
            if (options.isClearOnly()) {
                clear(store, options);
                return EXIT_OK;
            }

            FingerprintComputer fingerprintComputer = new FingerprintComputer();
            StageRunner stageRunner = new StageRunner(store, new FingerprintInvalidationPolicy(),
                    fingerprintComputer, options.cacheMode());
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(stageRunner, stages, new PipelineCodecs(),
                    fingerprintComputer, reporter::printProgress);

            PipelineReport report = runInterruptibly(orchestrator, options.toRequest());
            reporter.printReport(report);
            return EXIT_OK;
        } catch (StageFailedException e) {
            log.error("流水线终止: {}", e.getMessage(), e.getCause());
            reporter.printReport(e.getReport());
            reporter.error(e.getMessage());
            return EXIT_FAILURE;
        } catch (CacheException e) {
            log.error("缓存操作失败: {}", e.getMessage(), e);
            reporter.error(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * 运行期间注册关闭钩子: Ctrl-C 时中断流水线线程, 让逐项阶段在两个工作项之间停下,
     * 已完成的工作项都已写入缓存
     */
    private PipelineReport runInterruptibly(PipelineOrchestrator orchestrator, PipelineRequest request) {
        Thread worker = Thread.currentThread();
        Thread hook = new Thread(() -> {
            log.warn("收到终止信号, 当前工作项完成后停止");
            worker.interrupt();
            try {
                worker.join(SHUTDOWN_GRACE_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "organizer-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return orchestrator.run(request);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM 正在关闭, 关闭钩子保留: {}", e.getMessage());
            }
        }
    }

    protected CacheStore openStore(CommandLineOptions options) {
        return new FileSystemCacheStore(options.getCacheDir(), CacheJson.deterministicMapper());
    }

    private void clear(CacheStore store, CommandLineOptions options) {
        if (options.isClearAll()) {
            reporter.printCleared("全部阶段", store.deleteAll());
            return;
        }
        for (PipelineStageId id : options.getClearStages()) {
            reporter.printCleared(id.id(), store.deleteStage(id.id()));
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
