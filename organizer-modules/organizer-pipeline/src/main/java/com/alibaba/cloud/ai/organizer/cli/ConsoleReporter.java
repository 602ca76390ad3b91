package com.alibaba.cloud.ai.organizer.cli;

import com.alibaba.cloud.ai.organizer.cache.runner.CacheOutcome;
import com.alibaba.cloud.ai.organizer.cache.runner.ItemOutcome;
import com.alibaba.cloud.ai.organizer.cache.store.CacheStats;
import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisFailure;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.PipelineReport;
import com.alibaba.cloud.ai.organizer.pipeline.orchestrator.StageReport;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Map;

/**
 * 控制台输出: 运行摘要、缓存统计、逐项进度
 *
 * @author RobustH
 */
@Component
public class ConsoleReporter {

    private static final String ROW_FORMAT = "%-18s %-9s %-6s %-24s %10s%n";

    private final PrintStream out;

    public ConsoleReporter() {
        this(System.out);
    }

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void printProgress(ItemOutcome outcome) {
        out.printf("  [%d/%d] %-8s %s%s%n", outcome.getIndex(), outcome.getTotal(), outcome.getStatus(),
                outcome.getItemId(), outcome.getError() == null ? "" : " (" + outcome.getError() + ")");
    }

    public void printReport(PipelineReport report) {
        out.println();
        out.printf(ROW_FORMAT, "阶段", "状态", "缓存", "逐项 命中/未命中/失败", "耗时");
        for (StageReport stage : report.getStages()) {
            String items = stage.isGranular()
                    ? stage.getItemHits() + "/" + stage.getItemMisses() + "/" + stage.getItemFailures()
                    : "-";
            String elapsed = stage.getStatus().isTerminal() ? stage.getElapsedMillis() + " ms" : "-";
            out.printf(ROW_FORMAT, stage.getStage(), stage.getStatus(), outcome(stage.getOutcome()), items, elapsed);
        }

        if (!report.getItemFailures().isEmpty()) {
            out.println();
            out.println("分析失败的文件 (" + report.getItemFailures().size() + "):");
            for (AnalysisFailure failure : report.getItemFailures()) {
                out.println("  " + failure.getFilePath() + ": " + failure.getError());
            }
        }
    }

    public void printStats(CacheStats stats) {
        out.println("缓存目录: " + stats.getDirectory());
        if (stats.getStages().isEmpty()) {
            out.println("  (空)");
        }
        for (Map.Entry<String, CacheStats.StageStats> entry : stats.getStages().entrySet()) {
            CacheStats.StageStats stage = entry.getValue();
            out.printf("  %-8s 条目=%d (逐项=%d) 字节=%d%n",
                    entry.getKey(), stage.getEntries(), stage.getItemEntries(), stage.getBytes());
        }
        out.printf("合计: 条目=%d, 大小=%d 字节 (%.2f MB)%n",
                stats.getTotalEntries(), stats.getTotalBytes(), stats.totalMegabytes());
    }

    public void printCleared(String scope, int removed) {
        out.println("已清理 " + scope + " 的缓存: " + removed + " 个条目");
    }

    public void error(String message) {
        out.println("错误: " + message);
    }

    private static String outcome(CacheOutcome outcome) {
        if (outcome == null) {
            return "-";
        }
        switch (outcome) {
            case HIT:
                return "hit";
            case MISS:
                return "miss";
            default:
                return "off";
        }
    }
}
