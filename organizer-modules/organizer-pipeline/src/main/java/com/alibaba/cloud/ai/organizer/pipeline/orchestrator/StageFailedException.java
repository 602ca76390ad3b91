package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import lombok.Getter;

/**
 * 整阶段失败, 流水线终止
 *
 * @author RobustH
 */
@Getter
public class StageFailedException extends RuntimeException {

    private final PipelineStageId stage;

    /**
     * 失败时的运行报告 (后续阶段保持 PENDING)
     */
    private final transient PipelineReport report;

    public StageFailedException(PipelineStageId stage, PipelineReport report, Throwable cause) {
        super("阶段 " + stage + " 失败: " + describe(cause), cause);
        this.stage = stage;
        this.report = report;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
