package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

/**
 * 阶段状态: PENDING -> RUNNING -> {CACHED | COMPUTED | FAILED}
 * CACHED 和 COMPUTED 都表示成功, 只在报告中区分
 *
 * @author RobustH
 */
public enum StageStatus {

    PENDING,

    RUNNING,

    CACHED,

    COMPUTED,

    FAILED;

    public boolean isTerminal() {
        return this == CACHED || this == COMPUTED || this == FAILED;
    }

    public boolean isSuccess() {
        return this == CACHED || this == COMPUTED;
    }
}
