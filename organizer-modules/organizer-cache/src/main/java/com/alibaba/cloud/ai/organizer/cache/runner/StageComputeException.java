package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.Getter;

/**
 * 阶段或工作项计算失败
 * 整阶段作用域下为致命错误; 逐项作用域下被记录, 其余工作项继续处理
 *
 * @author RobustH
 */
@Getter
public class StageComputeException extends RuntimeException {

    private final String stageId;

    public StageComputeException(String stageId, String message) {
        super(message);
        this.stageId = stageId;
    }

    public StageComputeException(String stageId, String message, Throwable cause) {
        super(message, cause);
        this.stageId = stageId;
    }
}
