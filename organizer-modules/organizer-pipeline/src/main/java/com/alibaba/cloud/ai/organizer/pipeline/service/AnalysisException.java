package com.alibaba.cloud.ai.organizer.pipeline.service;

/**
 * 单个文件分析失败
 *
 * @author RobustH
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
