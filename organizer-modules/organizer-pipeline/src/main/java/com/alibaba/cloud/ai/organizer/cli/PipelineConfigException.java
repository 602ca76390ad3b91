package com.alibaba.cloud.ai.organizer.cli;

/**
 * 启动参数或配置错误, 在任何阶段运行之前报告
 *
 * @author RobustH
 */
public class PipelineConfigException extends RuntimeException {

    public PipelineConfigException(String message) {
        super(message);
    }
}
