package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;

/**
 * 文件分析器接口 (第三阶段的逐项计算)
 *
 * @author RobustH
 */
public interface FileAnalyzer {

    /**
     * 分析单个文件
     *
     * @param file      文件
     * @param discovery 第二阶段的模型映射
     * @return 分析结果
     * @throws AnalysisException 没有可用模型、模型调用失败或回复无法解析
     */
    FileAnalysis analyze(FileInfo file, DiscoveryResult discovery);
}
