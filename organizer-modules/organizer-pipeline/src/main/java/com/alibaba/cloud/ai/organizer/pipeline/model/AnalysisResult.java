package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 第三阶段结果: 成功的分析 + 失败列表
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private String sourceDirectory;

    /**
     * 按路径排序
     */
    @Builder.Default
    private List<FileAnalysis> analyses = new ArrayList<>();

    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();

    private int totalAnalyzed;

    private int totalErrors;
}
