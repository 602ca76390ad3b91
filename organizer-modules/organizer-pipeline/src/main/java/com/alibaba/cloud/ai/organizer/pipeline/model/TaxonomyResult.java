package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 第四阶段结果: 分类树 + 文件分配
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxonomyResult {

    private String sourceDirectory;

    /**
     * 按路径排序
     */
    @Builder.Default
    private List<TaxonomyNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FileAssignment> assignments = new ArrayList<>();

    /**
     * 第三阶段的失败, 第五阶段把这些文件移到 _errors/
     */
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();
}
