package com.alibaba.cloud.ai.organizer.pipeline.service;

import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;

/**
 * 分类规划接口 (第四阶段)
 *
 * @author RobustH
 */
public interface TaxonomyPlanner {

    /**
     * 为成功分析的文件规划分类树, 每个文件恰好分配到一个节点
     */
    TaxonomyResult plan(AnalysisResult analysis);
}
