package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.pipeline.model.AnalysisResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.ModelInfo;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanRequest;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 五个阶段的计算函数
 * 实现不感知缓存; 抛出任意 RuntimeException 表示失败
 *
 * @author RobustH
 */
public interface PipelineStages {

    /**
     * 影响某个阶段计算结果的配置项, 会并入该阶段的指纹; 没有时返回空 Map
     */
    Map<String, Object> settings(PipelineStageId stage);

    /**
     * 第一阶段的主体: 参与扫描的文件列表
     */
    List<Path> enumerate(ScanRequest request);

    ScanResult scan(ScanRequest request);

    /**
     * 当前配置的模型目录 (第二阶段指纹的一部分)
     */
    List<ModelInfo> modelCatalog();

    DiscoveryResult discover(DiscoveryRequest request);

    /**
     * 第三阶段的逐项计算
     */
    FileAnalysis analyze(FileInfo file, DiscoveryResult discovery);

    TaxonomyResult plan(AnalysisResult analysis);

    MoveResult move(MoveRequest request);
}
