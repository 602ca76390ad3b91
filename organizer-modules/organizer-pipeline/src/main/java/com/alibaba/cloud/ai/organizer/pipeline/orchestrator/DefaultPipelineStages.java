package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.pipeline.config.OrganizerProperties;
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
import com.alibaba.cloud.ai.organizer.pipeline.service.FileAnalyzer;
import com.alibaba.cloud.ai.organizer.pipeline.service.FileMover;
import com.alibaba.cloud.ai.organizer.pipeline.service.ModelDiscoveryService;
import com.alibaba.cloud.ai.organizer.pipeline.service.ScanService;
import com.alibaba.cloud.ai.organizer.pipeline.service.TaxonomyPlanner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 由 Spring 管理的各阶段服务组成的默认实现
 *
 * @author RobustH
 */
@Component
@RequiredArgsConstructor
public class DefaultPipelineStages implements PipelineStages {

    private final ScanService scanService;
    private final ModelDiscoveryService modelDiscoveryService;
    private final FileAnalyzer fileAnalyzer;
    private final TaxonomyPlanner taxonomyPlanner;
    private final FileMover fileMover;
    private final OrganizerProperties properties;

    @Override
    public Map<String, Object> settings(PipelineStageId stage) {
        Map<String, Object> settings = new TreeMap<>();
        switch (stage) {
            case STAGE1:
                settings.put("scan", properties.getScan());
                break;
            case STAGE2:
                settings.put("verifyConnectivity", properties.getModels().isVerifyConnectivity());
                break;
            case STAGE3:
                settings.put("maxContentChars", properties.getAnalysis().getMaxContentChars());
                break;
            case STAGE4:
                settings.put("maxTaxonomyFiles", properties.getAnalysis().getMaxTaxonomyFiles());
                break;
            default:
                break;
        }
        return settings;
    }

    @Override
    public List<Path> enumerate(ScanRequest request) {
        return scanService.enumerate(request);
    }

    @Override
    public ScanResult scan(ScanRequest request) {
        return scanService.scan(request);
    }

    @Override
    public List<ModelInfo> modelCatalog() {
        return modelDiscoveryService.catalog();
    }

    @Override
    public DiscoveryResult discover(DiscoveryRequest request) {
        return modelDiscoveryService.discover(request);
    }

    @Override
    public FileAnalysis analyze(FileInfo file, DiscoveryResult discovery) {
        return fileAnalyzer.analyze(file, discovery);
    }

    @Override
    public TaxonomyResult plan(AnalysisResult analysis) {
        return taxonomyPlanner.plan(analysis);
    }

    @Override
    public MoveResult move(MoveRequest request) {
        return fileMover.move(request);
    }
}
