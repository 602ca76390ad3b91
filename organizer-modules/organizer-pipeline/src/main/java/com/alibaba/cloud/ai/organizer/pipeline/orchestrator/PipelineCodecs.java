package com.alibaba.cloud.ai.organizer.pipeline.orchestrator;

import com.alibaba.cloud.ai.organizer.cache.codec.CacheJson;
import com.alibaba.cloud.ai.organizer.cache.codec.JacksonStageCodec;
import com.alibaba.cloud.ai.organizer.cache.codec.StageCodec;
import com.alibaba.cloud.ai.organizer.cache.exception.CacheException;
import com.alibaba.cloud.ai.organizer.pipeline.model.DiscoveryResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.FileAnalysis;
import com.alibaba.cloud.ai.organizer.pipeline.model.MoveResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.ScanResult;
import com.alibaba.cloud.ai.organizer.pipeline.model.TaxonomyResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.util.List;

/**
 * 各阶段结果的编解码器
 * 修改某个结果类型的结构时递增对应版本号, 旧缓存在解码时被识别为不兼容并重新计算
 *
 * @author RobustH
 */
@Getter
public class PipelineCodecs {

    private final ObjectMapper objectMapper;
    private final StageCodec<ScanResult> scan;
    private final StageCodec<DiscoveryResult> discovery;
    private final StageCodec<FileAnalysis> fileAnalysis;
    private final StageCodec<List<FileAnalysis>> fileAnalysisList;
    private final StageCodec<TaxonomyResult> taxonomy;
    private final StageCodec<MoveResult> move;

    public PipelineCodecs() {
        this(CacheJson.deterministicMapper());
    }

    public PipelineCodecs(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.scan = JacksonStageCodec.of(objectMapper, "scan-result", 1, ScanResult.class);
        this.discovery = JacksonStageCodec.of(objectMapper, "discovery-result", 1, DiscoveryResult.class);
        this.fileAnalysis = JacksonStageCodec.of(objectMapper, "file-analysis", 1, FileAnalysis.class);
        this.fileAnalysisList = JacksonStageCodec.listOf(objectMapper, "file-analysis-list", 1, FileAnalysis.class);
        this.taxonomy = JacksonStageCodec.of(objectMapper, "taxonomy-result", 1, TaxonomyResult.class);
        this.move = JacksonStageCodec.of(objectMapper, "move-result", 1, MoveResult.class);
    }

    /**
     * 规范化字节, 用作内容指纹的输入
     */
    public byte[] canonicalBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CacheException("序列化阶段输入失败: " + value.getClass().getSimpleName(), e);
        }
    }
}
