package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个文件的 AI 分析结果 (第三阶段的逐项结果)
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileAnalysis {

    private String filePath;

    private String fileName;

    private String mimeType;

    private String assignedModel;

    /**
     * 建议的新文件名 (保留原扩展名)
     */
    private String proposedFilename;

    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
