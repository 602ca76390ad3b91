package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 第一阶段结果: 文件清单
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    private String sourceDirectory;

    private int totalFiles;

    /**
     * 按路径排序
     */
    @Builder.Default
    private List<FileInfo> files = new ArrayList<>();

    @Builder.Default
    private List<ExcludedFile> excludedFiles = new ArrayList<>();

    @Builder.Default
    private List<FileError> errors = new ArrayList<>();

    /**
     * 去重并排序后的 MIME 类型
     */
    @Builder.Default
    private List<String> uniqueMimeTypes = new ArrayList<>();
}
