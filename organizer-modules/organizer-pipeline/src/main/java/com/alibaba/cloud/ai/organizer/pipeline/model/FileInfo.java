package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 扫描得到的单个文件
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileInfo {

    private String fileName;

    /**
     * 文件绝对路径 (同时作为第三阶段的工作项ID)
     */
    private String filePath;

    private String mimeType;

    private FileCategory category;

    private long fileSize;

    /**
     * 最后修改时间 (毫秒)
     */
    private long modifiedAt;
}
