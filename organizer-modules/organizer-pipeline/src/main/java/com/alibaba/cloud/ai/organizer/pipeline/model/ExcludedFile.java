package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 被过滤规则排除的文件
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExcludedFile {

    private String filePath;

    private String fileName;

    /**
     * 排除原因 (给人看)
     */
    private String reason;

    /**
     * 触发的规则: hidden_file, gitignore, exclude:<glob>, include, size_limit
     */
    private String rule;
}
