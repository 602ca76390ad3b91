package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次文件移动
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveOperation {

    public static final String ORGANIZED = "organized";
    public static final String ERROR = "error";

    private String sourcePath;

    /**
     * 目标目录 (相对于目标根目录)
     */
    private String targetPath;

    private String targetFilename;

    private String fullTarget;

    /**
     * organized 或 error
     */
    private String category;

    private boolean success;

    private String error;
}
