package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分析失败的文件: (路径, 错误)
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisFailure {

    private String filePath;

    private String error;
}
