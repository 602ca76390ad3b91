package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 扫描时无法读取的文件
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileError {

    private String filePath;

    private String error;
}
