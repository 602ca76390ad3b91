package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 第一阶段输入
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {

    private Path source;

    /**
     * 不参与扫描的目录 (缓存目录、位于源目录内的目标目录)
     */
    private List<Path> skipDirectories = new ArrayList<>();

    public ScanRequest(Path source) {
        this(source, new ArrayList<>());
    }
}
