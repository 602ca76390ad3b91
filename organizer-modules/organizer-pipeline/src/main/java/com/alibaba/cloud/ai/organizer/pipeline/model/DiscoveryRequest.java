package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 第二阶段输入: 扫描结果 + 配置的模型目录
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryRequest {

    private ScanResult scan;

    private List<ModelInfo> catalog;
}
