package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 第五阶段输入
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {

    private TaxonomyResult taxonomy;

    private String destination;

    private boolean dryRun;

    private boolean overwrite;
}
