package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 第五阶段结果
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveResult {

    private String destination;

    private boolean dryRun;

    @Builder.Default
    private List<MoveOperation> operations = new ArrayList<>();

    private int successfulMoves;

    private int failedMoves;

    /**
     * 移到 _errors/ 的文件数
     */
    private int errorMoves;
}
