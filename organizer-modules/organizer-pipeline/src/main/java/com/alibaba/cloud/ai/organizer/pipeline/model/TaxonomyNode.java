package com.alibaba.cloud.ai.organizer.pipeline.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 分类树中的一个目录
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaxonomyNode {

    /**
     * 完整路径, 例如 Photos/Nature/Wildlife
     */
    private String path;

    /**
     * 最后一段, 例如 Wildlife
     */
    private String category;

    private String description;

    /**
     * 直接分配到这里的文件数
     */
    private int fileCount;

    @Builder.Default
    private List<String> subcategories = new ArrayList<>();
}
