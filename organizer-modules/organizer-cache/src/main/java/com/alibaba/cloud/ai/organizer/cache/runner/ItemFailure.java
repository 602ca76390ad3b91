package com.alibaba.cloud.ai.organizer.cache.runner;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个工作项的失败记录
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemFailure {

    private String itemId;

    private String error;
}
