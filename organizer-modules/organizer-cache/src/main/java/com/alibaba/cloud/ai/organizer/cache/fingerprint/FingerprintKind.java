package com.alibaba.cloud.ai.organizer.cache.fingerprint;

/**
 * 指纹类型
 *
 * @author RobustH
 */
public enum FingerprintKind {

    /** 单个文件: 路径 + 大小 + 修改时间 */
    FILE,

    /** 目录快照: 排序后的文件指纹聚合 */
    DIRECTORY,

    /** 任意字节内容 (例如上一阶段的序列化结果) */
    CONTENT,

    /** 多个指纹的聚合 (逐项缓存阶段的整体快速路径) */
    AGGREGATE
}
