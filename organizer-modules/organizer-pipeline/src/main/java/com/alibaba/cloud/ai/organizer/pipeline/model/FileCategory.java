package com.alibaba.cloud.ai.organizer.pipeline.model;

/**
 * 文件大类
 *
 * 用途:
 * 1. 作为分析提示词的上下文
 * 2. 决定是否把文本片段发送给模型
 *
 * @author RobustH
 */
public enum FileCategory {

    /** 图片 (JPEG, PNG 等) */
    IMAGE,

    VIDEO,

    AUDIO,

    /** 文档文件 (Markdown, Text, PDF 等) */
    DOCUMENT,

    /** 代码文件 (Java, Python, JavaScript 等) */
    CODE,

    /** 配置文件 (JSON, YAML, XML 等) */
    CONFIG,

    /** 压缩包 */
    ARCHIVE,

    OTHER;

    /**
     * 内容可以作为文本读取
     */
    public boolean isTextual() {
        return this == DOCUMENT || this == CODE || this == CONFIG;
    }
}
