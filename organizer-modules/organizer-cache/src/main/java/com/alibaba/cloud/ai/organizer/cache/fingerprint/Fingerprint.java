package com.alibaba.cloud.ai.organizer.cache.fingerprint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存主体的身份指纹
 * 两个指纹相等当且仅当所有字段相等 (路径、大小、修改时间、摘要)
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Fingerprint {

    private FingerprintKind kind;

    /**
     * 主体路径 (文件或目录的绝对路径; CONTENT 类型为空)
     */
    private String path;

    /**
     * 文件大小, 目录为所有文件大小之和, 内容为字节数
     */
    private long size;

    /**
     * 最后修改时间 (毫秒), 目录为最新的文件修改时间
     */
    private long modifiedAt;

    /**
     * 摘要 (MD5). FILE 类型为空
     */
    private String digest;

    /**
     * 用于聚合摘要的规范化行
     */
    public String canonicalLine() {
        return kind + "|" + (path == null ? "" : path) + "|" + size + "|" + modifiedAt + "|" + (digest == null ? "" : digest);
    }
}
