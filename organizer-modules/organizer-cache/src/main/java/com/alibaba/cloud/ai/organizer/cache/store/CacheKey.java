package com.alibaba.cloud.ai.organizer.cache.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * 缓存键: (阶段ID, 作用域, 身份)
 * 文件名由身份的单向哈希派生, 保证文件系统安全; 只要求在同一阶段内唯一
 *
 * @author RobustH
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheKey {

    public static final String SEPARATOR = "__";
    public static final String FILE_SUFFIX = ".json";

    private static final Pattern STAGE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*");

    private String stageId;

    private CacheScope scope;

    /**
     * 语义身份 (全局作用域为源目录, 逐项作用域为文件路径)
     */
    private String identity;

    public static CacheKey global(String stageId, String identity) {
        return of(stageId, CacheScope.GLOBAL, identity);
    }

    public static CacheKey item(String stageId, String identity) {
        return of(stageId, CacheScope.ITEM, identity);
    }

    public static CacheKey of(String stageId, CacheScope scope, String identity) {
        if (stageId == null || !STAGE_ID.matcher(stageId).matches() || stageId.contains(SEPARATOR)) {
            throw new IllegalArgumentException("非法的阶段ID: " + stageId);
        }
        if (scope == null || identity == null) {
            throw new IllegalArgumentException("作用域和身份不能为空");
        }
        return new CacheKey(stageId, scope, identity);
    }

    /**
     * 磁盘文件名: stage1__global__<md5>.json
     */
    public String fileName() {
        String hash = DigestUtils.md5DigestAsHex(identity.getBytes(StandardCharsets.UTF_8));
        return stagePrefix(stageId) + scope.fileToken() + SEPARATOR + hash + FILE_SUFFIX;
    }

    /**
     * 某阶段所有缓存文件的公共前缀
     */
    public static String stagePrefix(String stageId) {
        return stageId + SEPARATOR;
    }

    @Override
    public String toString() {
        return stageId + "/" + scope.fileToken() + "/" + identity;
    }
}
