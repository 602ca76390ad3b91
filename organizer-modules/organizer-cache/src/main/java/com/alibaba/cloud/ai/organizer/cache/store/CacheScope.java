package com.alibaba.cloud.ai.organizer.cache.store;

/**
 * 缓存键作用域
 *
 * @author RobustH
 */
public enum CacheScope {

    /** 整个阶段的结果 */
    GLOBAL,

    /** 阶段内单个工作项的结果 */
    ITEM;

    public String fileToken() {
        return name().toLowerCase();
    }

    public static CacheScope fromFileToken(String token) {
        for (CacheScope scope : values()) {
            if (scope.fileToken().equals(token)) {
                return scope;
            }
        }
        return null;
    }
}
