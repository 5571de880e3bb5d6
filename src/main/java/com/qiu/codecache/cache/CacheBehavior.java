package com.qiu.codecache.cache;

/**
 * 查找时的预期，只用于区分统计
 */
public enum CacheBehavior {
    /**
     * 调用方预期条目在缓存中，命中/未命中计入 caching 计数
     */
    EXPECT_IN_CACHE,

    /**
     * 调用方只是探查，不预期一定命中
     */
    NO_EXPECT_IN_CACHE
}
