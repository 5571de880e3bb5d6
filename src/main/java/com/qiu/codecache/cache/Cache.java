package com.qiu.codecache.cache;

import com.qiu.codecache.core.Slice;

/**
 * 带引用计数句柄的缓存接口
 *
 * <p>每个由 {@link #insert} 或 {@link #lookup} 返回的句柄都必须恰好释放一次。
 * 被句柄持有的条目不会因容量压力被淘汰；条目的 {@link Deleter} 只在条目不再驻留
 * 且最后一个句柄释放后执行一次。
 */
public interface Cache {
    /**
     * 插入 key->value 映射并按 charge 计入容量
     *
     * <p>同一个键已有驻留条目时先将其淘汰。返回的句柄持有新条目，不再需要时调用 {@link #release}。
     */
    CacheHandle insert(Slice key, Object value, long charge, Deleter deleter);

    /**
     * 查找缓存条目，未命中时返回 null
     *
     * @param behavior 只影响命中/未命中统计
     */
    CacheHandle lookup(Slice key, CacheBehavior behavior);

    /**
     * 返回句柄对应的值
     */
    Object value(CacheHandle handle);

    /**
     * 释放由 insert 或 lookup 返回的句柄
     */
    void release(CacheHandle handle);

    /**
     * 淘汰键对应的驻留条目，仍被句柄持有的条目在释放后才销毁
     *
     * @return 是否存在被淘汰的条目
     */
    boolean erase(Slice key);

    /**
     * 返回新的数字id，共享同一缓存的多个客户端可以用它来划分键空间
     */
    long newId();

    /**
     * 淘汰所有未被持有的条目
     */
    void prune();

    /**
     * 淘汰所有驻留条目
     */
    void clear();

    /**
     * 当前驻留条目的 charge 总和
     */
    long getUsage();

    long getCapacity();

    /**
     * 当前驻留条目数量
     */
    int getEntryCount();

    /**
     * 获取缓存统计快照
     */
    CacheStats getStats();

    String getName();
}
