package com.qiu.codecache.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存统计信息
 *
 * <p>hits/misses 统计所有查找；hitsCaching/missesCaching 只统计以
 * {@link CacheBehavior#EXPECT_IN_CACHE} 发起的查找。
 */
public class CacheStats {
    private final AtomicLong hitCount;
    private final AtomicLong missCount;
    private final AtomicLong hitCachingCount;
    private final AtomicLong missCachingCount;
    private final AtomicLong insertCount;
    private final AtomicLong deleteCount;
    private final AtomicLong evictionCount;

    public CacheStats() {
        this.hitCount = new AtomicLong(0);
        this.missCount = new AtomicLong(0);
        this.hitCachingCount = new AtomicLong(0);
        this.missCachingCount = new AtomicLong(0);
        this.insertCount = new AtomicLong(0);
        this.deleteCount = new AtomicLong(0);
        this.evictionCount = new AtomicLong(0);
    }

    public CacheStats(CacheStats other) {
        this();
        add(other);
    }

    public void recordHit(CacheBehavior behavior) {
        hitCount.incrementAndGet();
        if (behavior == CacheBehavior.EXPECT_IN_CACHE) {
            hitCachingCount.incrementAndGet();
        }
    }

    public void recordMiss(CacheBehavior behavior) {
        missCount.incrementAndGet();
        if (behavior == CacheBehavior.EXPECT_IN_CACHE) {
            missCachingCount.incrementAndGet();
        }
    }

    public void recordInsert() {
        insertCount.incrementAndGet();
    }

    /**
     * 显式删除或同键覆盖
     */
    public void recordDelete() {
        deleteCount.incrementAndGet();
    }

    /**
     * 容量压力导致的淘汰
     */
    public void recordEviction() {
        evictionCount.incrementAndGet();
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public long getHitCachingCount() {
        return hitCachingCount.get();
    }

    public long getMissCachingCount() {
        return missCachingCount.get();
    }

    public long getInsertCount() {
        return insertCount.get();
    }

    public long getDeleteCount() {
        return deleteCount.get();
    }

    public long getEvictionCount() {
        return evictionCount.get();
    }

    public long getLookupCount() {
        return hitCount.get() + missCount.get();
    }

    public double getHitRate() {
        long lookups = getLookupCount();
        return lookups > 0 ? (double) hitCount.get() / lookups : 0.0;
    }

    public double getMissRate() {
        long lookups = getLookupCount();
        return lookups > 0 ? (double) missCount.get() / lookups : 0.0;
    }

    public void reset() {
        hitCount.set(0);
        missCount.set(0);
        hitCachingCount.set(0);
        missCachingCount.set(0);
        insertCount.set(0);
        deleteCount.set(0);
        evictionCount.set(0);
    }

    /**
     * 将另一个统计对象累加到当前对象
     */
    public void add(CacheStats other) {
        hitCount.addAndGet(other.hitCount.get());
        missCount.addAndGet(other.missCount.get());
        hitCachingCount.addAndGet(other.hitCachingCount.get());
        missCachingCount.addAndGet(other.missCachingCount.get());
        insertCount.addAndGet(other.insertCount.get());
        deleteCount.addAndGet(other.deleteCount.get());
        evictionCount.addAndGet(other.evictionCount.get());
    }

    /**
     * 合并两个统计对象
     */
    public CacheStats merge(CacheStats other) {
        CacheStats merged = new CacheStats(this);
        merged.add(other);
        return merged;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{hits=%d, misses=%d, hitRate=%.3f, hitsCaching=%d, missesCaching=%d, "
                        + "inserts=%d, deletes=%d, evictions=%d}",
                hitCount.get(), missCount.get(), getHitRate(), hitCachingCount.get(), missCachingCount.get(),
                insertCount.get(), deleteCount.get(), evictionCount.get());
    }
}
