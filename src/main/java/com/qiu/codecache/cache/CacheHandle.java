package com.qiu.codecache.cache;

import com.qiu.codecache.core.Slice;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 缓存句柄，代表对缓存条目的一份所有权
 *
 * <p>持有期间条目不会被销毁。{@link #close()} 等价于 {@code cache.release(handle)}，
 * 重复关闭没有效果；通过 {@link Cache#release} 重复释放会抛出 IllegalStateException。
 */
public final class CacheHandle implements AutoCloseable {
    private final CacheEntry entry;
    private final ShardedCache cache;
    private final AtomicBoolean released;

    CacheHandle(CacheEntry entry, ShardedCache cache) {
        this.entry = Objects.requireNonNull(entry, "Entry cannot be null");
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
        this.released = new AtomicBoolean(false);
    }

    CacheEntry getEntryUnchecked() {
        return entry;
    }

    ShardedCache getCache() {
        return cache;
    }

    public Slice getKey() {
        checkNotReleased();
        return entry.getKey();
    }

    public Object getValue() {
        checkNotReleased();
        return entry.getValue();
    }

    public long getCharge() {
        checkNotReleased();
        return entry.getCharge();
    }

    /**
     * 标记为已释放，只有第一次调用返回 true
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        // 先抢占释放标记，并发关闭时只有一个线程真正释放
        if (markReleased()) {
            cache.releaseEntry(entry);
        }
    }

    private void checkNotReleased() {
        if (released.get()) {
            throw new IllegalStateException("CacheHandle is released");
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
