package com.qiu.codecache.cache;

import com.qiu.codecache.core.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个缓存分片：哈希表 + LRU 链表 + in-use 链表
 *
 * <p>所有表和链表的修改都在分片锁内完成。引用计数降到 0 的条目在锁外执行 deleter。
 * LRU 链表头部 ({@code lru.next}) 是最久未使用的条目，尾部是最近使用的。
 */
final class LRUCache {
    private static final Logger LOG = LoggerFactory.getLogger(LRUCache.class);

    private final String name;
    private final long capacity;
    private long usage;

    private final Map<Slice, CacheEntry> table;
    // 哨兵：lru.next 最旧，lru.prev 最新
    private final CacheEntry lru;
    private final CacheEntry inUse;

    private final ReentrantLock lock;
    private final CacheStats stats;

    LRUCache(String name, long capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative");
        }
        this.name = name;
        this.capacity = capacity;
        this.usage = 0;
        this.table = new HashMap<>();
        this.lru = CacheEntry.listHead();
        this.inUse = CacheEntry.listHead();
        this.lock = new ReentrantLock();
        this.stats = new CacheStats();
    }

    /**
     * 插入新条目并返回它，新条目已为调用方的句柄计入一次引用
     */
    CacheEntry insert(Slice key, int hash, Object value, long charge, Deleter deleter) {
        CacheEntry entry = new CacheEntry(key, hash, value, charge, deleter);
        entry.refs = 2; // 缓存一份，返回的句柄一份
        entry.resident = true;

        List<CacheEntry> deleted = new ArrayList<>();
        lock.lock();
        try {
            entry.appendTo(inUse);
            usage += charge;

            CacheEntry old = table.put(key, entry);
            if (old != null) {
                finishErase(old, deleted);
                stats.recordDelete();
            }

            while (usage > capacity && lru.next != lru) {
                CacheEntry victim = lru.next;
                table.remove(victim.getKey(), victim);
                finishErase(victim, deleted);
                stats.recordEviction();
                if (LOG.isDebugEnabled()) {
                    LOG.debug("[{}] evicted {}", name, victim.getKey().toHexString(16));
                }
            }

            if (usage > capacity) {
                LOG.debug("[{}] shard over capacity, all resident entries pinned: usage={}, capacity={}",
                        name, usage, capacity);
            }
            stats.recordInsert();
        } finally {
            lock.unlock();
        }

        runDeleters(deleted);
        return entry;
    }

    /**
     * 查找驻留条目，命中时增加引用并移入 in-use 链表
     */
    CacheEntry lookup(Slice key, CacheBehavior behavior) {
        lock.lock();
        try {
            CacheEntry entry = table.get(key);
            if (entry == null) {
                stats.recordMiss(behavior);
                return null;
            }
            ref(entry);
            stats.recordHit(behavior);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 释放一份引用
     */
    void release(CacheEntry entry) {
        List<CacheEntry> deleted = new ArrayList<>(1);
        lock.lock();
        try {
            unref(entry, deleted);
        } finally {
            lock.unlock();
        }
        runDeleters(deleted);
    }

    boolean erase(Slice key) {
        List<CacheEntry> deleted = new ArrayList<>(1);
        boolean erased = false;
        lock.lock();
        try {
            CacheEntry entry = table.remove(key);
            if (entry != null) {
                finishErase(entry, deleted);
                stats.recordDelete();
                erased = true;
            }
        } finally {
            lock.unlock();
        }
        runDeleters(deleted);
        return erased;
    }

    /**
     * 淘汰所有未被持有的条目
     */
    void prune() {
        List<CacheEntry> deleted = new ArrayList<>();
        lock.lock();
        try {
            while (lru.next != lru) {
                CacheEntry victim = lru.next;
                table.remove(victim.getKey(), victim);
                finishErase(victim, deleted);
                stats.recordEviction();
            }
        } finally {
            lock.unlock();
        }
        runDeleters(deleted);
    }

    /**
     * 淘汰所有驻留条目，被持有的条目在最后一个句柄释放时销毁
     */
    void clear() {
        List<CacheEntry> deleted = new ArrayList<>();
        lock.lock();
        try {
            while (lru.next != lru) {
                CacheEntry victim = lru.next;
                table.remove(victim.getKey(), victim);
                finishErase(victim, deleted);
                stats.recordDelete();
            }
            while (inUse.next != inUse) {
                CacheEntry pinned = inUse.next;
                table.remove(pinned.getKey(), pinned);
                finishErase(pinned, deleted);
                stats.recordDelete();
            }
        } finally {
            lock.unlock();
        }
        runDeleters(deleted);
    }

    private void ref(CacheEntry entry) {
        if (entry.refs == 1 && entry.resident) {
            entry.unlink();
            entry.appendTo(inUse);
        }
        entry.refs++;
    }

    private void unref(CacheEntry entry, List<CacheEntry> deleted) {
        if (entry.refs <= 0) {
            throw new IllegalStateException("Reference count underflow: " + entry);
        }
        entry.refs--;
        if (entry.refs == 0) {
            // 驻留本身持有一份引用，计数归零说明条目已不在缓存中
            deleted.add(entry);
        } else if (entry.resident && entry.refs == 1) {
            entry.unlink();
            entry.appendTo(lru);
        }
    }

    /**
     * 条目已从哈希表移除，摘链、扣除容量并放弃缓存持有的引用
     */
    private void finishErase(CacheEntry entry, List<CacheEntry> deleted) {
        entry.unlink();
        entry.resident = false;
        usage -= entry.getCharge();
        unref(entry, deleted);
    }

    private void runDeleters(List<CacheEntry> deleted) {
        for (CacheEntry entry : deleted) {
            try {
                entry.getDeleter().delete(entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                LOG.error("[{}] deleter failed for entry {}", name, entry.getKey().toHexString(16), e);
            }
        }
    }

    long getUsage() {
        lock.lock();
        try {
            return usage;
        } finally {
            lock.unlock();
        }
    }

    long getCapacity() {
        return capacity;
    }

    int getEntryCount() {
        lock.lock();
        try {
            return table.size();
        } finally {
            lock.unlock();
        }
    }

    CacheStats getStats() {
        return new CacheStats(stats);
    }

    /**
     * 负载因子（当前使用量/容量）
     */
    double getLoadFactor() {
        lock.lock();
        try {
            return capacity > 0 ? (double) usage / capacity : 0.0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按从旧到新的顺序返回可淘汰条目的键（用于测试和监控）
     */
    List<Slice> getLruKeys() {
        lock.lock();
        try {
            List<Slice> keys = new ArrayList<>();
            for (CacheEntry e = lru.next; e != lru; e = e.next) {
                keys.add(e.getKey());
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }
}
