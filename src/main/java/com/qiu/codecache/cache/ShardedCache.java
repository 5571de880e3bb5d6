package com.qiu.codecache.cache;

import com.qiu.codecache.core.CacheOptions;
import com.qiu.codecache.core.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 分片缓存，将缓存分成多个独立加锁的分片以减少锁竞争
 *
 * <p>键按哈希选择分片，总容量在分片间平分。分片之间没有任何共享状态，
 * 不同分片上的操作可以完全并行。容量上限和 LRU 淘汰顺序都按分片各自维护，
 * 只有单分片时才是整个缓存范围内的严格 LRU。
 */
public class ShardedCache implements Cache {
    private static final Logger LOG = LoggerFactory.getLogger(ShardedCache.class);

    private final String name;
    private final int numShards;
    private final LRUCache[] shards;
    private final long capacity;
    private final AtomicLong lastId;

    public ShardedCache(long capacity) {
        this(capacity, CacheOptions.defaultShardsFor(capacity), "cache");
    }

    public ShardedCache(long capacity, int numShards) {
        this(capacity, numShards, "cache");
    }

    public ShardedCache(CacheOptions options) {
        this(options.getCapacity(), options.getNumShards(), options.getName());
    }

    public ShardedCache(long capacity, int numShards, String name) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (numShards <= 0) {
            throw new IllegalArgumentException("Number of shards must be positive");
        }

        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.capacity = capacity;
        // 分片数不超过容量，保证每个分片至少能容纳一个单位
        this.numShards = (int) Math.min(numShards, capacity);
        this.shards = new LRUCache[this.numShards];
        this.lastId = new AtomicLong(0);

        long baseShardCapacity = capacity / this.numShards;
        long remainder = capacity % this.numShards;

        for (int i = 0; i < this.numShards; i++) {
            // 前 remainder 个分片多分配1单位容量
            long shardCapacity = (i < remainder) ? baseShardCapacity + 1 : baseShardCapacity;
            shards[i] = new LRUCache(name, shardCapacity);
        }

        LOG.info("Created cache '{}': capacity={}, shards={}", name, capacity, this.numShards);
    }

    /**
     * 根据键的哈希值计算分片索引
     */
    int getShardIndex(Slice key) {
        return shardIndexOf(key.hashCode());
    }

    private int shardIndexOf(int hash) {
        hash = hash ^ (hash >>> 16);
        return (hash & 0x7FFFFFFF) % numShards; // 确保非负
    }

    @Override
    public CacheHandle insert(Slice key, Object value, long charge, Deleter deleter) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(deleter, "Deleter cannot be null");
        if (charge < 1) {
            throw new IllegalArgumentException("Charge must be at least 1");
        }

        // 缓存保存自己的键副本
        Slice ownKey = key.copy();
        int hash = ownKey.hashCode();
        CacheEntry entry = shards[shardIndexOf(hash)].insert(ownKey, hash, value, charge, deleter);
        return new CacheHandle(entry, this);
    }

    @Override
    public CacheHandle lookup(Slice key, CacheBehavior behavior) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(behavior, "Behavior cannot be null");

        CacheEntry entry = shards[getShardIndex(key)].lookup(key, behavior);
        return entry == null ? null : new CacheHandle(entry, this);
    }

    @Override
    public Object value(CacheHandle handle) {
        return checkOwned(handle).getValue();
    }

    @Override
    public void release(CacheHandle handle) {
        checkOwned(handle);
        if (!handle.markReleased()) {
            throw new IllegalStateException("CacheHandle is already released");
        }
        releaseEntry(handle.getEntryUnchecked());
    }

    /**
     * 释放已标记为 released 的句柄所持有的引用
     */
    void releaseEntry(CacheEntry entry) {
        shards[shardIndexOf(entry.getHash())].release(entry);
    }

    @Override
    public boolean erase(Slice key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return shards[getShardIndex(key)].erase(key);
    }

    @Override
    public long newId() {
        return lastId.incrementAndGet();
    }

    @Override
    public void prune() {
        for (LRUCache shard : shards) {
            shard.prune();
        }
    }

    @Override
    public void clear() {
        for (LRUCache shard : shards) {
            shard.clear();
        }
        LOG.info("Cleared cache '{}'", name);
    }

    @Override
    public long getUsage() {
        long totalUsage = 0;
        for (LRUCache shard : shards) {
            totalUsage += shard.getUsage();
        }
        return totalUsage;
    }

    @Override
    public long getCapacity() {
        return capacity;
    }

    @Override
    public int getEntryCount() {
        int totalCount = 0;
        for (LRUCache shard : shards) {
            totalCount += shard.getEntryCount();
        }
        return totalCount;
    }

    @Override
    public CacheStats getStats() {
        CacheStats totalStats = new CacheStats();
        for (LRUCache shard : shards) {
            totalStats.add(shard.getStats());
        }
        return totalStats;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * 获取分片数量
     */
    public int getShardCount() {
        return numShards;
    }

    /**
     * 获取指定分片的统计信息
     */
    public CacheStats getShardStats(int shardIndex) {
        return shardAt(shardIndex).getStats();
    }

    /**
     * 获取指定分片的容量
     */
    public long getShardCapacity(int shardIndex) {
        return shardAt(shardIndex).getCapacity();
    }

    /**
     * 获取分片负载信息（用于监控）
     */
    public double[] getShardLoadFactors() {
        double[] loadFactors = new double[numShards];
        for (int i = 0; i < numShards; i++) {
            loadFactors[i] = shards[i].getLoadFactor();
        }
        return loadFactors;
    }

    /**
     * 按从旧到新返回键所在分片中可淘汰条目的键
     */
    List<Slice> getLruKeys(Slice key) {
        return shards[getShardIndex(key)].getLruKeys();
    }

    private LRUCache shardAt(int shardIndex) {
        if (shardIndex < 0 || shardIndex >= numShards) {
            throw new IllegalArgumentException("Invalid shard index: " + shardIndex);
        }
        return shards[shardIndex];
    }

    private CacheHandle checkOwned(CacheHandle handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        if (handle.getCache() != this) {
            throw new IllegalArgumentException("Handle belongs to another cache");
        }
        return handle;
    }

    @Override
    public String toString() {
        CacheStats stats = getStats();
        return String.format("ShardedCache{name=%s, shards=%d, usage=%d, capacity=%d, entries=%d, hitRate=%.3f}",
                name, numShards, getUsage(), capacity, getEntryCount(), stats.getHitRate());
    }
}
