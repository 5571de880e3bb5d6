package com.qiu.codecache.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 代码缓存配置选项
 */
public class CacheOptions {
    public static final String RESOURCE_NAME = "codecache.properties";
    public static final String CAPACITY_KEY = "code_cache.capacity";
    public static final String SHARDS_KEY = "code_cache.shards";
    public static final String NAME_KEY = "code_cache.name";

    static final int MAX_DEFAULT_SHARDS = 16;
    // 未指定分片数时，每个分片至少分到这么多容量
    static final long MIN_SHARD_CAPACITY = 64;

    private final long capacity;
    private final int numShards;
    private final String name;

    private CacheOptions(Builder builder) {
        this.capacity = builder.capacity;
        this.numShards = builder.numShards > 0 ? builder.numShards : defaultShardsFor(builder.capacity);
        this.name = builder.name;
    }

    public long getCapacity() { return capacity; }
    public int getNumShards() { return numShards; }
    public String getName() { return name; }

    /**
     * Builder模式创建配置
     */
    public static class Builder {
        private long capacity = 100;     // 最多缓存100个编译产物
        private int numShards = 0;       // 0 表示按容量推导
        private String name = "code_cache";

        public Builder capacity(long capacity) {
            if (capacity <= 0) throw new IllegalArgumentException("Capacity must be positive");
            this.capacity = capacity;
            return this;
        }

        public Builder numShards(int shards) {
            if (shards <= 0) throw new IllegalArgumentException("Number of shards must be positive");
            this.numShards = shards;
            return this;
        }

        public Builder name(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Cache name cannot be empty");
            }
            this.name = name;
            return this;
        }

        public CacheOptions build() {
            return new CacheOptions(this);
        }
    }

    /**
     * 按容量推导默认分片数
     *
     * <p>容量小于 2 * MIN_SHARD_CAPACITY 时只用一个分片，整个缓存是一个精确的 LRU；
     * 更大的缓存按每片至少 MIN_SHARD_CAPACITY 拆分，最多 MAX_DEFAULT_SHARDS 片，
     * 此时淘汰顺序只在分片内是 LRU。
     */
    public static int defaultShardsFor(long capacity) {
        return (int) Math.max(1, Math.min(MAX_DEFAULT_SHARDS, capacity / MIN_SHARD_CAPACITY));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CacheOptions defaultOptions() {
        return new Builder().build();
    }

    /**
     * 从属性集合读取配置，缺失的项使用默认值
     */
    public static CacheOptions fromProperties(Properties props) {
        Builder builder = builder();
        String capacity = props.getProperty(CAPACITY_KEY);
        if (capacity != null) {
            builder.capacity(parseLong(CAPACITY_KEY, capacity));
        }
        String shards = props.getProperty(SHARDS_KEY);
        if (shards != null) {
            builder.numShards(parseInt(SHARDS_KEY, shards));
        }
        String name = props.getProperty(NAME_KEY);
        if (name != null) {
            builder.name(name.trim());
        }
        return builder.build();
    }

    /**
     * 从classpath上的 codecache.properties 读取配置，文件不存在时返回默认配置
     */
    public static CacheOptions load() {
        try (InputStream in = CacheOptions.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                return defaultOptions();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("CacheOptions{name=%s, capacity=%d, shards=%d}", name, capacity, numShards);
    }
}
