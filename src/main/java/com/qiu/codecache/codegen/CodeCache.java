package com.qiu.codecache.codegen;

import com.qiu.codecache.cache.Cache;
import com.qiu.codecache.cache.CacheBehavior;
import com.qiu.codecache.cache.CacheHandle;
import com.qiu.codecache.cache.CacheStats;
import com.qiu.codecache.cache.Deleter;
import com.qiu.codecache.cache.ShardedCache;
import com.qiu.codecache.core.CacheOptions;
import com.qiu.codecache.core.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 按内容寻址的编译产物缓存
 *
 * <p>键由产物自身的规范编码生成，容量按条目数计算。缓存只保存无类型的值，
 * 这里负责把它和产物的引用计数对接：插入时增加一份引用，由 deleter 在条目销毁时释放。
 */
public class CodeCache implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CodeCache.class);

    // 缓存只认识 Object，销毁条目时放弃插入时增加的那份引用
    private static final Deleter ARTIFACT_DELETER = (key, value) -> ((JitArtifact) value).release();

    private final Cache cache;

    public CodeCache(long capacity) {
        this(CacheOptions.builder().capacity(capacity).build());
    }

    public CodeCache(CacheOptions options) {
        this(new ShardedCache(options));
    }

    public CodeCache(Cache cache) {
        this.cache = Objects.requireNonNull(cache, "Cache cannot be null");
    }

    /**
     * 把产物放入缓存，同键的旧产物被替换
     *
     * @throws KeyEncodingException 产物无法生成键，此时不会插入，引用计数不变
     */
    public void addEntry(JitArtifact artifact) throws KeyEncodingException {
        Objects.requireNonNull(artifact, "Artifact cannot be null");
        Slice key = artifact.encodeOwnKey();

        artifact.addRef();
        CacheHandle inserted = cache.insert(key, artifact, 1, ARTIFACT_DELETER);
        // 调用方仍持有自己的引用，不需要继续持有句柄
        cache.release(inserted);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Cached {} under key {}", artifact, key.toHexString(32));
        }
    }

    /**
     * 查找产物，未命中返回 null
     *
     * <p>返回的产物已为调用方增加一份引用，使用完毕后必须调用 {@link JitArtifact#release()}。
     */
    public JitArtifact lookup(Slice key) {
        CacheHandle found = cache.lookup(key, CacheBehavior.EXPECT_IN_CACHE);
        if (found == null) {
            return null;
        }

        JitArtifact value;
        try {
            value = (JitArtifact) cache.value(found);
            value.addRef();
        } finally {
            cache.release(found);
        }
        return value;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    public int getEntryCount() {
        return cache.getEntryCount();
    }

    public long getCapacity() {
        return cache.getCapacity();
    }

    /**
     * 清空缓存，放弃缓存持有的所有产物引用
     */
    @Override
    public void close() {
        cache.clear();
        LOG.info("Closed code cache '{}': {}", cache.getName(), cache.getStats());
    }

    @Override
    public String toString() {
        return "CodeCache{" + cache + "}";
    }
}
