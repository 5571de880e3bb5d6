package com.qiu.codecache.codegen;

import com.qiu.codecache.core.CacheOptions;
import com.qiu.codecache.core.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 代码生成子系统的入口，拥有代码缓存
 *
 * <p>在子系统初始化时显式创建，按引用传给需要它的组件，关闭时释放缓存。
 * 同一个键的并发未命中不做合并：多个线程可能各自编译，后插入的产物替换先插入的。
 */
public class CompilationManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CompilationManager.class);

    private final CodeCache cache;
    private final AtomicLong compileCount;
    private final AtomicLong encodingFailures;

    public CompilationManager(CacheOptions options) {
        this(new CodeCache(options));
        LOG.info("Code generation initialized with {}", options);
    }

    public CompilationManager(CodeCache cache) {
        this.cache = Objects.requireNonNull(cache, "Code cache cannot be null");
        this.compileCount = new AtomicLong(0);
        this.encodingFailures = new AtomicLong(0);
    }

    /**
     * 获取行投影产物，缓存未命中时用 compiler 编译并放入缓存
     *
     * <p>返回的产物已为调用方持有一份引用，用完后调用 {@link JitArtifact#release()}。
     *
     * @throws KeyEncodingException schema 无法编码成键
     */
    public RowProjectorArtifact requestRowProjector(List<String> baseColumns, List<String> projectionColumns,
                                                    ArtifactCompiler<RowProjectorArtifact> compiler)
            throws KeyEncodingException {
        Slice key;
        try {
            key = RowProjectorArtifact.encodeKey(baseColumns, projectionColumns);
        } catch (KeyEncodingException e) {
            encodingFailures.incrementAndGet();
            throw e;
        }
        return getOrCompile(key, RowProjectorArtifact.class, compiler);
    }

    /**
     * 按键查找产物，未命中时编译并放入缓存
     */
    public <T extends JitArtifact> T getOrCompile(Slice key, Class<T> type, ArtifactCompiler<T> compiler)
            throws KeyEncodingException {
        Objects.requireNonNull(compiler, "Compiler cannot be null");

        JitArtifact cached = cache.lookup(key);
        if (cached != null) {
            if (type.isInstance(cached)) {
                return type.cast(cached);
            }
            cached.release();
            throw new IllegalStateException("Cached artifact " + cached + " is not a " + type.getSimpleName());
        }

        T compiled = Objects.requireNonNull(compiler.compile(), "Compiler returned null");
        compileCount.incrementAndGet();
        try {
            cache.addEntry(compiled);
        } catch (KeyEncodingException e) {
            encodingFailures.incrementAndGet();
            compiled.release();
            throw e;
        }
        return compiled;
    }

    public CodeCache getCodeCache() {
        return cache;
    }

    /**
     * 未命中缓存而实际编译的次数
     */
    public long getCompileCount() {
        return compileCount.get();
    }

    public long getEncodingFailureCount() {
        return encodingFailures.get();
    }

    @Override
    public void close() {
        LOG.info("Shutting down code generation: compiled={}, encodingFailures={}",
                compileCount.get(), encodingFailures.get());
        cache.close();
    }
}
