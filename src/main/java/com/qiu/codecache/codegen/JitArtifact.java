package com.qiu.codecache.codegen;

import com.qiu.codecache.core.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JIT 编译产物的基类
 *
 * <p>产物构造后不可变，可在线程间共享。引用计数的修改是原子的，不依赖任何缓存锁；
 * 创建者持有初始的一份引用，计数归零时关闭 {@link CodeOwner} 并销毁。
 */
public abstract class JitArtifact {
    private static final Logger LOG = LoggerFactory.getLogger(JitArtifact.class);

    private final ArtifactType type;
    private final CodeOwner owner;
    private final AtomicInteger refCount;

    protected JitArtifact(ArtifactType type, CodeOwner owner) {
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.owner = Objects.requireNonNull(owner, "Code owner cannot be null");
        this.refCount = new AtomicInteger(1);
    }

    public ArtifactType getType() {
        return type;
    }

    /**
     * 将自身的规范键写入 out
     *
     * <p>同样含义的请求必须写出相同的字节，失败时 out 的内容无意义。
     */
    public abstract void encodeOwnKey(ByteArrayOutputStream out) throws KeyEncodingException;

    public Slice encodeOwnKey() throws KeyEncodingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encodeOwnKey(out);
        return Slice.wrap(out.toByteArray());
    }

    /**
     * 增加一份引用
     */
    public void addRef() {
        int prev;
        do {
            prev = refCount.get();
            if (prev <= 0) {
                throw new IllegalStateException("Artifact already destroyed: " + this);
            }
        } while (!refCount.compareAndSet(prev, prev + 1));
    }

    /**
     * 释放一份引用，最后一份释放时销毁产物
     */
    public void release() {
        int remaining = refCount.decrementAndGet();
        if (remaining == 0) {
            destroy();
        } else if (remaining < 0) {
            throw new IllegalStateException("Artifact released more times than referenced: " + this);
        }
    }

    public int getRefCount() {
        return Math.max(refCount.get(), 0);
    }

    public boolean isDestroyed() {
        return refCount.get() <= 0;
    }

    private void destroy() {
        LOG.debug("Destroying {}", this);
        owner.close();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + type + ", refs=" + refCount.get() + "}";
    }
}
