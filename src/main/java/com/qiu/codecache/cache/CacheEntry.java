package com.qiu.codecache.cache;

import com.qiu.codecache.core.Slice;

import java.util.Objects;

/**
 * 缓存条目
 *
 * <p>除构造时确定的字段外，引用计数、驻留标记和链表指针都只在所属分片的锁内修改。
 * 驻留期间条目恰好位于分片的两个链表之一：refs == 1 时在 LRU 链表（只有缓存自身持有，可淘汰），
 * refs &gt; 1 时在 in-use 链表（被句柄持有，不可淘汰）。
 */
final class CacheEntry {
    private final Slice key;
    private final int hash;
    private final Object value;
    private final long charge;
    private final Deleter deleter;

    int refs;
    boolean resident;

    CacheEntry prev;
    CacheEntry next;

    CacheEntry(Slice key, int hash, Object value, long charge, Deleter deleter) {
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        this.hash = hash;
        this.value = value;
        this.charge = charge;
        this.deleter = Objects.requireNonNull(deleter, "Deleter cannot be null");
    }

    /**
     * 创建链表头哨兵
     */
    static CacheEntry listHead() {
        CacheEntry head = new CacheEntry(Slice.wrap(new byte[0]), 0, null, 0, (k, v) -> { });
        head.prev = head;
        head.next = head;
        return head;
    }

    Slice getKey() {
        return key;
    }

    int getHash() {
        return hash;
    }

    Object getValue() {
        return value;
    }

    long getCharge() {
        return charge;
    }

    Deleter getDeleter() {
        return deleter;
    }

    /**
     * 从所在链表摘除
     */
    void unlink() {
        next.prev = prev;
        prev.next = next;
        next = null;
        prev = null;
    }

    /**
     * 追加到链表尾部（最近使用端），head 为哨兵
     */
    void appendTo(CacheEntry head) {
        next = head;
        prev = head.prev;
        prev.next = this;
        head.prev = this;
    }

    @Override
    public String toString() {
        return String.format("CacheEntry{key=%s, charge=%d, refs=%d, resident=%b}",
                key.toHexString(16), charge, refs, resident);
    }
}
