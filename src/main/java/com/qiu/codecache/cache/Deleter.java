package com.qiu.codecache.cache;

import com.qiu.codecache.core.Slice;

/**
 * 条目销毁回调，每个条目恰好调用一次
 */
@FunctionalInterface
public interface Deleter {
    void delete(Slice key, Object value);
}
