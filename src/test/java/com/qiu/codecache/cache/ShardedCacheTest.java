package com.qiu.codecache.cache;

import com.qiu.codecache.core.CacheOptions;
import com.qiu.codecache.core.Slice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ShardedCacheTest {

    private ShardedCache cache;
    private Deleter deleter;

    @BeforeEach
    void setUp() {
        cache = new ShardedCache(2, 1, "test"); // 单分片，便于验证淘汰顺序
        deleter = mock(Deleter.class);
    }

    private static Slice key(String s) {
        return Slice.wrap(s.getBytes(StandardCharsets.UTF_8));
    }

    private void insertAndRelease(String k, Object value) {
        cache.release(cache.insert(key(k), value, 1, deleter));
    }

    @Test
    void testConstructor() {
        ShardedCache sharded = new ShardedCache(1024, 4);
        assertEquals(1024, sharded.getCapacity());
        assertEquals(4, sharded.getShardCount());
        assertEquals("cache", sharded.getName());

        assertThrows(IllegalArgumentException.class, () -> new ShardedCache(0));
        assertThrows(IllegalArgumentException.class, () -> new ShardedCache(1024, 0));
    }

    @Test
    void testShardCapacityDistribution() {
        ShardedCache sharded = new ShardedCache(10, 4);
        assertEquals(3, sharded.getShardCapacity(0));
        assertEquals(3, sharded.getShardCapacity(1));
        assertEquals(2, sharded.getShardCapacity(2));
        assertEquals(2, sharded.getShardCapacity(3));

        // 分片数不超过容量
        ShardedCache small = new ShardedCache(3, 16);
        assertEquals(3, small.getShardCount());
        for (int i = 0; i < small.getShardCount(); i++) {
            assertEquals(1, small.getShardCapacity(i));
        }
    }

    @Test
    void testConstructFromOptions() {
        CacheOptions options = CacheOptions.builder().capacity(32).numShards(8).name("opts").build();
        ShardedCache fromOptions = new ShardedCache(options);
        assertEquals(32, fromOptions.getCapacity());
        assertEquals(8, fromOptions.getShardCount());
        assertEquals("opts", fromOptions.getName());
    }

    @Test
    @DisplayName("默认分片数按容量推导，小容量为单分片")
    void testDefaultShardCountFollowsCapacity() {
        ShardedCache small = new ShardedCache(100);
        assertEquals(1, small.getShardCount());
        assertEquals(100, small.getShardCapacity(0));

        // 单分片时容量 C 插入 C+1 个键，恰好淘汰最久未使用的一个
        for (int i = 0; i <= 100; i++) {
            small.release(small.insert(key("k" + i), i, 1, deleter));
        }
        assertEquals(100, small.getEntryCount());
        assertNull(small.lookup(key("k0"), CacheBehavior.NO_EXPECT_IN_CACHE));
        verify(deleter, times(1)).delete(eq(key("k0")), eq(0));

        assertEquals(16, new ShardedCache(4096).getShardCount());
    }

    @Test
    void testInsertAndLookup() {
        Object value = new Object();
        CacheHandle inserted = cache.insert(key("k1"), value, 1, deleter);
        assertSame(value, cache.value(inserted));
        cache.release(inserted);

        CacheHandle found = cache.lookup(key("k1"), CacheBehavior.EXPECT_IN_CACHE);
        assertNotNull(found);
        assertSame(value, cache.value(found));
        assertEquals(key("k1"), found.getKey());
        cache.release(found);

        verify(deleter, never()).delete(any(), any());
        assertEquals(1, cache.getEntryCount());
        assertEquals(1, cache.getUsage());
    }

    @Test
    void testLookupMissReturnsNull() {
        assertNull(cache.lookup(key("absent"), CacheBehavior.EXPECT_IN_CACHE));
        assertNull(cache.lookup(key("absent"), CacheBehavior.NO_EXPECT_IN_CACHE));

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.getMissCount());
        assertEquals(1, stats.getMissCachingCount());
    }

    @Test
    void testInsertCopiesKey() {
        byte[] raw = "mutable".getBytes(StandardCharsets.UTF_8);
        insertAndRelease(new String(raw, StandardCharsets.UTF_8), "v");
        Slice wrapped = Slice.wrap(raw);
        cache.release(cache.insert(wrapped, "v2", 1, deleter));

        raw[0] = 'X';
        try (CacheHandle handle = cache.lookup(key("mutable"), CacheBehavior.EXPECT_IN_CACHE)) {
            assertNotNull(handle);
            assertEquals("v2", handle.getValue());
        }
    }

    @Test
    @DisplayName("超出容量时淘汰最久未使用的条目")
    void testEvictsLeastRecentlyUsed() {
        insertAndRelease("f1", "A1");
        insertAndRelease("f2", "A2");
        insertAndRelease("f3", "A3");

        assertNull(cache.lookup(key("f1"), CacheBehavior.EXPECT_IN_CACHE));
        verify(deleter, times(1)).delete(eq(key("f1")), eq("A1"));
        assertEquals(2, cache.getEntryCount());
        assertEquals(List.of(key("f2"), key("f3")), cache.getLruKeys(key("f2")));

        // 查找 f2 后 f3 成为最久未使用
        cache.release(cache.lookup(key("f2"), CacheBehavior.EXPECT_IN_CACHE));
        assertEquals(List.of(key("f3"), key("f2")), cache.getLruKeys(key("f2")));

        insertAndRelease("f4", "A4");
        assertNull(cache.lookup(key("f3"), CacheBehavior.EXPECT_IN_CACHE));
        verify(deleter, times(1)).delete(eq(key("f3")), eq("A3"));

        try (CacheHandle f2 = cache.lookup(key("f2"), CacheBehavior.EXPECT_IN_CACHE);
             CacheHandle f4 = cache.lookup(key("f4"), CacheBehavior.EXPECT_IN_CACHE)) {
            assertEquals("A2", f2.getValue());
            assertEquals("A4", f4.getValue());
        }
        assertEquals(2, cache.getStats().getEvictionCount());
    }

    @Test
    void testChargeCountsAgainstCapacity() {
        ShardedCache weighted = new ShardedCache(10, 1, "weighted");
        weighted.release(weighted.insert(key("small"), "s", 3, deleter));
        weighted.release(weighted.insert(key("large"), "l", 8, deleter));

        assertEquals(8, weighted.getUsage());
        assertNull(weighted.lookup(key("small"), CacheBehavior.NO_EXPECT_IN_CACHE));
        verify(deleter).delete(eq(key("small")), eq("s"));

        assertThrows(IllegalArgumentException.class, () -> weighted.insert(key("zero"), "z", 0, deleter));
    }

    @Test
    @DisplayName("被句柄持有的条目不会被淘汰")
    void testPinnedEntrySurvivesEviction() {
        CacheHandle pinned = cache.insert(key("pinned"), "P", 1, deleter);

        for (int i = 0; i < 5; i++) {
            insertAndRelease("other" + i, "O" + i);
        }

        assertEquals("P", cache.value(pinned));
        verify(deleter, never()).delete(eq(key("pinned")), any());
        try (CacheHandle again = cache.lookup(key("pinned"), CacheBehavior.EXPECT_IN_CACHE)) {
            assertNotNull(again);
        }

        // 不再驻留后，最后一个句柄释放时才销毁
        assertTrue(cache.erase(key("pinned")));
        assertNull(cache.lookup(key("pinned"), CacheBehavior.EXPECT_IN_CACHE));
        verify(deleter, never()).delete(eq(key("pinned")), any());
        assertEquals("P", cache.value(pinned));

        cache.release(pinned);
        verify(deleter, times(1)).delete(eq(key("pinned")), eq("P"));
    }

    @Test
    void testCapacityExceededWhenAllPinned() {
        CacheHandle h1 = cache.insert(key("a"), "A", 1, deleter);
        CacheHandle h2 = cache.insert(key("b"), "B", 1, deleter);
        CacheHandle h3 = cache.insert(key("c"), "C", 1, deleter);

        assertEquals(3, cache.getUsage());
        assertEquals(3, cache.getEntryCount());
        verify(deleter, never()).delete(any(), any());

        cache.release(h1);
        cache.release(h2);
        cache.release(h3);

        // 下一次插入时回收到容量以内
        insertAndRelease("d", "D");
        assertEquals(2, cache.getUsage());
        verify(deleter).delete(eq(key("a")), eq("A"));
        verify(deleter).delete(eq(key("b")), eq("B"));
    }

    @Test
    @DisplayName("同键插入替换旧条目，旧值在持有者释放后销毁")
    void testOverwriteSameKey() {
        CacheHandle first = cache.insert(key("k"), "old", 1, deleter);
        cache.release(cache.insert(key("k"), "new", 1, deleter));

        assertEquals(1, cache.getEntryCount());
        try (CacheHandle found = cache.lookup(key("k"), CacheBehavior.EXPECT_IN_CACHE)) {
            assertEquals("new", found.getValue());
        }
        assertEquals("old", cache.value(first));
        verify(deleter, never()).delete(any(), eq("old"));

        cache.release(first);
        verify(deleter, times(1)).delete(eq(key("k")), eq("old"));
        verify(deleter, never()).delete(any(), eq("new"));
        assertEquals(1, cache.getStats().getDeleteCount());
    }

    @Test
    void testOverwriteUnpinnedDeletesImmediately() {
        insertAndRelease("k", "old");
        insertAndRelease("k", "new");
        verify(deleter, times(1)).delete(eq(key("k")), eq("old"));
        assertEquals(1, cache.getUsage());
    }

    @Test
    void testErase() {
        insertAndRelease("k", "v");
        assertTrue(cache.erase(key("k")));
        assertFalse(cache.erase(key("k")));
        assertFalse(cache.erase(key("nonexistent")));
        assertNull(cache.lookup(key("k"), CacheBehavior.EXPECT_IN_CACHE));
        verify(deleter, times(1)).delete(eq(key("k")), eq("v"));
        assertEquals(0, cache.getUsage());
    }

    @Test
    void testPruneKeepsPinnedEntries() {
        CacheHandle pinned = cache.insert(key("pinned"), "P", 1, deleter);
        insertAndRelease("free", "F");

        cache.prune();

        assertEquals(1, cache.getEntryCount());
        verify(deleter).delete(eq(key("free")), eq("F"));
        verify(deleter, never()).delete(eq(key("pinned")), any());
        cache.release(pinned);
        assertEquals(1, cache.getEntryCount());
    }

    @Test
    void testClear() {
        CacheHandle pinned = cache.insert(key("pinned"), "P", 1, deleter);
        insertAndRelease("free", "F");

        cache.clear();

        assertEquals(0, cache.getUsage());
        assertEquals(0, cache.getEntryCount());
        assertNull(cache.lookup(key("pinned"), CacheBehavior.EXPECT_IN_CACHE));
        verify(deleter).delete(eq(key("free")), eq("F"));
        verify(deleter, never()).delete(eq(key("pinned")), any());

        cache.release(pinned);
        verify(deleter).delete(eq(key("pinned")), eq("P"));
    }

    @Test
    void testReleaseTwiceThrows() {
        CacheHandle handle = cache.insert(key("k"), "v", 1, deleter);
        cache.release(handle);

        assertThrows(IllegalStateException.class, () -> cache.release(handle));
        assertThrows(IllegalStateException.class, () -> cache.value(handle));
    }

    @Test
    void testHandleFromAnotherCacheRejected() {
        ShardedCache other = new ShardedCache(4, 1, "other");
        CacheHandle foreign = other.insert(key("k"), "v", 1, deleter);

        assertThrows(IllegalArgumentException.class, () -> cache.release(foreign));
        assertThrows(IllegalArgumentException.class, () -> cache.value(foreign));
        other.release(foreign);
    }

    @Test
    void testDeleterFailureDoesNotCorruptShard() {
        Deleter failing = (k, v) -> {
            throw new IllegalStateException("boom");
        };
        cache.release(cache.insert(key("k"), "v", 1, failing));

        assertTrue(cache.erase(key("k")));
        assertEquals(0, cache.getUsage());
        insertAndRelease("k", "v2");
        assertEquals(1, cache.getEntryCount());
    }

    @Test
    void testNewIdIsMonotonic() {
        long first = cache.newId();
        long second = cache.newId();
        assertTrue(second > first);
    }

    @Test
    void testStatsAggregation() {
        ShardedCache sharded = new ShardedCache(64, 4);
        for (int i = 0; i < 10; i++) {
            sharded.release(sharded.insert(key("key" + i), i, 1, deleter));
        }
        for (int i = 0; i < 10; i++) {
            sharded.release(sharded.lookup(key("key" + i), CacheBehavior.EXPECT_IN_CACHE));
        }
        sharded.lookup(key("missing"), CacheBehavior.NO_EXPECT_IN_CACHE);

        CacheStats stats = sharded.getStats();
        assertEquals(10, stats.getInsertCount());
        assertEquals(10, stats.getHitCount());
        assertEquals(10, stats.getHitCachingCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(0, stats.getMissCachingCount());

        long shardInserts = 0;
        for (int i = 0; i < sharded.getShardCount(); i++) {
            shardInserts += sharded.getShardStats(i).getInsertCount();
        }
        assertEquals(10, shardInserts);
        assertThrows(IllegalArgumentException.class, () -> sharded.getShardStats(-1));
        assertThrows(IllegalArgumentException.class, () -> sharded.getShardStats(100));
    }

    @Test
    void testGetShardLoadFactors() {
        ShardedCache sharded = new ShardedCache(16, 4);
        for (double factor : sharded.getShardLoadFactors()) {
            assertEquals(0.0, factor, 0.001);
        }

        sharded.release(sharded.insert(key("key"), "value", 1, deleter));
        double[] loadFactors = sharded.getShardLoadFactors();
        assertEquals(0.25, loadFactors[sharded.getShardIndex(key("key"))], 0.001);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("并发访问下每个值的 deleter 恰好执行一次")
    void testConcurrentAccessDeletesEachValueOnce() throws Exception {
        ShardedCache shared = new ShardedCache(32, 4, "concurrent");
        Map<Integer, AtomicInteger> deletions = new ConcurrentHashMap<>();
        Deleter counting = (k, v) -> deletions.computeIfAbsent((Integer) v, x -> new AtomicInteger()).incrementAndGet();
        AtomicInteger nextValue = new AtomicInteger();

        int threads = 8;
        int opsPerThread = 5000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            long seed = t;
            futures.add(executor.submit(() -> {
                Random random = new Random(seed);
                start.await();
                for (int i = 0; i < opsPerThread; i++) {
                    Slice k = key("key" + random.nextInt(100));
                    int op = random.nextInt(10);
                    if (op < 4) {
                        int value = nextValue.incrementAndGet();
                        CacheHandle h = shared.insert(k, value, 1, counting);
                        assertEquals(value, shared.value(h));
                        shared.release(h);
                    } else if (op < 9) {
                        CacheHandle h = shared.lookup(k, CacheBehavior.NO_EXPECT_IN_CACHE);
                        if (h != null) {
                            Integer value = (Integer) shared.value(h);
                            assertNull(deletions.get(value));
                            shared.release(h);
                        }
                    } else {
                        shared.erase(k);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get();
        }
        executor.shutdown();

        shared.clear();
        assertEquals(0, shared.getUsage());

        assertEquals(nextValue.get(), deletions.size());
        for (AtomicInteger count : deletions.values()) {
            assertEquals(1, count.get());
        }
    }

    @Test
    void testToString() {
        String str = new ShardedCache(16, 4, "named").toString();
        assertTrue(str.contains("ShardedCache"));
        assertTrue(str.contains("shards=4"));
        assertTrue(str.contains("name=named"));
    }
}
