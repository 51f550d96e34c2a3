package com.otpguard.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 进程内短期存储实现（Caffeine）。
 * <p>
 * 每个条目携带自己的 TTL（可变过期），条目只会随 TTL 到期消失，不做容量淘汰：
 * 锁定记录与失败计数若被挤出就等于提前解锁。达到容量上限后拒绝写入新键并抛出
 * {@link EphemeralStoreException}，已有键的覆盖与自增不受影响。
 * 系统时钟使用单调的 {@link Ticker#systemTicker()}，其它时钟（测试）按其毫秒驱动过期。
 * 计数器自增通过 {@code asMap().compute} 保证原子性。适用于单节点部署与测试。
 */
public class CaffeineEphemeralStore implements EphemeralStore {

    private final Cache<String, Entry> cache;
    private final long maximumSize;

    public CaffeineEphemeralStore(long maximumSize, Clock clock) {
        this(maximumSize, tickerFor(clock));
    }

    public CaffeineEphemeralStore(long maximumSize, Ticker ticker) {
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfter(new PerEntryTtl())
                .build();
    }

    static Ticker tickerFor(Clock clock) {
        if (Clock.systemUTC().equals(clock) || Clock.systemDefaultZone().equals(clock)) {
            return Ticker.systemTicker();
        }
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    @Override
    public String get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? null : entry.value();
    }

    @Override
    public long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        return parseCounter(key, value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        ensureCapacity(key);
        cache.put(key, new Entry(value, ttl.toNanos()));
    }

    @Override
    public void delete(String... keys) {
        for (String key : keys) {
            cache.invalidate(key);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        ensureCapacity(key);
        Entry updated = cache.asMap().compute(key, (k, old) -> {
            long current = old == null ? 0L : parseCounter(k, old.value());
            return new Entry(String.valueOf(current + 1), ttl.toNanos());
        });
        return Long.parseLong(updated.value());
    }

    private void ensureCapacity(String key) {
        if (cache.estimatedSize() < maximumSize || cache.asMap().containsKey(key)) {
            return;
        }
        // 先清理已到期条目再判断
        cache.cleanUp();
        if (cache.estimatedSize() >= maximumSize) {
            throw new EphemeralStoreException("Local store is full (" + maximumSize + " entries)");
        }
    }

    private static long parseCounter(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new EphemeralStoreException("Counter " + key + " holds a non-numeric value", ex);
        }
    }

    private record Entry(String value, long ttlNanos) {
    }

    private static final class PerEntryTtl implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
