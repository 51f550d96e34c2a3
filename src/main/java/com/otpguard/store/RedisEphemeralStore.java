package com.otpguard.store;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

/**
 * 基于 Redis 的短期存储实现。
 * <p>
 * 字符串值使用 {@code SET key value PX ttl}，计数器通过 Lua 脚本在一次往返内完成
 * {@code INCR} 与 {@code PEXPIRE}，避免并发失败请求相互覆盖导致少计。
 * Spring 的 {@link DataAccessException} 统一转换为 {@link EphemeralStoreException}。
 */
public class RedisEphemeralStore implements EphemeralStore {

    private static final String INCR_WITH_TTL_LUA =
            "local v = redis.call('INCR', KEYS[1])\n" +
            "redis.call('PEXPIRE', KEYS[1], ARGV[1])\n" +
            "return v";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> incrementScript;

    public RedisEphemeralStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = new DefaultRedisScript<>();
        this.incrementScript.setResultType(Long.class);
        this.incrementScript.setScriptText(INCR_WITH_TTL_LUA);
    }

    @Override
    public String get(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (DataAccessException ex) {
            throw new EphemeralStoreException("Failed to read key " + key, ex);
        }
    }

    @Override
    public long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new EphemeralStoreException("Counter " + key + " holds a non-numeric value", ex);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException ex) {
            throw new EphemeralStoreException("Failed to write key " + key, ex);
        }
    }

    @Override
    public void delete(String... keys) {
        if (keys.length == 0) {
            return;
        }
        try {
            redisTemplate.delete(List.of(keys));
        } catch (DataAccessException ex) {
            throw new EphemeralStoreException("Failed to delete keys " + List.of(keys), ex);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        Long value;
        try {
            value = redisTemplate.execute(incrementScript, List.of(key), String.valueOf(ttl.toMillis()));
        } catch (DataAccessException ex) {
            throw new EphemeralStoreException("Failed to increment counter " + key, ex);
        }
        if (value == null) {
            throw new EphemeralStoreException("Counter " + key + " increment returned no value");
        }
        return value;
    }
}
