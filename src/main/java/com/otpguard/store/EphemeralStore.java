package com.otpguard.store;

import java.time.Duration;

/**
 * 短期状态存储接口。
 * <p>
 * 抽象带 TTL 的键值读写，验证码、锁定、冷却与计数器均存放于此。
 * 实现可使用 Redis 或进程内缓存；任何底层故障都必须以 {@link EphemeralStoreException} 抛出，
 * 不允许吞掉异常后返回“缺失”。
 */
public interface EphemeralStore {

    /**
     * 读取字符串值。
     *
     * @param key 键名。
     * @return 值；键不存在或已过期时返回 null。
     */
    String get(String key);

    /**
     * 读取数字计数器。
     *
     * @param key          键名。
     * @param defaultValue 键不存在时的返回值。
     * @return 计数值。
     * @throws EphemeralStoreException 存储故障或值不是整数时抛出（计数器不允许被静默清零）。
     */
    long getLong(String key, long defaultValue);

    /**
     * 写入值并设置生存时间，覆盖已有值与 TTL。
     *
     * @param key   键名。
     * @param value 值。
     * @param ttl   生存时间，必须为正。
     */
    void set(String key, String value, Duration ttl);

    /**
     * 删除一个或多个键，不存在的键忽略。
     *
     * @param keys 键名。
     */
    void delete(String... keys);

    /**
     * 原子自增计数器并刷新 TTL。
     *
     * @param key 键名。
     * @param ttl 自增后的生存时间。
     * @return 自增后的值。
     */
    long increment(String key, Duration ttl);
}
