package com.otpguard.lockout;

import com.otpguard.store.EphemeralStore;
import com.otpguard.util.Timestamps;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 二元锁定状态。
 * <p>
 * 锁定记录键为 {@code <keyPrefix><subjectKey>}，值为锁定开始时间，TTL 等于锁定时长；
 * 键存在即锁定，只有 TTL 到期才会自然解除。重复锁定会覆盖开始时间，相当于从“现在”重新计时。
 * 同一实现按不同键前缀分别用于验证码与密码重置两个场景。
 * <p>
 * 存储故障直接向上抛出，不会被解读为“未锁定”。
 */
@Slf4j
public class LockoutGuard {

    private final EphemeralStore store;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration duration;

    public LockoutGuard(EphemeralStore store, Clock clock, String keyPrefix, Duration duration) {
        this.store = store;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.duration = duration;
    }

    public boolean isLockedOut(String subjectKey) {
        return store.get(key(subjectKey)) != null;
    }

    /**
     * 剩余锁定分钟数（向下取整）。未锁定或开始时间无法解析时返回 0。
     */
    public int remainingMinutes(String subjectKey) {
        Instant start = Timestamps.parse(store.get(key(subjectKey)));
        if (start == null) {
            return 0;
        }
        return (int) Timestamps.remaining(start, duration, clock.instant()).toMinutes();
    }

    public void lock(String subjectKey) {
        store.set(key(subjectKey), Timestamps.format(clock.instant()), duration);
        log.debug("Lockout written namespace={} durationMinutes={}", keyPrefix, duration.toMinutes());
    }

    /**
     * 删除锁定记录。仅用于成功路径的收尾清理（此时检查阶段已确认未锁定），不对外提供解锁能力。
     */
    public void clear(String subjectKey) {
        store.delete(key(subjectKey));
    }

    public String key(String subjectKey) {
        return keyPrefix + subjectKey;
    }
}
