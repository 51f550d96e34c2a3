package com.otpguard.reset;

import com.otpguard.config.GuardProperties;
import com.otpguard.lockout.LockoutGuard;
import com.otpguard.store.EphemeralStore;
import com.otpguard.util.EmailNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * 密码重置防护服务。
 * <p>
 * 两道相互独立的门禁，均以规范化邮箱为键：
 * - 请求门禁：每小时固定窗口计数，达到上限拒绝；
 * - 尝试门禁：失败次数达到上限时在本次检查中直接触发锁定并拒绝。
 * 锁定使用独立命名空间 {@code pwd_reset:lockout:}，与验证码锁定互不影响。
 * 空邮箱一律抛出 {@link com.otpguard.exception.BusinessException}。
 */
@Slf4j
@Service
public class PasswordResetGuard {

    static final Duration COUNTER_WINDOW = Duration.ofHours(1);

    private final EphemeralStore store;
    private final GuardProperties.Reset cfg;
    private final LockoutGuard lockout;

    public PasswordResetGuard(EphemeralStore store, GuardProperties properties, Clock clock) {
        this.store = store;
        this.cfg = properties.getReset();
        this.lockout = new LockoutGuard(store, clock, ResetKeys.LOCKOUT_PREFIX, cfg.lockoutDuration());
    }

    /**
     * 是否允许发起重置请求：锁定中或本小时请求数已达上限则拒绝。
     */
    public ResetDecision canRequestReset(String email) {
        String normalized = EmailNormalizer.normalize(email);
        if (lockout.isLockedOut(normalized)) {
            int remaining = lockout.remainingMinutes(normalized);
            return ResetDecision.deny(ResetDenial.LOCKED_OUT, remaining, 0,
                    "Too many reset attempts. Please wait %d minutes before trying again.".formatted(remaining));
        }
        long requests = store.getLong(ResetKeys.requests(normalized), 0L);
        if (requests >= cfg.getMaxResetRequestsPerHour()) {
            log.info("Reset request limit reached email={} requests={}", EmailNormalizer.mask(normalized), requests);
            return ResetDecision.deny(ResetDenial.REQUEST_LIMIT, 0, cfg.getMaxResetRequestsPerHour(),
                    "Maximum %d reset requests per hour exceeded. Please try again later."
                            .formatted(cfg.getMaxResetRequestsPerHour()));
        }
        return ResetDecision.allow("Reset request allowed");
    }

    /**
     * 记录一次已受理的重置请求（1 小时窗口）。
     *
     * @return 当前窗口内请求数。
     */
    public long trackRequest(String email) {
        return store.increment(ResetKeys.requests(EmailNormalizer.normalize(email)), COUNTER_WINDOW);
    }

    /**
     * 是否允许提交重置凭证：锁定中拒绝；失败次数已达上限则在此处触发锁定并拒绝。
     */
    public ResetDecision canAttemptReset(String email) {
        String normalized = EmailNormalizer.normalize(email);
        if (lockout.isLockedOut(normalized)) {
            int remaining = lockout.remainingMinutes(normalized);
            return ResetDecision.deny(ResetDenial.LOCKED_OUT, remaining, 0,
                    "Account temporarily locked. Please wait %d minutes before trying again.".formatted(remaining));
        }
        long attempts = store.getLong(ResetKeys.attempts(normalized), 0L);
        if (attempts >= cfg.getMaxResetAttempts()) {
            lockout.lock(normalized);
            log.info("Reset attempt limit reached, email locked email={} attempts={}", EmailNormalizer.mask(normalized), attempts);
            return ResetDecision.deny(ResetDenial.ATTEMPT_LIMIT, cfg.getLockoutDurationMinutes(), cfg.getMaxResetAttempts(),
                    "Too many reset attempts. Account locked for %d minutes.".formatted(cfg.getLockoutDurationMinutes()));
        }
        return ResetDecision.allow("Reset attempt allowed");
    }

    /**
     * 记录一次失败的重置确认（1 小时窗口）。
     *
     * @return 当前窗口内失败次数。
     */
    public long trackFailedResetAttempt(String email) {
        return store.increment(ResetKeys.attempts(EmailNormalizer.normalize(email)), COUNTER_WINDOW);
    }

    /**
     * 重置完全成功后清除请求计数、失败计数与锁定记录。
     */
    public void clearTracking(String email) {
        String normalized = EmailNormalizer.normalize(email);
        store.delete(ResetKeys.requests(normalized), ResetKeys.attempts(normalized));
        lockout.clear(normalized);
    }

    public long requestCount(String email) {
        return store.getLong(ResetKeys.requests(EmailNormalizer.normalize(email)), 0L);
    }

    public long attemptCount(String email) {
        return store.getLong(ResetKeys.attempts(EmailNormalizer.normalize(email)), 0L);
    }

    public boolean isLockedOut(String email) {
        return lockout.isLockedOut(EmailNormalizer.normalize(email));
    }

    public int lockoutRemainingMinutes(String email) {
        return lockout.remainingMinutes(EmailNormalizer.normalize(email));
    }
}
