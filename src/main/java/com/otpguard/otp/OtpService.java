package com.otpguard.otp;

import com.otpguard.config.GuardProperties;
import com.otpguard.exception.BusinessException;
import com.otpguard.exception.ErrorCode;
import com.otpguard.lockout.LockoutGuard;
import com.otpguard.store.EphemeralStore;
import com.otpguard.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;

/**
 * 一次性验证码业务服务。
 * <p>
 * 负责签发、校验、重发与状态查询：
 * - 锁定检查优先于其它一切判断，锁定只随 TTL 到期解除；
 * - 每个主体仅保留一条记录，重发在原记录上替换码值，旧码立即失效；
 * - 重发受冷却间隔与最大次数约束，超限触发锁定；
 * - 校验失败在窗口内累计，达到阈值立即锁定，与验证码是否过期无关；
 * 配置来源于 `GuardProperties.Otp`，状态全部保存在 {@link EphemeralStore}。
 * <p>
 * 本服务不发送验证码，也不记录码值；存储故障以
 * {@link com.otpguard.store.EphemeralStoreException} 抛出。
 */
@Slf4j
@Service
public class OtpService {

    private final EphemeralStore store;
    private final CodeGenerator codeGenerator;
    private final OneTimeCodeCodec codec;
    private final GuardProperties.Otp cfg;
    private final Clock clock;
    private final LockoutGuard lockout;

    public OtpService(EphemeralStore store,
                      CodeGenerator codeGenerator,
                      OneTimeCodeCodec codec,
                      GuardProperties properties,
                      Clock clock) {
        this.store = store;
        this.codeGenerator = codeGenerator;
        this.codec = codec;
        this.cfg = properties.getOtp();
        this.clock = clock;
        this.lockout = new LockoutGuard(store, clock, OtpKeys.LOCKOUT_PREFIX, cfg.lockoutDuration());
    }

    /**
     * 签发新验证码，覆盖该主体已有记录，并清除重发冷却。
     *
     * @param subjectId 主体 ID。
     * @return 成功时包含码值与有效期；锁定中返回 LOCKED_OUT。
     */
    public OtpResult<IssuedCode> issue(long subjectId) {
        String subject = String.valueOf(subjectId);
        if (lockout.isLockedOut(subject)) {
            return OtpResult.lockedOut(lockout.remainingMinutes(subject));
        }
        Instant now = clock.instant();
        OneTimeCode record = OneTimeCode.issue(subjectId, codeGenerator.generate(cfg.getOtpLength()), now);
        save(record);
        store.delete(OtpKeys.resend(subjectId));
        log.debug("OTP issued subjectId={}", subjectId);
        return OtpResult.success(toIssued(record, now));
    }

    /**
     * 校验验证码。
     * <p>
     * 判断顺序：锁定 → 记录存在 → 已使用 → 过期（清理残留键）→ 比对。
     * 比对失败累计失败次数并返回 MISMATCH；成功则标记已使用并清理冷却、锁定与失败计数。
     *
     * @param subjectId     主体 ID。
     * @param submittedCode 用户提交的验证码。
     * @return 成功时包含校验时间。
     * @throws BusinessException 提交码为空时抛出。
     */
    public OtpResult<Instant> verify(long subjectId, String submittedCode) {
        if (!StringUtils.hasText(submittedCode)) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Verification code must not be empty");
        }
        String subject = String.valueOf(subjectId);
        if (lockout.isLockedOut(subject)) {
            return OtpResult.lockedOut(lockout.remainingMinutes(subject));
        }
        OneTimeCode record = load(subjectId);
        if (record == null) {
            return OtpResult.failure(OtpOutcome.NOT_FOUND);
        }
        if (record.used()) {
            return OtpResult.failure(OtpOutcome.ALREADY_USED);
        }
        Instant now = clock.instant();
        if (record.isExpired(now, cfg.expiry())) {
            purge(subjectId);
            return OtpResult.failure(OtpOutcome.EXPIRED);
        }
        if (!record.matches(submittedCode)) {
            long attempts = trackFailedAttempt(subjectId);
            log.debug("OTP mismatch subjectId={} failedAttempts={}", subjectId, attempts);
            return OtpResult.failure(OtpOutcome.MISMATCH);
        }

        save(record.markVerified(now));
        store.delete(OtpKeys.resend(subjectId), OtpKeys.failedAttempts(subjectId));
        lockout.clear(subject);
        log.debug("OTP verified subjectId={}", subjectId);
        return OtpResult.success(now);
    }

    /**
     * 重发验证码。
     * <p>
     * 有效记录存在时在原记录上生成新码（重发次数 +1、已使用标记复位、刷新 TTL 与冷却）；
     * 重发次数已达上限则触发锁定。记录不存在或已过期时清理残留键后按签发处理。
     *
     * @param subjectId 主体 ID。
     * @return 成功时包含新码与最新重发次数；可能返回 LOCKED_OUT、COOLDOWN、LIMIT_REACHED。
     */
    public OtpResult<IssuedCode> resend(long subjectId) {
        String subject = String.valueOf(subjectId);
        if (lockout.isLockedOut(subject)) {
            return OtpResult.lockedOut(lockout.remainingMinutes(subject));
        }
        int cooldown = cooldownRemainingSeconds(subjectId);
        if (cooldown > 0) {
            return OtpResult.cooldown(cooldown);
        }

        Instant now = clock.instant();
        OneTimeCode existing = load(subjectId);
        if (existing != null && !existing.isExpired(now, cfg.expiry())) {
            int resendCount = existing.resendCountCappedAt(cfg.getMaxResendCount());
            if (resendCount >= cfg.getMaxResendCount()) {
                lockout.lock(subject);
                log.info("OTP resend limit reached, subject locked subjectId={} max={}", subjectId, cfg.getMaxResendCount());
                return OtpResult.limitReached(cfg.getMaxResendCount());
            }
            OneTimeCode resent = existing.resend(codeGenerator.generate(cfg.getOtpLength()), resendCount + 1, now);
            save(resent);
            store.set(OtpKeys.resend(subjectId), Timestamps.format(now), cfg.resendCooldown());
            log.debug("OTP resent subjectId={} resendCount={}/{}", subjectId, resent.resendCount(), cfg.getMaxResendCount());
            return OtpResult.success(toIssued(resent, now));
        }

        if (existing != null) {
            purge(subjectId);
        }
        return issue(subjectId);
    }

    /**
     * 只读的状态汇总，不修改任何键。
     */
    public OtpStatus status(long subjectId) {
        String subject = String.valueOf(subjectId);
        boolean lockedOut = lockout.isLockedOut(subject);
        int lockoutRemaining = lockedOut ? lockout.remainingMinutes(subject) : 0;
        int cooldown = cooldownRemainingSeconds(subjectId);

        Instant now = clock.instant();
        OneTimeCode record = load(subjectId);
        boolean active = record != null && !record.isExpired(now, cfg.expiry());
        int resendCount = active ? record.resendCountCappedAt(cfg.getMaxResendCount()) : 0;
        int expiresInMinutes = active
                ? (int) Timestamps.remaining(record.createdAt(), cfg.expiry(), now).toMinutes()
                : 0;

        boolean canResend = !lockedOut && cooldown == 0 && resendCount < cfg.getMaxResendCount();
        return new OtpStatus(lockedOut, lockoutRemaining, cooldown, active, resendCount,
                cfg.getMaxResendCount(), expiresInMinutes, canResend);
    }

    public boolean isLockedOut(long subjectId) {
        return lockout.isLockedOut(String.valueOf(subjectId));
    }

    public int lockoutRemainingMinutes(long subjectId) {
        return lockout.remainingMinutes(String.valueOf(subjectId));
    }

    /**
     * 剩余冷却秒数（向下取整）。无冷却记录或时间戳无法解析时返回 0。
     */
    public int cooldownRemainingSeconds(long subjectId) {
        Instant lastResend = Timestamps.parse(store.get(OtpKeys.resend(subjectId)));
        if (lastResend == null) {
            return 0;
        }
        return (int) Timestamps.remaining(lastResend, cfg.resendCooldown(), clock.instant()).getSeconds();
    }

    /**
     * 记录一次校验失败（刷新窗口 TTL），达到阈值立即锁定。
     *
     * @return 窗口内累计失败次数。
     */
    public long trackFailedAttempt(long subjectId) {
        long attempts = store.increment(OtpKeys.failedAttempts(subjectId), cfg.failedAttemptsWindow());
        if (attempts >= cfg.getMaxFailedAttempts()) {
            lockout.lock(String.valueOf(subjectId));
            log.info("OTP failed attempts threshold reached, subject locked subjectId={} attempts={}", subjectId, attempts);
        }
        return attempts;
    }

    /**
     * 删除该主体的验证码记录、冷却与失败计数。锁定记录保留，仍只随 TTL 解除。
     */
    public void purge(long subjectId) {
        store.delete(OtpKeys.purgeable(subjectId));
    }

    private OneTimeCode load(long subjectId) {
        return codec.decode(store.get(OtpKeys.code(subjectId)));
    }

    private void save(OneTimeCode record) {
        store.set(OtpKeys.code(record.subjectId()), codec.encode(record), cfg.expiry());
    }

    private IssuedCode toIssued(OneTimeCode record, Instant now) {
        return new IssuedCode(
                record.subjectId(),
                record.code(),
                record.resendCount(),
                cfg.getMaxResendCount(),
                Timestamps.remaining(record.createdAt(), cfg.expiry(), now).getSeconds());
    }
}
