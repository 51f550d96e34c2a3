package com.otpguard.otp;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;

/**
 * 一次性验证码记录，每个主体至多一条。
 * <p>
 * {@code createdAt} 为 null 表示存储中的时间戳缺失或无法解析，此时记录一律视为已过期。
 * {@code resendCount} 为 {@link #UNKNOWN_RESEND_COUNT} 表示计数无法解析，按已达上限处理。
 */
public record OneTimeCode(
        long subjectId,
        String code,
        Instant createdAt,
        boolean used,
        int resendCount,
        Instant lastResendAt,
        Instant verifiedAt
) {

    public static final int UNKNOWN_RESEND_COUNT = Integer.MAX_VALUE;

    public static OneTimeCode issue(long subjectId, String code, Instant now) {
        return new OneTimeCode(subjectId, code, now, false, 0, null, null);
    }

    /**
     * 过期判定：{@code now > createdAt + expiry}。
     */
    public boolean isExpired(Instant now, Duration expiry) {
        return createdAt == null || now.isAfter(createdAt.plus(expiry));
    }

    /**
     * 常量时间比较，避免按响应时间猜测码值。
     */
    public boolean matches(String submitted) {
        if (code == null || submitted == null) {
            return false;
        }
        return MessageDigest.isEqual(
                code.getBytes(StandardCharsets.UTF_8),
                submitted.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 重发：替换码值并重置已使用标记，旧码随之失效。
     */
    public OneTimeCode resend(String newCode, int newResendCount, Instant now) {
        return new OneTimeCode(subjectId, newCode, createdAt, false, newResendCount, now, verifiedAt);
    }

    public OneTimeCode markVerified(Instant now) {
        return new OneTimeCode(subjectId, code, createdAt, true, resendCount, lastResendAt, now);
    }

    public int resendCountCappedAt(int max) {
        return Math.min(resendCount, max);
    }

    @Override
    public String toString() {
        return "OneTimeCode[subjectId=" + subjectId
                + ", createdAt=" + createdAt
                + ", used=" + used
                + ", resendCount=" + resendCount
                + ", lastResendAt=" + lastResendAt
                + ", verifiedAt=" + verifiedAt + "]";
    }
}
