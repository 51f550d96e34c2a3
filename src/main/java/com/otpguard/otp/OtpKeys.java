package com.otpguard.otp;

/**
 * 验证码相关 Redis Key 生成工具。
 */
public final class OtpKeys {

    public static final String LOCKOUT_PREFIX = "otp:lockout:user:";

    private OtpKeys() {}

    // 验证码记录：otp:user:{subjectId}
    public static String code(long subjectId) {
        return "otp:user:" + subjectId;
    }

    public static String lockout(long subjectId) {
        return LOCKOUT_PREFIX + subjectId;
    }

    // 重发冷却：otp:resend:user:{subjectId}
    public static String resend(long subjectId) {
        return "otp:resend:user:" + subjectId;
    }

    // 失败次数窗口计数：otp:failed_attempts:user:{subjectId}
    public static String failedAttempts(long subjectId) {
        return "otp:failed_attempts:user:" + subjectId;
    }

    // 可清理的键；锁定记录不在其中，只能随 TTL 到期
    public static String[] purgeable(long subjectId) {
        return new String[]{code(subjectId), resend(subjectId), failedAttempts(subjectId)};
    }
}
