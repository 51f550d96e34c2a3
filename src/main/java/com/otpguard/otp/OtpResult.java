package com.otpguard.otp;

import com.otpguard.exception.BusinessException;

/**
 * 验证码操作结果。
 * <p>
 * 成功时携带 {@code value}；失败时携带结构化字段，由调用方自行组织提示文案：
 * - LOCKED_OUT：{@code remainingMinutes}；
 * - COOLDOWN：{@code remainingSeconds}；
 * - LIMIT_REACHED：{@code limit}。
 */
public record OtpResult<T>(
        OtpOutcome outcome,
        T value,
        int remainingMinutes,
        int remainingSeconds,
        int limit
) {

    public static <T> OtpResult<T> success(T value) {
        return new OtpResult<>(OtpOutcome.SUCCESS, value, 0, 0, 0);
    }

    public static <T> OtpResult<T> lockedOut(int remainingMinutes) {
        return new OtpResult<>(OtpOutcome.LOCKED_OUT, null, remainingMinutes, 0, 0);
    }

    public static <T> OtpResult<T> cooldown(int remainingSeconds) {
        return new OtpResult<>(OtpOutcome.COOLDOWN, null, 0, remainingSeconds, 0);
    }

    public static <T> OtpResult<T> limitReached(int limit) {
        return new OtpResult<>(OtpOutcome.LIMIT_REACHED, null, 0, 0, limit);
    }

    public static <T> OtpResult<T> failure(OtpOutcome outcome) {
        return new OtpResult<>(outcome, null, 0, 0, 0);
    }

    public boolean isSuccess() {
        return outcome == OtpOutcome.SUCCESS;
    }

    /**
     * 成功返回结果值，失败则抛出携带对应错误码的 {@link BusinessException}。
     */
    public T orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        throw new BusinessException(outcome.getErrorCode());
    }
}
