package com.otpguard.reset;

import com.otpguard.exception.BusinessException;

/**
 * 重置门禁判定结果。
 * <p>
 * 拒绝时 {@code denial} 说明原因，{@code remainingMinutes} / {@code limit} 为结构化数值，
 * {@code message} 为默认英文提示，调用方可据结构化字段自行本地化。
 */
public record ResetDecision(boolean allowed, ResetDenial denial, int remainingMinutes, int limit, String message) {

    public static ResetDecision allow(String message) {
        return new ResetDecision(true, null, 0, 0, message);
    }

    public static ResetDecision deny(ResetDenial denial, int remainingMinutes, int limit, String message) {
        return new ResetDecision(false, denial, remainingMinutes, limit, message);
    }

    public void orElseThrow() {
        if (!allowed) {
            throw new BusinessException(denial.getErrorCode(), message);
        }
    }
}
