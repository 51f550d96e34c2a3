package com.otpguard.otp;

import com.otpguard.exception.ErrorCode;
import lombok.Getter;

// 分别对应：成功、锁定中、冷却中、找不到、已使用、过期、不匹配、重发次数用尽
@Getter
public enum OtpOutcome {
    SUCCESS(null),
    LOCKED_OUT(ErrorCode.OTP_LOCKED_OUT),
    COOLDOWN(ErrorCode.OTP_COOLDOWN),
    NOT_FOUND(ErrorCode.OTP_NOT_FOUND),
    ALREADY_USED(ErrorCode.OTP_ALREADY_USED),
    EXPIRED(ErrorCode.OTP_EXPIRED),
    MISMATCH(ErrorCode.OTP_MISMATCH),
    LIMIT_REACHED(ErrorCode.OTP_RESEND_LIMIT);

    private final ErrorCode errorCode;

    OtpOutcome(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }
}
