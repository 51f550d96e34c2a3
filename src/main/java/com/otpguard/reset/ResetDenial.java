package com.otpguard.reset;

import com.otpguard.exception.ErrorCode;
import lombok.Getter;

@Getter
public enum ResetDenial {
    LOCKED_OUT(ErrorCode.RESET_LOCKED_OUT),
    REQUEST_LIMIT(ErrorCode.RESET_REQUEST_LIMIT),
    ATTEMPT_LIMIT(ErrorCode.RESET_ATTEMPT_LIMIT);

    private final ErrorCode errorCode;

    ResetDenial(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }
}
