package com.otpguard.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", "Invalid request parameters"),
    OTP_LOCKED_OUT("OTP_LOCKED_OUT", "Temporarily locked out. Please wait before trying again."),
    OTP_COOLDOWN("OTP_COOLDOWN", "Please wait before requesting another code."),
    OTP_NOT_FOUND("OTP_NOT_FOUND", "No valid code found. Please request a new one."),
    OTP_ALREADY_USED("OTP_ALREADY_USED", "Code has already been used. Please request a new one."),
    OTP_EXPIRED("OTP_EXPIRED", "Code has expired. Please request a new one."),
    OTP_MISMATCH("OTP_MISMATCH", "Invalid code. Please check and try again."),
    OTP_RESEND_LIMIT("OTP_RESEND_LIMIT", "Maximum resend limit reached."),
    RESET_LOCKED_OUT("RESET_LOCKED_OUT", "Too many reset attempts. Please wait before trying again."),
    RESET_REQUEST_LIMIT("RESET_REQUEST_LIMIT", "Too many reset requests. Please try again later."),
    RESET_ATTEMPT_LIMIT("RESET_ATTEMPT_LIMIT", "Too many reset attempts."),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "Ephemeral store unavailable");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
