package com.otpguard.otp;

public record OtpStatus(
        boolean lockedOut,
        int lockoutRemainingMinutes,
        int cooldownRemainingSeconds,
        boolean hasActiveOtp,
        int resendCount,
        int maxResendCount,
        int otpExpiresInMinutes,
        boolean canResend
) {
}
