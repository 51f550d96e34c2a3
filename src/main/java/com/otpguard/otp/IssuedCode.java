package com.otpguard.otp;

/**
 * 签发/重发结果：码值交由调用方投递，本组件不负责发送。
 */
public record IssuedCode(long subjectId, String code, int resendCount, int maxResendCount, long expiresInSeconds) {

    @Override
    public String toString() {
        return "IssuedCode[subjectId=" + subjectId
                + ", resendCount=" + resendCount + "/" + maxResendCount
                + ", expiresInSeconds=" + expiresInSeconds + "]";
    }
}
