package com.otpguard.reset;

/**
 * 密码重置相关 Key，{@code email} 必须已经规范化。
 */
public final class ResetKeys {

    public static final String LOCKOUT_PREFIX = "pwd_reset:lockout:";

    private ResetKeys() {}

    public static String requests(String normalizedEmail) {
        return "pwd_reset:requests:" + normalizedEmail;
    }

    public static String attempts(String normalizedEmail) {
        return "pwd_reset:attempts:" + normalizedEmail;
    }

    public static String lockout(String normalizedEmail) {
        return LOCKOUT_PREFIX + normalizedEmail;
    }
}
