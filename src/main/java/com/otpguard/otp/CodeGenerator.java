package com.otpguard.otp;

/**
 * 验证码生成器接口。
 * <p>
 * 在 {@code [10^(length-1), 10^length - 1]} 区间内均匀取值，保证不出现前导零。
 * 默认实现基于 {@link java.security.SecureRandom}，可替换为其它随机源。
 */
public interface CodeGenerator {

    String generate(int length);
}
