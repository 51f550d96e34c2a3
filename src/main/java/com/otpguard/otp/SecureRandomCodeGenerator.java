package com.otpguard.otp;

import java.security.SecureRandom;

public class SecureRandomCodeGenerator implements CodeGenerator {

    private final SecureRandom secureRandom;

    public SecureRandomCodeGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public String generate(int length) {
        if (length < 1 || length > 18) {
            throw new IllegalArgumentException("Code length must be between 1 and 18: " + length);
        }
        long lower = pow10(length - 1);
        long span = pow10(length) - lower;
        return String.valueOf(lower + secureRandom.nextLong(span));
    }

    private static long pow10(int exponent) {
        long value = 1L;
        for (int i = 0; i < exponent; i++) {
            value *= 10L;
        }
        return value;
    }
}
