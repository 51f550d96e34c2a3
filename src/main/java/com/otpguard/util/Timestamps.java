package com.otpguard.util;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * 存储中时间戳字段的读写工具。
 * <p>
 * 时间戳统一为 ISO-8601 瞬时值；无法解析时返回 null，由调用方决定按“已过期/未锁定”处理。
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant.toString();
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * 计算从 {@code start} 起 {@code window} 时长内在 {@code now} 时刻的剩余时间，不小于零。
     */
    public static Duration remaining(Instant start, Duration window, Instant now) {
        Duration left = Duration.between(now, start.plus(window));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
