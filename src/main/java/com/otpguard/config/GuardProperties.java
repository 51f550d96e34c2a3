package com.otpguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 防护策略配置属性，绑定前缀 {@code guard.*}。
 *
 * <p>包含以下分组：</p>
 * - Otp：一次性验证码的有效期、重发、冷却与失败锁定策略；
 * - Reset：密码重置请求与尝试的频率限制；
 * - Store：短期存储选择（redis/local）。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    /** 验证码配置项。 */
    @Valid
    private final Otp otp = new Otp();
    /** 密码重置配置项。 */
    @Valid
    private final Reset reset = new Reset();
    /** 存储配置项。 */
    @Valid
    private final Store store = new Store();

    @Data
    public static class Otp {
        /** 验证码有效期（分钟），同时作为记录 TTL。 */
        @Min(1)
        private int expiryMinutes = 5;
        /** 达到锁定前允许的最大重发次数。 */
        @Min(0)
        private int maxResendCount = 3;
        /** 两次重发之间的最小间隔（秒）。 */
        @Min(1)
        private int resendCooldownSeconds = 60;
        /** 锁定时长（分钟）。 */
        @Min(1)
        private int lockoutDurationMinutes = 20;
        /** 验证码位数。 */
        @Min(1)
        @Max(18)
        private int otpLength = 6;
        /** 窗口内触发锁定的失败校验次数。 */
        @Min(1)
        private int maxFailedAttempts = 5;
        /** 失败计数窗口（分钟）。 */
        @Min(1)
        private int failedAttemptsWindowMinutes = 10;

        public Duration expiry() {
            return Duration.ofMinutes(expiryMinutes);
        }

        public Duration resendCooldown() {
            return Duration.ofSeconds(resendCooldownSeconds);
        }

        public Duration lockoutDuration() {
            return Duration.ofMinutes(lockoutDurationMinutes);
        }

        public Duration failedAttemptsWindow() {
            return Duration.ofMinutes(failedAttemptsWindowMinutes);
        }
    }

    @Data
    public static class Reset {
        /** 每小时允许的重置请求次数。 */
        @Min(1)
        private int maxResetRequestsPerHour = 3;
        /** 触发锁定的重置失败次数。 */
        @Min(1)
        private int maxResetAttempts = 5;
        /** 锁定时长（分钟）。 */
        @Min(1)
        private int lockoutDurationMinutes = 20;

        public Duration lockoutDuration() {
            return Duration.ofMinutes(lockoutDurationMinutes);
        }
    }

    @Data
    public static class Store {
        /** redis 或 local。 */
        @NotBlank
        private String type = "redis";
        /** local 模式下的最大条目数，达到后拒绝写入新键（不淘汰已有条目）。 */
        @Min(1)
        private long localMaximumSize = 100_000;
    }
}
