package com.otpguard.config;

import com.otpguard.otp.CodeGenerator;
import com.otpguard.otp.SecureRandomCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * 防护组件基础 Bean 配置。
 * <p>
 * - `Clock`：统一时间源（UTC），测试可替换为可控时钟；
 * - `SecureRandom` / `CodeGenerator`：验证码随机源，可替换为其它实现。
 */
@Configuration
@EnableConfigurationProperties(GuardProperties.class)
public class GuardConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(SecureRandom.class)
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    @ConditionalOnMissingBean(CodeGenerator.class)
    public CodeGenerator codeGenerator(SecureRandom secureRandom) {
        return new SecureRandomCodeGenerator(secureRandom);
    }
}
