package com.otpguard.store;

import com.otpguard.config.GuardProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 短期存储装配：默认 Redis，{@code guard.store.type=local} 时使用进程内 Caffeine。
 */
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "guard.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public EphemeralStore redisEphemeralStore(StringRedisTemplate redisTemplate) {
        return new RedisEphemeralStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "guard.store", name = "type", havingValue = "local")
    public EphemeralStore localEphemeralStore(GuardProperties props, Clock clock) {
        return new CaffeineEphemeralStore(props.getStore().getLocalMaximumSize(), clock);
    }
}
