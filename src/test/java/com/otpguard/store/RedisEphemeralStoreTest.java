package com.otpguard.store;

import com.otpguard.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RedisEphemeralStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisEphemeralStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisEphemeralStore(redisTemplate);
    }

    @Test
    void setWritesWithTtl() {
        store.set("k", "v", Duration.ofMinutes(5));

        verify(valueOps).set("k", "v", Duration.ofMinutes(5));
    }

    @Test
    void getLongParsesCounter() {
        when(valueOps.get("c")).thenReturn("4");
        when(valueOps.get("bad")).thenReturn("x");

        assertThat(store.getLong("c", 0)).isEqualTo(4);
        assertThat(store.getLong("missing", 7)).isEqualTo(7);
        assertThatThrownBy(() -> store.getLong("bad", 0)).isInstanceOf(EphemeralStoreException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementRunsScriptWithTtlInMillis() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("k")), eq("60000"))).thenReturn(3L);

        assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void incrementWithoutResultFails() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(null);

        assertThatThrownBy(() -> store.increment("k", Duration.ofSeconds(60)))
                .isInstanceOf(EphemeralStoreException.class);
    }

    @Test
    void deleteSendsKeysInOneCall() {
        store.delete("a", "b");

        verify(redisTemplate).delete(List.of("a", "b"));
    }

    @Test
    void connectionFailureBecomesStoreException() {
        when(valueOps.get("k")).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.get("k"))
                .isInstanceOfSatisfying(EphemeralStoreException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.STORE_UNAVAILABLE))
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void emptyDeleteDoesNotTouchRedis() {
        StringRedisTemplate untouched = mock(StringRedisTemplate.class);

        new RedisEphemeralStore(untouched).delete();

        verifyNoInteractions(untouched);
    }
}
