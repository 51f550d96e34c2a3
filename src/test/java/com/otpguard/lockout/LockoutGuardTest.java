package com.otpguard.lockout;

import com.otpguard.store.CaffeineEphemeralStore;
import com.otpguard.store.EphemeralStore;
import com.otpguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LockoutGuardTest {

    private MutableClock clock;
    private EphemeralStore store;
    private LockoutGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new CaffeineEphemeralStore(1_000, clock);
        guard = new LockoutGuard(store, clock, "test:lockout:", Duration.ofMinutes(20));
    }

    @Test
    void lockHoldsUntilDurationElapses() {
        assertThat(guard.isLockedOut("a")).isFalse();
        assertThat(guard.remainingMinutes("a")).isZero();

        guard.lock("a");
        assertThat(guard.isLockedOut("a")).isTrue();
        assertThat(guard.remainingMinutes("a")).isEqualTo(20);

        clock.advance(Duration.ofMinutes(10).plusSeconds(30));
        assertThat(guard.remainingMinutes("a")).isEqualTo(9);

        clock.advance(Duration.ofMinutes(9).plusSeconds(29));
        assertThat(guard.isLockedOut("a")).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(guard.isLockedOut("a")).isFalse();
        assertThat(guard.remainingMinutes("a")).isZero();
    }

    @Test
    void relockRestartsFromNow() {
        guard.lock("a");
        clock.advance(Duration.ofMinutes(15));
        guard.lock("a");

        clock.advance(Duration.ofMinutes(10));
        assertThat(guard.isLockedOut("a")).isTrue();
        assertThat(guard.remainingMinutes("a")).isEqualTo(10);

        clock.advance(Duration.ofMinutes(10));
        assertThat(guard.isLockedOut("a")).isFalse();
    }

    @Test
    void unparsableStartStillLocksWithZeroRemaining() {
        store.set("test:lockout:a", "not-a-timestamp", Duration.ofMinutes(20));

        assertThat(guard.isLockedOut("a")).isTrue();
        assertThat(guard.remainingMinutes("a")).isZero();
    }

    @Test
    void namespacesAreDisjoint() {
        LockoutGuard other = new LockoutGuard(store, clock, "other:lockout:", Duration.ofMinutes(5));

        guard.lock("a");

        assertThat(other.isLockedOut("a")).isFalse();
        assertThat(guard.key("a")).isEqualTo("test:lockout:a");
        assertThat(other.key("a")).isEqualTo("other:lockout:a");
    }
}
