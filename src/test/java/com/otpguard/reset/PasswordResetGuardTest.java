package com.otpguard.reset;

import com.otpguard.config.GuardProperties;
import com.otpguard.exception.BusinessException;
import com.otpguard.exception.ErrorCode;
import com.otpguard.otp.OtpKeys;
import com.otpguard.store.CaffeineEphemeralStore;
import com.otpguard.store.EphemeralStore;
import com.otpguard.store.EphemeralStoreException;
import com.otpguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PasswordResetGuardTest {

    private static final String EMAIL = "Alice@Example.com";

    private MutableClock clock;
    private EphemeralStore store;
    private PasswordResetGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new CaffeineEphemeralStore(1_000, clock);
        guard = new PasswordResetGuard(store, new GuardProperties(), clock);
    }

    @Test
    void fourthRequestWithinHourIsDenied() {
        for (int i = 0; i < 3; i++) {
            assertThat(guard.canRequestReset(EMAIL).allowed()).isTrue();
            guard.trackRequest(EMAIL);
        }

        ResetDecision denied = guard.canRequestReset(EMAIL);

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.denial()).isEqualTo(ResetDenial.REQUEST_LIMIT);
        assertThat(denied.limit()).isEqualTo(3);
        assertThat(denied.message()).contains("Maximum 3");
    }

    @Test
    void requestWindowExpiresAfterAnHour() {
        for (int i = 0; i < 3; i++) {
            guard.trackRequest(EMAIL);
        }
        clock.advance(Duration.ofHours(1));

        assertThat(guard.requestCount(EMAIL)).isZero();
        assertThat(guard.canRequestReset(EMAIL).allowed()).isTrue();
    }

    @Test
    void emailIsCaseFoldedAtEveryKey() {
        guard.trackRequest(EMAIL);
        guard.trackFailedResetAttempt("  ALICE@example.COM ");

        assertThat(guard.requestCount("alice@example.com")).isEqualTo(1);
        assertThat(guard.attemptCount("alice@EXAMPLE.com")).isEqualTo(1);
        assertThat(store.getLong(ResetKeys.requests("alice@example.com"), 0)).isEqualTo(1);
    }

    @Test
    void attemptLimitLocksOnTheCheckItself() {
        for (int i = 0; i < 5; i++) {
            assertThat(guard.canAttemptReset(EMAIL).allowed()).isTrue();
            guard.trackFailedResetAttempt(EMAIL);
        }
        assertThat(guard.isLockedOut(EMAIL)).isFalse();

        ResetDecision limited = guard.canAttemptReset(EMAIL);
        assertThat(limited.denial()).isEqualTo(ResetDenial.ATTEMPT_LIMIT);
        assertThat(limited.message()).contains("20 minutes");
        assertThat(guard.isLockedOut(EMAIL)).isTrue();

        ResetDecision locked = guard.canAttemptReset(EMAIL);
        assertThat(locked.denial()).isEqualTo(ResetDenial.LOCKED_OUT);
        assertThat(locked.remainingMinutes()).isEqualTo(20);
        assertThat(guard.canRequestReset(EMAIL).denial()).isEqualTo(ResetDenial.LOCKED_OUT);
    }

    @Test
    void lockoutClearsAfterDuration() {
        for (int i = 0; i < 5; i++) {
            guard.trackFailedResetAttempt(EMAIL);
        }
        guard.canAttemptReset(EMAIL);
        clock.advance(Duration.ofMinutes(19));
        assertThat(guard.lockoutRemainingMinutes(EMAIL)).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));

        assertThat(guard.isLockedOut(EMAIL)).isFalse();
    }

    @Test
    void floodOfOtherEmailsCannotEvictLockout() {
        PasswordResetGuard smallGuard = new PasswordResetGuard(
                new CaffeineEphemeralStore(10, clock), new GuardProperties(), clock);
        for (int i = 0; i < 5; i++) {
            smallGuard.trackFailedResetAttempt(EMAIL);
        }
        smallGuard.canAttemptReset(EMAIL);

        assertThatThrownBy(() -> {
            for (int i = 0; i < 1000; i++) {
                smallGuard.trackRequest("junk" + i + "@example.com");
            }
        }).isInstanceOf(EphemeralStoreException.class);

        assertThat(smallGuard.isLockedOut(EMAIL)).isTrue();
        assertThat(smallGuard.attemptCount(EMAIL)).isEqualTo(5);
        assertThat(smallGuard.canAttemptReset(EMAIL).denial()).isEqualTo(ResetDenial.LOCKED_OUT);
    }

    @Test
    void clearTrackingResetsEverything() {
        guard.trackRequest(EMAIL);
        for (int i = 0; i < 5; i++) {
            guard.trackFailedResetAttempt(EMAIL);
        }
        guard.canAttemptReset(EMAIL);

        guard.clearTracking(EMAIL);

        assertThat(guard.requestCount(EMAIL)).isZero();
        assertThat(guard.attemptCount(EMAIL)).isZero();
        assertThat(guard.isLockedOut(EMAIL)).isFalse();
        assertThat(guard.canAttemptReset(EMAIL).allowed()).isTrue();
    }

    @Test
    void resetLockoutDoesNotTouchOtpNamespace() {
        for (int i = 0; i < 5; i++) {
            guard.trackFailedResetAttempt(EMAIL);
        }
        guard.canAttemptReset(EMAIL);

        assertThat(store.get(ResetKeys.lockout("alice@example.com"))).isNotNull();
        assertThat(ResetKeys.LOCKOUT_PREFIX).isNotEqualTo(OtpKeys.LOCKOUT_PREFIX);
    }

    @Test
    void deniedDecisionConvertsToBusinessException() {
        for (int i = 0; i < 3; i++) {
            guard.trackRequest(EMAIL);
        }

        assertThatThrownBy(() -> guard.canRequestReset(EMAIL).orElseThrow())
                .isInstanceOfSatisfying(BusinessException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.RESET_REQUEST_LIMIT));
    }

    @Test
    void blankEmailIsRejectedEverywhere() {
        assertBadRequest(() -> guard.canRequestReset(""));
        assertBadRequest(() -> guard.trackRequest(null));
        assertBadRequest(() -> guard.canAttemptReset("   "));
        assertBadRequest(() -> guard.trackFailedResetAttempt(""));
        assertBadRequest(() -> guard.clearTracking(null));
    }

    private static void assertBadRequest(Runnable call) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(BusinessException.class,
                        ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.BAD_REQUEST));
    }
}
