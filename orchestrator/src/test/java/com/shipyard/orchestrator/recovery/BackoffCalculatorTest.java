package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.config.RecoveryProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    static final Duration BASE = Duration.ofSeconds(2);
    static final Duration MAX  = Duration.ofMinutes(1);

    // ------------------------------------------------------------------
    // delayFor()
    // ------------------------------------------------------------------

    @Test
    void delayFor_noJitter_doublesPerRetry() {
        BackoffCalculator backoff = new BackoffCalculator(BASE, MAX, 0.5, () -> 0.0);

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void delayFor_fullJitter_addsFactorOfExponential() {
        BackoffCalculator backoff = new BackoffCalculator(BASE, MAX, 0.5, () -> 1.0);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void delayFor_cappedAtMax() {
        BackoffCalculator backoff = new BackoffCalculator(BASE, MAX, 0.5, () -> 1.0);

        assertThat(backoff.delayFor(5)).isEqualTo(MAX);
        assertThat(backoff.delayFor(40)).isEqualTo(MAX);
        assertThat(backoff.delayFor(Integer.MAX_VALUE)).isEqualTo(MAX);
    }

    @Test
    void delayFor_neverDecreases() {
        BackoffCalculator backoff = new BackoffCalculator(BASE, MAX, 0.0, () -> 0.7);

        Duration previous = Duration.ZERO;
        for (int i = 0; i < 70; i++) {
            Duration d = backoff.delayFor(i);
            assertThat(d).isGreaterThanOrEqualTo(previous);
            previous = d;
        }
    }

    @Test
    void delayFor_negativeRetryCount_rejected() {
        BackoffCalculator backoff = new BackoffCalculator(new RecoveryProperties());

        assertThatThrownBy(() -> backoff.delayFor(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    @Test
    void constructor_invalidSettings_rejected() {
        assertThatThrownBy(() -> new BackoffCalculator(Duration.ZERO, MAX, 0.1, () -> 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(MAX, BASE, 0.1, () -> 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(BASE, MAX, 1.5, () -> 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
