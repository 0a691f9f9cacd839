package com.shipyard.orchestrator.recovery;

import com.shipyard.orchestrator.config.RecoveryProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for RETRY attempts.
 *
 * <pre>
 * delay  = min(base * 2^retryCount + jitter, max)
 * jitter = random(0, base * 2^retryCount * jitterFactor)
 * </pre>
 *
 * retryCount starts at 0, so the first retry waits roughly {@code base}.
 */
public class BackoffCalculator {

    private final long baseMs;
    private final long maxMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffCalculator(RecoveryProperties properties) {
        this(properties.getBaseBackoff(), properties.getMaxBackoff(), properties.getJitterFactor(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffCalculator(Duration base, Duration max, double jitterFactor, DoubleSupplier random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base backoff must be positive (was " + base + ")");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max backoff must be >= base (base " + base + ", max " + max + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (was " + jitterFactor + ")");
        }
        this.baseMs       = base.toMillis();
        this.maxMs        = max.toMillis();
        this.jitterFactor = jitterFactor;
        this.random       = random;
    }

    public Duration delayFor(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative (was " + retryCount + ")");
        }
        // Shifts past 62 overflow; anything that large is capped anyway.
        long exponential = retryCount >= 62 || baseMs > (maxMs >> retryCount)
                ? maxMs
                : Math.min(baseMs << retryCount, maxMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxMs));
    }
}
