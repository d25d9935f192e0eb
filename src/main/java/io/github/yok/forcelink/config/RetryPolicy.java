package io.github.yok.forcelink.config;

import io.github.yok.forcelink.exception.ConfigException;
import java.time.Duration;
import lombok.Value;

/**
 * Immutable retry settings for transient failures.
 *
 * <p>
 * {@code maxAttempts} counts every submission of a record, the first one included. The delay
 * before attempt {@code n + 1} is {@code initialBackoff * multiplier^(n - 1)}.
 * </p>
 */
@Value
public class RetryPolicy {

    int maxAttempts;
    Duration initialBackoff;
    double multiplier;

    /**
     * Creates a policy.
     *
     * @param maxAttempts total attempts per record (at least 1)
     * @param initialBackoff delay before the first retry (not negative)
     * @param multiplier backoff growth factor (at least 1.0)
     * @throws ConfigException if a value is out of range
     */
    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new ConfigException("max-attempts must be at least 1 (was " + maxAttempts + ")");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new ConfigException("initial backoff must not be negative");
        }
        if (multiplier < 1.0d) {
            throw new ConfigException("backoff multiplier must be at least 1.0 (was "
                    + multiplier + ")");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
    }

    /**
     * Default policy: 3 attempts, 500 ms initial delay, doubling.
     *
     * @return default policy
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), 2.0d);
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration backoffAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis(Math.round(initialBackoff.toMillis() * factor));
    }
}
