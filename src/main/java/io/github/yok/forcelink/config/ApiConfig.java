package io.github.yok.forcelink.config;

import io.github.yok.forcelink.exception.ConfigException;
import io.github.yok.forcelink.model.Batch;
import java.time.Duration;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code api} section in {@code application.yml}.
 *
 * <pre>
 * api:
 *   version: '57.0'
 *   batch-size: 200
 *   timeout: 30
 *   max-attempts: 3
 *   initial-backoff-millis: 500
 *   backoff-multiplier: 2.0
 * </pre>
 */
@ConfigurationProperties(prefix = "api")
@Data
public class ApiConfig {

    /**
     * Remote API version used in every REST and SOAP path.
     */
    private String version = "57.0";

    /**
     * Default chunk size for bulk operations (1..200).
     */
    private int batchSize = Batch.MAX_SIZE_LIMIT;

    /**
     * Request timeout in seconds.
     */
    private int timeout = 30;

    /**
     * Maximum number of submissions of a record that keeps failing transiently.
     */
    private int maxAttempts = 3;

    /**
     * Delay before the first retry, in milliseconds.
     */
    private long initialBackoffMillis = 500L;

    /**
     * Factor applied to the delay after every retry.
     */
    private double backoffMultiplier = 2.0d;

    /**
     * Builds the immutable retry policy from these settings.
     *
     * @return retry policy
     * @throws ConfigException if a value is out of range
     */
    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMillis),
                backoffMultiplier);
    }

    /**
     * Returns the request timeout as a {@link Duration}.
     *
     * @return timeout
     * @throws ConfigException if the timeout is not positive
     */
    public Duration getTimeoutDuration() {
        if (timeout <= 0) {
            throw new ConfigException("api.timeout must be positive (was " + timeout + ")");
        }
        return Duration.ofSeconds(timeout);
    }

    /**
     * Validates the settings that every run depends on.
     *
     * @throws ConfigException if a value is invalid
     */
    public void validate() {
        if (StringUtils.isBlank(version)) {
            throw new ConfigException("api.version is not configured.");
        }
        Batch.validateSize(batchSize);
        getTimeoutDuration();
        toRetryPolicy();
    }
}
