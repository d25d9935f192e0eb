/**
 * Configuration model package for ForceLink.
 *
 * <p>
 * The {@code *Config} classes are bound from {@code application.yml} (or the environment) by
 * Spring Boot. They are converted once at start-up into immutable values
 * ({@link io.github.yok.forcelink.config.RetryPolicy},
 * {@link io.github.yok.forcelink.config.CsvSettings}) that are handed to components through their
 * constructors.
 * </p>
 */
package io.github.yok.forcelink.config;
