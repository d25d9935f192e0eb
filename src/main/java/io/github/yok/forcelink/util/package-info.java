/**
 * Utility package for ForceLink.
 *
 * <p>
 * Provides reusable helpers used across the project: CSV reading/writing, fatal error reporting,
 * log masking and per-run file naming.
 * </p>
 */
package io.github.yok.forcelink.util;
