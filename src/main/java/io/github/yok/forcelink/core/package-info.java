/**
 * Core package for ForceLink.
 *
 * <p>
 * Contains the batch dispatcher and the three entry points built on it: CSV synchronization,
 * query export and single-record enrichment.
 * </p>
 */
package io.github.yok.forcelink.core;
