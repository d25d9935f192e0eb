/**
 * Per-run output files for failed and, optionally, successful records.
 */
package io.github.yok.forcelink.sink;
