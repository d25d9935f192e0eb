/**
 * Failure taxonomy of ForceLink.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link io.github.yok.forcelink.exception.ForceLinkException}. Whether a failure aborts the run or
 * is isolated to a record is decided by the catching component, not by the exception itself.
 * </p>
 */
package io.github.yok.forcelink.exception;
