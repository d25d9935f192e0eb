package io.github.yok.forcelink.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal errors of a CLI run: full detail to the log, one concise line to
 * {@code System.err}.
 *
 * <p>
 * Messages pass through {@link MaskingLogUtil#maskBody(String)} before they are written, so a
 * session id echoed in a remote error never reaches the console. The JVM is not terminated here;
 * callers turn the returned code into the process exit status.
 * </p>
 *
 * <p>
 * In tests, callers can switch behavior to throwing an exception via thread-local flags.
 * </p>
 */
@Slf4j
public class ErrorHandler {

    /**
     * Process exit status for a run aborted by a fatal error.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Switch to "throw exception instead of reporting" for the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a fatal error with its cause.
     *
     * @param message what the run was doing
     * @param cause root cause
     * @return {@link #EXIT_FAILURE}
     */
    public static int errorAndExit(String message, Throwable cause) {
        String safeMessage = MaskingLogUtil.maskBody(message);
        log.error("{}\n{}", safeMessage,
                MaskingLogUtil.maskBody(ExceptionUtils.getStackTrace(cause)));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(safeMessage, cause);
        }
        System.err.println("ERROR: " + safeMessage + "\n"
                + MaskingLogUtil.maskBody(ExceptionUtils.getRootCauseMessage(cause)));
        return EXIT_FAILURE;
    }

    /**
     * Reports a fatal error without an exception, e.g. invalid command-line arguments.
     *
     * @param message message to report
     * @return {@link #EXIT_FAILURE}
     */
    public static int errorAndExit(String message) {
        String safeMessage = MaskingLogUtil.maskBody(message);
        log.error(safeMessage);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(safeMessage);
        }
        System.err.println("ERROR: " + safeMessage);
        return EXIT_FAILURE;
    }
}
