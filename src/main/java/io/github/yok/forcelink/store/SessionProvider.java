package io.github.yok.forcelink.store;

/**
 * Supplies sessions for remote calls.
 */
public interface SessionProvider {

    /**
     * Returns a usable session, logging in only when no valid session is cached.
     *
     * @return session
     * @throws io.github.yok.forcelink.exception.AuthException if credentials are missing or
     *         rejected
     */
    Session acquire();

    /**
     * Discards any cached session and logs in again.
     *
     * @return fresh session
     * @throws io.github.yok.forcelink.exception.AuthException if credentials are rejected
     */
    Session reauthenticate();
}
