package io.github.yok.forcelink.store;

import io.github.yok.forcelink.util.MaskingLogUtil;
import java.time.Clock;
import java.time.Instant;
import lombok.Value;

/**
 * Authenticated session against the remote object store.
 */
@Value
public class Session {

    String accessToken;

    // Scheme and host, e.g. https://na1.my.salesforce.com
    String instanceUrl;

    // null when the store did not report a lifetime
    Instant expiresAt;

    /**
     * Returns whether the session is past its reported lifetime.
     *
     * @param clock clock to compare against
     * @return {@code true} if expired
     */
    public boolean isExpired(Clock clock) {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Session(accessToken=" + MaskingLogUtil.maskToken(accessToken) + ", instanceUrl="
                + instanceUrl + ", expiresAt=" + expiresAt + ")";
    }
}
