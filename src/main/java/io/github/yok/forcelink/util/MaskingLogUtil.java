package io.github.yok.forcelink.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Utility for masking sensitive values before they reach the log.
 *
 * <p>
 * Hides passwords, security tokens and session ids while keeping enough detail (user name, a token
 * prefix) for troubleshooting.
 * </p>
 */
public final class MaskingLogUtil {

    /**
     * Pattern that matches a session id inside a SOAP envelope or an authorization header.
     */
    private static final Pattern SESSION_PATTERN = Pattern.compile(
            "(<sessionId>|Bearer\\s+)([^<\\s]+)", Pattern.CASE_INSENSITIVE);

    /**
     * Pattern that matches a password element of a SOAP login envelope.
     */
    private static final Pattern PASSWORD_ELEMENT_PATTERN =
            Pattern.compile("(<(?:\\w+:)?password>)([^<]*)(</)", Pattern.CASE_INSENSITIVE);

    // Number of leading characters kept visible by maskToken
    private static final int VISIBLE_PREFIX = 4;

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks a session token, keeping a short prefix.
     *
     * @param token raw token
     * @return masked token, or {@code null} when input is {@code null}
     */
    public static String maskToken(String token) {
        if (token == null) {
            return null;
        }
        if (token.length() <= VISIBLE_PREFIX * 2) {
            return maskText(token);
        }
        return token.substring(0, VISIBLE_PREFIX) + "***";
    }

    /**
     * Masks session ids and passwords embedded in a request or response body.
     *
     * @param body raw body
     * @return masked body, or {@code null} when input is {@code null}
     */
    public static String maskBody(String body) {
        if (body == null) {
            return null;
        }
        String masked = body;
        Matcher sessionMatcher = SESSION_PATTERN.matcher(masked);
        if (sessionMatcher.find()) {
            masked = sessionMatcher.replaceAll("$1***");
        }
        Matcher passwordMatcher = PASSWORD_ELEMENT_PATTERN.matcher(masked);
        if (passwordMatcher.find()) {
            masked = passwordMatcher.replaceAll("$1***$3");
        }
        return masked;
    }
}
