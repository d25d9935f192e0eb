package io.github.yok.forcelink.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials for the session provider, bound from the {@code salesforce} prefix.
 *
 * <p>
 * Through relaxed binding the values are normally supplied by the environment variables
 * {@code SALESFORCE_USERNAME}, {@code SALESFORCE_PASSWORD}, {@code SALESFORCE_SECURITY_TOKEN} and
 * {@code SALESFORCE_DOMAIN}. Only {@link io.github.yok.forcelink.store.SoapSessionProvider} reads
 * them.
 * </p>
 */
@ConfigurationProperties(prefix = "salesforce")
@Data
public class SalesforceConfig {

    private String username;

    private String password;

    // Appended to the password at login
    private String securityToken;

    // "login" for production, "test" for sandboxes
    private String domain = "login";

    @Override
    public String toString() {
        return "SalesforceConfig(username=" + username + ", domain=" + domain + ")";
    }
}
