package io.github.yok.forcelink.config;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code enrichment} section in {@code application.yml}.
 *
 * <pre>
 * enrichment:
 *   fields:
 *     Account:
 *       - Phone
 *       - Website
 *   search-url-template: 'https://www.google.com/search?q={query}'
 * </pre>
 *
 * <p>
 * Object types missing from {@code fields} fall back to the built-in allow-lists for
 * {@code Account}, {@code Contact} and {@code Lead}.
 * </p>
 */
@ConfigurationProperties(prefix = "enrichment")
@Data
public class EnrichmentConfig {

    /**
     * Built-in allow-lists used when an object type is not configured.
     */
    public static final Map<String, List<String>> DEFAULT_FIELDS = ImmutableMap.of("Account",
            List.of("Phone", "Website", "BillingStreet", "BillingCity", "BillingState",
                    "BillingPostalCode", "BillingCountry"),
            "Contact",
            List.of("Phone", "Email", "MailingStreet", "MailingCity", "MailingState",
                    "MailingPostalCode", "MailingCountry"),
            "Lead", List.of("Phone", "Email", "Street", "City", "State", "PostalCode", "Country"));

    // object type -> fields enrichment may update
    private Map<String, List<String>> fields = new LinkedHashMap<>();

    // {query} is replaced by the URL-encoded search phrase
    private String searchUrlTemplate = "https://www.google.com/search?q={query}";

    private String userAgent =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    // Seconds per scraper HTTP request
    private int timeout = 10;

    // Search results inspected when looking for the company site
    private int maxCandidates = 5;

    /**
     * Returns the allow-list of an object type. Lookup is exact first, then case-insensitive, then
     * falls back to {@link #DEFAULT_FIELDS}.
     *
     * @param objectType object type name
     * @return ordered allow-list; empty if the type is unknown
     */
    public Set<String> allowedFieldsFor(String objectType) {
        List<String> configured = findByObjectType(fields, objectType);
        if (configured == null) {
            configured = findByObjectType(DEFAULT_FIELDS, objectType);
        }
        if (configured == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(configured));
    }

    private static List<String> findByObjectType(Map<String, List<String>> source,
            String objectType) {
        if (source == null || objectType == null) {
            return null;
        }
        List<String> found = source.get(objectType);
        if (found != null) {
            return found;
        }
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(objectType)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
