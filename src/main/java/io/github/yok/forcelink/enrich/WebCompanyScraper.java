package io.github.yok.forcelink.enrich;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import io.github.yok.forcelink.config.EnrichmentConfig;
import io.github.yok.forcelink.exception.ScrapeException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Finds a company's web site through a search page and harvests its contact details.
 *
 * <p>
 * A search key that already looks like a domain is fetched directly. Otherwise the search results
 * are reduced to one candidate site per host, excluding search engines and social sites. Exactly
 * one candidate whose host matches the key is required; when no host matches, a sole candidate is
 * accepted. Anything else is ambiguous and raises {@link ScrapeException}.
 * </p>
 */
@Slf4j
public class WebCompanyScraper implements CompanyScraper {

    private static final Set<String> EXCLUDED_HOSTS =
            ImmutableSet.of("google.", "youtube.com", "facebook.com");

    // Legal-form words ignored when matching a company name against a host
    private static final Set<String> NAME_NOISE = ImmutableSet.of("the", "inc", "incorporated",
            "corp", "corporation", "co", "company", "llc", "ltd", "limited", "group", "plc",
            "gmbh");

    private final EnrichmentConfig config;
    private final PageFetcher fetcher;

    public WebCompanyScraper(EnrichmentConfig config) {
        this(config, new HttpPageFetcher(config));
    }

    @VisibleForTesting
    WebCompanyScraper(EnrichmentConfig config, PageFetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
    }

    @Override
    public CompanyProfile scrape(String searchKey) {
        if (StringUtils.isBlank(searchKey)) {
            throw new ScrapeException("No search key available for the record.");
        }
        String key = searchKey.trim();
        URI site = looksLikeDomain(key) ? URI.create("https://" + key) : findCompanySite(key);
        log.info("Scraping contact details from {}", site);
        Document page = fetcher.fetch(site);
        String text = page.text();
        CompanyProfile profile = CompanyProfile.builder()
                .phone(ContactDetailExtractor.extractPhone(text))
                .email(ContactDetailExtractor.extractEmail(text))
                .address(ContactDetailExtractor.extractAddress(page))
                .website(site.getScheme() + "://" + site.getHost()).build();
        if (profile.hasNoContactDetails()) {
            throw new ScrapeException("No contact details found on " + site);
        }
        return profile;
    }

    private URI findCompanySite(String key) {
        String query = URLEncoder.encode(key + " company contact", StandardCharsets.UTF_8);
        URI searchUri = URI.create(config.getSearchUrlTemplate().replace("{query}", query));
        Document results = fetcher.fetch(searchUri);
        Map<String, URI> candidates = candidateSites(results, searchUri.getHost());
        if (candidates.isEmpty()) {
            throw new ScrapeException("Could not find a company web site for '" + key + "'");
        }
        String normalizedKey = normalizeName(key);
        List<URI> matching = candidates.entrySet().stream()
                .filter(entry -> hostMatches(entry.getKey(), normalizedKey))
                .map(Map.Entry::getValue).collect(Collectors.toList());
        if (matching.size() == 1) {
            return matching.get(0);
        }
        if (matching.isEmpty() && candidates.size() == 1) {
            return candidates.values().iterator().next();
        }
        throw new ScrapeException("Ambiguous search results for '" + key + "': "
                + (matching.isEmpty() ? candidates.keySet() : matching));
    }

    /**
     * Collects result links, one per host, in page order.
     *
     * @param results search result page
     * @param searchHost host of the search engine, excluded from the results
     * @return host -> site address
     */
    @VisibleForTesting
    Map<String, URI> candidateSites(Document results, String searchHost) {
        Map<String, URI> sites = new LinkedHashMap<>();
        for (Element link : results.select("a[href]")) {
            URI target = resolveTarget(link);
            if (target == null || target.getHost() == null) {
                continue;
            }
            String host = target.getHost().toLowerCase(Locale.ROOT);
            if (host.equals(searchHost) || isExcluded(host)) {
                continue;
            }
            sites.putIfAbsent(host, target);
            if (sites.size() >= config.getMaxCandidates()) {
                break;
            }
        }
        return sites;
    }

    // Search engines wrap result links as /url?q=<target>&...
    private static URI resolveTarget(Element link) {
        String href = link.attr("href");
        String target;
        int redirect = href.indexOf("url?q=");
        if (redirect >= 0) {
            target = URLDecoder.decode(
                    StringUtils.substringBefore(href.substring(redirect + 6), "&"),
                    StandardCharsets.UTF_8);
        } else {
            target = link.attr("abs:href");
        }
        if (!StringUtils.startsWithAny(target, "http://", "https://")) {
            return null;
        }
        try {
            return URI.create(target);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed link {}", target);
            return null;
        }
    }

    private static boolean isExcluded(String host) {
        return EXCLUDED_HOSTS.stream().anyMatch(host::contains);
    }

    @VisibleForTesting
    static boolean looksLikeDomain(String key) {
        return !key.contains(" ") && key.contains(".") && !key.contains("@")
                && !key.startsWith(".") && !key.endsWith(".");
    }

    @VisibleForTesting
    static String normalizeName(String name) {
        return Arrays.stream(name.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> !token.isEmpty() && !NAME_NOISE.contains(token))
                .collect(Collectors.joining());
    }

    @VisibleForTesting
    static boolean hostMatches(String host, String normalizedKey) {
        if (normalizedKey.isEmpty()) {
            return false;
        }
        String label = StringUtils.removeStart(host, "www.");
        label = StringUtils.substringBefore(label, ".").replaceAll("[^a-z0-9]", "");
        return label.length() >= 3
                && (label.contains(normalizedKey) || normalizedKey.contains(label));
    }
}
