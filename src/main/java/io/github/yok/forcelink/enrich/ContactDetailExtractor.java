package io.github.yok.forcelink.enrich;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Pattern-based extraction of phone numbers, e-mail addresses and street addresses from page
 * content.
 */
public final class ContactDetailExtractor {

    // North American numbers first, then a looser international form
    private static final List<Pattern> PHONE_PATTERNS = ImmutableList.of(
            Pattern.compile("\\+?1?\\s*\\(?[0-9]{3}\\)?[-.\\s]?[0-9]{3}[-.\\s]?[0-9]{4}"),
            Pattern.compile(
                    "\\+?[0-9]{1,4}[-.\\s]?[0-9]{2,4}[-.\\s]?[0-9]{2,4}[-.\\s]?[0-9]{2,4}"));

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");

    private static final Pattern STREET_PATTERN = Pattern.compile(
            "\\d+.*(?:street|st|avenue|ave|road|rd|boulevard|blvd)", Pattern.CASE_INSENSITIVE);

    private static final List<String> ADDRESS_CLASS_HINTS =
            ImmutableList.of("address", "location", "headquarters", "contact");

    private ContactDetailExtractor() {}

    /**
     * Collapses runs of whitespace and trims.
     *
     * @param text raw text, may be {@code null}
     * @return normalized text, never {@code null}
     */
    public static String cleanText(String text) {
        return StringUtils.normalizeSpace(StringUtils.defaultIfEmpty(text, ""));
    }

    /**
     * Finds the first phone number in a text.
     *
     * @param text page text
     * @return phone number, or an empty string
     */
    public static String extractPhone(String text) {
        for (Pattern pattern : PHONE_PATTERNS) {
            Matcher matcher = pattern.matcher(StringUtils.defaultIfEmpty(text, ""));
            if (matcher.find()) {
                return cleanText(matcher.group());
            }
        }
        return "";
    }

    /**
     * Finds the first e-mail address in a text, lower-cased.
     *
     * @param text page text
     * @return e-mail address, or an empty string
     */
    public static String extractEmail(String text) {
        Matcher matcher = EMAIL_PATTERN.matcher(StringUtils.defaultIfEmpty(text, ""));
        return matcher.find() ? matcher.group().toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Finds a street address in {@code div}, {@code p} or {@code span} elements whose class hints
     * at an address block.
     *
     * @param doc parsed page
     * @return address text, or an empty string
     */
    public static String extractAddress(Document doc) {
        for (String hint : ADDRESS_CLASS_HINTS) {
            for (Element element : doc.select("div[class], p[class], span[class]")) {
                if (!element.className().toLowerCase(Locale.ROOT).contains(hint)) {
                    continue;
                }
                String text = cleanText(element.text());
                if (STREET_PATTERN.matcher(text).find()) {
                    return text;
                }
            }
        }
        return "";
    }
}
