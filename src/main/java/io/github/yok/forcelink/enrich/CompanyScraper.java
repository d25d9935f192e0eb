package io.github.yok.forcelink.enrich;

/**
 * External source of company contact details.
 */
public interface CompanyScraper {

    /**
     * Looks up a company.
     *
     * @param searchKey company name or domain
     * @return harvested profile, never empty
     * @throws io.github.yok.forcelink.exception.ScrapeException if the lookup fails, is ambiguous
     *         or yields no contact details
     */
    CompanyProfile scrape(String searchKey);
}
