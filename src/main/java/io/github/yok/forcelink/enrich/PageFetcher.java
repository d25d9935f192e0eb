package io.github.yok.forcelink.enrich;

import java.net.URI;
import org.jsoup.nodes.Document;

/**
 * Fetches and parses one HTML page.
 */
public interface PageFetcher {

    /**
     * Fetches a page.
     *
     * @param uri page address
     * @return parsed document, with {@code uri} as its base URI
     * @throws io.github.yok.forcelink.exception.ScrapeException if the page cannot be fetched
     */
    Document fetch(URI uri);
}
