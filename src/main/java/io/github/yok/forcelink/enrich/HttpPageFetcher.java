package io.github.yok.forcelink.enrich;

import io.github.yok.forcelink.config.EnrichmentConfig;
import io.github.yok.forcelink.exception.ScrapeException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * {@link PageFetcher} on {@link HttpClient}, sending the configured User-Agent.
 */
@Slf4j
public class HttpPageFetcher implements PageFetcher {

    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpPageFetcher(EnrichmentConfig config) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.getTimeout()))
                .version(HttpClient.Version.HTTP_1_1).build(), config);
    }

    HttpPageFetcher(HttpClient client, EnrichmentConfig config) {
        this.client = client;
        this.userAgent = config.getUserAgent();
        this.timeout = Duration.ofSeconds(config.getTimeout());
    }

    @Override
    public Document fetch(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml")
                .header("Accept-Language", "en-US,en;q=0.8").GET().build();
        log.debug("GET {}", uri);
        HttpResponse<String> response;
        try {
            response = client.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ScrapeException("Failed to fetch " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeException("Interrupted while fetching " + uri, e);
        }
        if (response.statusCode() >= 400) {
            throw new ScrapeException("HTTP " + response.statusCode() + " from " + uri);
        }
        return Jsoup.parse(response.body(), response.uri().toString());
    }
}
