package io.github.yok.forcelink.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.forcelink.config.EnrichmentConfig;
import io.github.yok.forcelink.exception.ScrapeException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class HttpPageFetcherTest {

    private static final URI PAGE = URI.create("https://acme.com/contact");

    private HttpClient client;
    private HttpPageFetcher fetcher;

    @BeforeEach
    void setUp() {
        client = mock(HttpClient.class);
        EnrichmentConfig config = new EnrichmentConfig();
        config.setUserAgent("forcelink-test/1.0");
        fetcher = new HttpPageFetcher(client, config);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(response.uri()).thenReturn(PAGE);
        doReturn(response).when(client).send(any(HttpRequest.class), any());
    }

    @Test
    void fetch_正常ケース_本文が解析され相対リンクが解決できること() throws Exception {
        respond(200, "<html><body><a href=\"/about\">About</a></body></html>");

        Document doc = fetcher.fetch(PAGE);

        assertEquals("https://acme.com/about", doc.selectFirst("a").attr("abs:href"));
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        assertEquals("forcelink-test/1.0",
                captor.getValue().headers().firstValue("User-Agent").orElse(null));
    }

    @Test
    void fetch_異常ケース_404応答_ScrapeExceptionが送出されること() throws Exception {
        respond(404, "not found");

        assertThrows(ScrapeException.class, () -> fetcher.fetch(PAGE));
    }

    @Test
    void fetch_異常ケース_通信エラー_ScrapeExceptionが送出されること() throws Exception {
        doThrow(new IOException("refused")).when(client).send(any(HttpRequest.class), any());

        assertThrows(ScrapeException.class, () -> fetcher.fetch(PAGE));
    }
}
