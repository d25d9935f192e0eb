package io.github.yok.forcelink.store;

import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.config.SalesforceConfig;
import java.net.http.HttpClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory that wires the REST store and the SOAP login against one shared {@link HttpClient}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObjectStoreFactory {

    // Version, timeout
    private final ApiConfig apiConfig;

    // Credentials and login domain
    private final SalesforceConfig salesforceConfig;

    private HttpClient httpClient;

    /**
     * Creates the session provider.
     *
     * @return SOAP login provider
     */
    public SessionProvider createSessionProvider() {
        log.debug("Creating session provider: {}", salesforceConfig);
        return new SoapSessionProvider(salesforceConfig, apiConfig, httpClient());
    }

    /**
     * Creates the object store.
     *
     * @return REST object store
     */
    public RemoteObjectStore createObjectStore() {
        return new RestObjectStore(apiConfig, httpClient());
    }

    private synchronized HttpClient httpClient() {
        if (httpClient == null) {
            httpClient = HttpClient.newBuilder().connectTimeout(apiConfig.getTimeoutDuration())
                    .followRedirects(HttpClient.Redirect.NORMAL).build();
        }
        return httpClient;
    }
}
