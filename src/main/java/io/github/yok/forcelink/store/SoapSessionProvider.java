package io.github.yok.forcelink.store;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;
import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.config.SalesforceConfig;
import io.github.yok.forcelink.exception.AuthException;
import io.github.yok.forcelink.exception.TransportException;
import io.github.yok.forcelink.util.MaskingLogUtil;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * Username/password login through the partner SOAP endpoint.
 *
 * <p>
 * The password sent is the configured password followed by the security token. The session is
 * cached until {@code sessionSecondsValid} minus a one minute margin has passed.
 * </p>
 */
@Slf4j
public class SoapSessionProvider implements SessionProvider {

    private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(1);

    private static final String ENVELOPE = "<?xml version=\"1.0\" encoding=\"utf-8\" ?>"
            + "<env:Envelope xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\""
            + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\""
            + " xmlns:env=\"http://schemas.xmlsoap.org/soap/envelope/\">"
            + "<env:Body><n1:login xmlns:n1=\"urn:partner.soap.sforce.com\">"
            + "<n1:username>%s</n1:username><n1:password>%s</n1:password>"
            + "</n1:login></env:Body></env:Envelope>";

    private final SalesforceConfig salesforceConfig;
    private final ApiConfig apiConfig;
    private final HttpClient httpClient;
    private final Clock clock;

    private Session cached;

    public SoapSessionProvider(SalesforceConfig salesforceConfig, ApiConfig apiConfig,
            HttpClient httpClient) {
        this(salesforceConfig, apiConfig, httpClient, Clock.systemUTC());
    }

    @VisibleForTesting
    SoapSessionProvider(SalesforceConfig salesforceConfig, ApiConfig apiConfig,
            HttpClient httpClient, Clock clock) {
        this.salesforceConfig = salesforceConfig;
        this.apiConfig = apiConfig;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    @Override
    public synchronized Session acquire() {
        if (cached != null && !cached.isExpired(clock)) {
            return cached;
        }
        cached = login();
        return cached;
    }

    @Override
    public synchronized Session reauthenticate() {
        log.info("Re-authenticating user [{}]", salesforceConfig.getUsername());
        cached = null;
        cached = login();
        return cached;
    }

    /**
     * Returns the SOAP login endpoint for the configured domain and API version.
     *
     * @return login URI
     */
    URI loginUri() {
        String domain = StringUtils.defaultIfBlank(salesforceConfig.getDomain(), "login").trim();
        return URI.create("https://" + domain + ".salesforce.com/services/Soap/u/"
                + apiConfig.getVersion());
    }

    private Session login() {
        String username = salesforceConfig.getUsername();
        String password = salesforceConfig.getPassword();
        if (StringUtils.isBlank(username) || StringUtils.isBlank(password)) {
            throw new AuthException("Salesforce credentials are not configured. Set "
                    + "SALESFORCE_USERNAME, SALESFORCE_PASSWORD and SALESFORCE_SECURITY_TOKEN.");
        }
        Escaper escaper = XmlEscapers.xmlContentEscaper();
        String secret = password + Strings.nullToEmpty(salesforceConfig.getSecurityToken());
        String body = String.format(ENVELOPE, escaper.escape(username), escaper.escape(secret));

        URI uri = loginUri();
        log.info("Logging in to {} as [{}]", uri, username);
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(apiConfig.getTimeoutDuration())
                .header("Content-Type", "text/xml; charset=UTF-8").header("SOAPAction", "login")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransportException("Login request to " + uri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Login request to " + uri + " was interrupted", e);
        }
        return parseLoginResponse(response.statusCode(), response.body());
    }

    @VisibleForTesting
    Session parseLoginResponse(int status, String responseBody) {
        Document doc = Jsoup.parse(Strings.nullToEmpty(responseBody), "", Parser.xmlParser());
        Element fault = findElement(doc, "faultstring");
        if (fault != null) {
            throw new AuthException("Login failed: " + fault.text());
        }
        Element sessionId = findElement(doc, "sessionId");
        Element serverUrl = findElement(doc, "serverUrl");
        if (status != 200 || sessionId == null || serverUrl == null) {
            log.debug("Unexpected login response ({}): {}", status,
                    MaskingLogUtil.maskBody(responseBody));
            throw new AuthException("Login failed with HTTP status " + status);
        }
        URI server = URI.create(serverUrl.text().trim());
        String instanceUrl = server.getScheme() + "://" + server.getAuthority();
        Instant expiresAt = null;
        Element secondsValid = findElement(doc, "sessionSecondsValid");
        if (secondsValid != null && StringUtils.isNumeric(secondsValid.text().trim())) {
            expiresAt = clock.instant()
                    .plusSeconds(Long.parseLong(secondsValid.text().trim()))
                    .minus(EXPIRY_MARGIN);
        }
        Session session = new Session(sessionId.text().trim(), instanceUrl, expiresAt);
        log.info("Login succeeded: {}", session);
        return session;
    }

    // Matches both prefixed (sf:sessionId) and unprefixed element names
    private static Element findElement(Document doc, String localName) {
        for (Element element : doc.getAllElements()) {
            String name = element.tagName();
            int colon = name.indexOf(':');
            String local = colon >= 0 ? name.substring(colon + 1) : name;
            if (local.equalsIgnoreCase(localName)) {
                return element;
            }
        }
        return null;
    }
}
