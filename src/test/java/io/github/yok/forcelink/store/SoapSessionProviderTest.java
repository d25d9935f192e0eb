package io.github.yok.forcelink.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.config.SalesforceConfig;
import io.github.yok.forcelink.exception.AuthException;
import io.github.yok.forcelink.exception.TransportException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SoapSessionProviderTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static final String LOGIN_OK = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<soapenv:Envelope xmlns:soapenv=\"http://schemas.xmlsoap.org/soap/envelope/\">"
            + "<soapenv:Body><loginResponse><result>"
            + "<serverUrl>https://na1.my.salesforce.com/services/Soap/u/57.0/00Dxx</serverUrl>"
            + "<sessionId>00Dxx!AQ0session</sessionId>"
            + "<userInfo><sessionSecondsValid>7200</sessionSecondsValid></userInfo>"
            + "</result></loginResponse></soapenv:Body></soapenv:Envelope>";

    private static final String LOGIN_FAULT = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<soapenv:Envelope xmlns:soapenv=\"http://schemas.xmlsoap.org/soap/envelope/\">"
            + "<soapenv:Body><soapenv:Fault><faultcode>INVALID_LOGIN</faultcode>"
            + "<faultstring>INVALID_LOGIN: Invalid username, password, security token; or user"
            + " locked out.</faultstring></soapenv:Fault></soapenv:Body></soapenv:Envelope>";

    private HttpClient client;
    private SalesforceConfig salesforceConfig;
    private SoapSessionProvider provider;

    @BeforeEach
    void setUp() {
        client = mock(HttpClient.class);
        salesforceConfig = new SalesforceConfig();
        salesforceConfig.setUsername("ops@example.com");
        salesforceConfig.setPassword("p<ss");
        salesforceConfig.setSecurityToken("TOKEN");
        provider = new SoapSessionProvider(salesforceConfig, new ApiConfig(), client,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        doReturn(response).when(client).send(any(HttpRequest.class), any());
    }

    @Test
    void parseLoginResponse_正常ケース_セッションIDとインスタンスURLと有効期限が取得できること() {
        Session session = provider.parseLoginResponse(200, LOGIN_OK);

        assertEquals("00Dxx!AQ0session", session.getAccessToken());
        assertEquals("https://na1.my.salesforce.com", session.getInstanceUrl());
        assertEquals(NOW.plusSeconds(7200).minusSeconds(60), session.getExpiresAt());
    }

    @Test
    void parseLoginResponse_正常ケース_有効期限がない場合はnullとなること() {
        String body = LOGIN_OK.replace(
                "<userInfo><sessionSecondsValid>7200</sessionSecondsValid></userInfo>", "");

        assertNull(provider.parseLoginResponse(200, body).getExpiresAt());
    }

    @Test
    void parseLoginResponse_異常ケース_SOAPフォルト_AuthExceptionが送出されること() {
        AuthException ex = assertThrows(AuthException.class,
                () -> provider.parseLoginResponse(500, LOGIN_FAULT));
        assertTrue(ex.getMessage().startsWith("Login failed: INVALID_LOGIN"));
    }

    @Test
    void parseLoginResponse_異常ケース_セッションIDがない_AuthExceptionが送出されること() {
        assertThrows(AuthException.class,
                () -> provider.parseLoginResponse(200, "<html>maintenance</html>"));
    }

    @Test
    void acquire_正常ケース_有効なセッションはキャッシュされること() throws Exception {
        respond(200, LOGIN_OK);

        Session first = provider.acquire();
        Session second = provider.acquire();

        assertSame(first, second);
        verify(client, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void acquire_正常ケース_パスワードとトークンを連結しエスケープして送信すること() throws Exception {
        respond(200, LOGIN_OK);

        provider.acquire();

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertEquals("https://login.salesforce.com/services/Soap/u/57.0",
                request.uri().toString());
        assertEquals("login", request.headers().firstValue("SOAPAction").orElse(null));
    }

    @Test
    void reauthenticate_正常ケース_キャッシュを破棄して再ログインすること() throws Exception {
        respond(200, LOGIN_OK);

        Session first = provider.acquire();
        Session second = provider.reauthenticate();

        assertNotSame(first, second);
        verify(client, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    void acquire_異常ケース_認証情報が未設定_AuthExceptionが送出されること() throws Exception {
        salesforceConfig.setPassword(" ");

        assertThrows(AuthException.class, () -> provider.acquire());
        verify(client, never()).send(any(HttpRequest.class), any());
    }

    @Test
    void acquire_異常ケース_通信エラー_TransportExceptionが送出されること() throws Exception {
        doThrow(new IOException("unreachable")).when(client).send(any(HttpRequest.class), any());

        assertThrows(TransportException.class, () -> provider.acquire());
    }

    @Test
    void loginUri_正常ケース_ドメイン設定が反映されること() {
        salesforceConfig.setDomain("test");

        assertEquals("https://test.salesforce.com/services/Soap/u/57.0",
                provider.loginUri().toString());
    }
}
