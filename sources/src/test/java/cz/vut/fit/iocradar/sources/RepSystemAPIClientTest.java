package cz.vut.fit.iocradar.sources;

import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RepSystemAPIClientTest {

    private HttpClient mockHttpClient;
    private HttpResponse<Object> mockResponse;
    private RepSystemAPIClient client;
    private final Logger dummyLogger = LoggerFactory.getLogger("test");

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        mockHttpClient = mock(HttpClient.class);
        mockResponse = mock(HttpResponse.class);
        client = clientWithToken("secret");
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private RepSystemAPIClient clientWithToken(String token) {
        return new RepSystemAPIClient(token, Duration.ofSeconds(1)) {
            @Override
            protected HttpClient buildHttpClient() {
                return mockHttpClient;
            }
        };
    }

    private void respond(int status, String body) {
        when(mockResponse.statusCode()).thenReturn(status);
        when(mockResponse.body()).thenReturn(body);
        when(mockHttpClient.sendAsync(any(), any())).thenReturn(CompletableFuture.completedFuture(mockResponse));
    }

    private Optional<Integer> executeForValue() throws Exception {
        return client.execute("https://api.example.test/check?x=1", "Key",
                json -> json.getInt("value"), dummyLogger, "test-source").get(1, TimeUnit.SECONDS);
    }

    @Test
    void execute_200MapsBodyAndSendsAuthHeader() throws Exception {
        respond(200, "{\"value\": 42}");

        assertEquals(Optional.of(42), executeForValue());

        ArgumentCaptor<HttpRequest> cap = ArgumentCaptor.forClass(HttpRequest.class);
        verify(mockHttpClient).sendAsync(cap.capture(), any());
        assertEquals(URI.create("https://api.example.test/check?x=1"), cap.getValue().uri());
        assertEquals("secret", cap.getValue().headers().firstValue("Key").orElse(""));
        assertEquals("application/json", cap.getValue().headers().firstValue("Accept").orElse(""));
    }

    @Test
    void execute_rateLimitedIsEmpty() throws Exception {
        respond(429, "");
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_notFoundIsEmpty() throws Exception {
        respond(404, "{}");
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_serverErrorIsEmpty() throws Exception {
        respond(503, "unavailable");
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_malformedBodyIsEmpty() throws Exception {
        respond(200, "<html>not json</html>");
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_missingFieldIsEmpty() throws Exception {
        respond(200, "{\"other\": 1}");
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_ioErrorIsEmpty() throws Exception {
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));
        assertTrue(executeForValue().isEmpty());
    }

    @Test
    void execute_nullUrlSkipsRequest() throws Exception {
        var result = client.execute(null, "Key", (JSONObject json) -> 1, dummyLogger, "test-source")
                .get(1, TimeUnit.SECONDS);

        assertTrue(result.isEmpty());
        verifyNoInteractions(mockHttpClient);
    }

    @Test
    void execute_blankTokenDisablesClient() throws Exception {
        client.close();
        client = clientWithToken(" ");

        assertTrue(client.isDisabled());
        assertTrue(executeForValue().isEmpty());
        verifyNoInteractions(mockHttpClient);
    }
}
