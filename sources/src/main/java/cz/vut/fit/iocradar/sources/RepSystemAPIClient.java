package cz.vut.fit.iocradar.sources;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * A client responsible for interacting with the remote reputation API.
 * This class abstracts the common logic for sending requests to an API and handling the responses. Every failure
 * (a disabled client, an HTTP error, rate limiting, a timeout, an I/O error or a malformed body) is logged and
 * results in an empty optional.
 */
public class RepSystemAPIClient implements AutoCloseable {
    private final ExecutorService _executor;
    private final String _token;
    private final Duration _httpTimeout;
    private final boolean _disabled;
    private HttpClient _client;

    public RepSystemAPIClient(@NotNull String token, @NotNull Duration timeout) {
        this._token = token;
        this._httpTimeout = timeout;
        this._disabled = this._token.isBlank() || this._token.equals("Bearer ");
        this._executor = Executors.newCachedThreadPool(runnable -> {
            var thread = new Thread(runnable, "rep-system-http");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates the HTTP client used to send requests.
     *
     * @return The HttpClient instance.
     */
    protected HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(_httpTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(_executor)
                .build();
    }

    /**
     * Checks if the client is disabled based on the authentication token
     *
     * @return True if the client is disabled (token is blank or equals to "Bearer "), otherwise false
     */
    public boolean isDisabled() {
        return _disabled;
    }

    /**
     * Gets the HTTP client used to send requests, creating it on the first call.
     *
     * @return The HttpClient instance used for HTTP requests.
     */
    public synchronized HttpClient getClient() {
        if (_client == null) {
            _client = buildHttpClient();
        }
        return _client;
    }

    public Duration getHttpTimeout() {
        return _httpTimeout;
    }

    /**
     * Executes an asynchronous GET request to a remote API and maps the response.
     *
     * @param url            The request URL, or null if the input is not supported by the API.
     * @param authHeaderName The name of the authorization header (or null if no auth is needed).
     * @param responseMapper A function that maps the JSON response body to the desired data type.
     * @param logger         A logger instance for logging errors and debug information.
     * @param sourceName     The name of the source, used in log messages.
     * @param <TData>        The data type that the response is mapped to.
     * @return A future completed with the mapped data, or with an empty optional on any failure.
     */
    public <TData> CompletableFuture<Optional<TData>> execute(
            @Nullable String url,
            @Nullable String authHeaderName,
            @NotNull Function<JSONObject, TData> responseMapper,
            @NotNull Logger logger,
            @NotNull String sourceName
    ) {
        if (_disabled) {
            logger.trace("{} is disabled", sourceName);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        if (url == null) {
            logger.debug("Discarding unsupported indicator");
            return CompletableFuture.completedFuture(Optional.empty());
        }

        var requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(_httpTimeout)
                .header("Accept", "application/json")
                .GET();

        if (authHeaderName != null) {
            requestBuilder.header(authHeaderName, _token);
        }

        var request = requestBuilder.build();
        // Add a bit of a buffer to make the absolute processing timeout
        final var processingTimeoutMs = (long) (_httpTimeout.toMillis() * 1.2);

        return getClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(processingTimeoutMs, TimeUnit.MILLISECONDS)
                .thenApply(response -> {
                    if (response.statusCode() == 200) {
                        try {
                            return Optional.ofNullable(responseMapper.apply(new JSONObject(response.body())));
                        } catch (JSONException e) {
                            logger.warn("{} returned an unexpected body: {}", sourceName, e.getMessage());
                            return Optional.<TData>empty();
                        }
                    } else if (response.statusCode() == 404) {
                        logger.debug("{} has no data (404)", sourceName);
                    } else if (response.statusCode() == 429) {
                        logger.warn("{} is rate limited", sourceName);
                    } else {
                        logger.warn("{} response {}", sourceName, response.statusCode());
                    }
                    return Optional.<TData>empty();
                })
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof HttpConnectTimeoutException || cause instanceof HttpTimeoutException
                            || cause instanceof TimeoutException) {
                        logger.debug("{} timed out ({} ms)", sourceName, _httpTimeout.toMillis());
                    } else if (cause instanceof IOException) {
                        logger.debug("{} I/O exception: {}", sourceName, cause.getMessage());
                    } else {
                        logger.warn("{} unexpected error", sourceName, cause);
                    }
                    return Optional.empty();
                });
    }

    @Override
    public void close() {
        _executor.shutdownNow();
    }
}
