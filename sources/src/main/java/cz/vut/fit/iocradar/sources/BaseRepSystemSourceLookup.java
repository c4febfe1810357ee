package cz.vut.fit.iocradar.sources;

import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.models.IndicatorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

/**
 * An abstract base class for sources that query a remote reputation system API.
 * The subclass supplies the request URL, the authentication header and the mapping of the response; this class
 * takes care of the request itself and of turning the mapped data into a {@link SourceReport}.
 *
 * @param <TData> The type of the data the API response is mapped to.
 */
public abstract class BaseRepSystemSourceLookup<TData> implements SourceLookup {
    protected final RepSystemAPIClient _client;

    protected BaseRepSystemSourceLookup(@NotNull Properties properties, @NotNull String tokenConfig,
                                        @NotNull String tokenDefault, @NotNull String timeoutConfig,
                                        @NotNull String timeoutDefault) {
        this(new RepSystemAPIClient(properties.getProperty(tokenConfig, tokenDefault).trim(),
                Common.secondsProperty(properties, timeoutConfig, timeoutDefault)));
    }

    protected BaseRepSystemSourceLookup(@NotNull RepSystemAPIClient client) {
        _client = client;
    }

    /**
     * Returns the logger used by the concrete source.
     */
    protected abstract Logger getLogger();

    /**
     * Returns the URL to query for an indicator.
     *
     * @param value The indicator value.
     * @param kind  The indicator kind.
     * @return The URL, or null if the API cannot be asked about the indicator.
     */
    protected abstract @Nullable String getRequestUrl(@NotNull String value, @NotNull IndicatorKind kind);

    /**
     * Returns the name of the HTTP header that carries the access token.
     */
    protected abstract String getAuthTokenHeaderName();

    /**
     * Maps the JSON response body to the source's data record.
     *
     * @param jsonResponse The parsed response body.
     * @return The mapped data.
     */
    protected abstract TData mapResponseToData(JSONObject jsonResponse);

    /**
     * Converts the mapped data to a report with a raw score in the source's own representation.
     *
     * @param data The mapped data.
     * @return The report.
     */
    protected abstract SourceReport toReport(TData data);

    /**
     * Returns the indicator kinds the API can be asked about.
     *
     * @param kind The kind to check.
     * @return True if the kind is supported by the API.
     */
    protected abstract boolean supportsKind(@NotNull IndicatorKind kind);

    @Override
    public boolean supports(@NotNull IndicatorKind kind) {
        return !_client.isDisabled() && supportsKind(kind);
    }

    @Override
    public @NotNull CompletableFuture<Optional<SourceReport>> lookup(@NotNull String value,
                                                                    @NotNull IndicatorKind kind) {
        if (!supportsKind(kind)) {
            getLogger().trace("Kind {} not supported: {}", kind, value);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return _client.execute(getRequestUrl(value, kind), getAuthTokenHeaderName(), this::mapResponseToData,
                        getLogger(), getName())
                .thenApply(data -> data.map(this::toReport));
    }

    /**
     * Puts a value into a details map if it is not null.
     */
    protected static void putDetail(Map<String, Object> details, String key, @Nullable Object value) {
        if (value != null)
            details.put(key, value);
    }

    protected static Map<String, Object> newDetails() {
        return new HashMap<>();
    }

    @Override
    public void close() {
        _client.close();
    }
}
