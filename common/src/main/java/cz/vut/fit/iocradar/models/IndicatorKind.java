package cz.vut.fit.iocradar.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The kind of observable an indicator of compromise represents.
 */
public enum IndicatorKind {
    IP("ip"),
    DOMAIN("domain"),
    HASH("hash"),
    URL("url");

    // MD5, SHA-1 or SHA-256 in hexadecimal
    private static final Pattern HASH_PATTERN = Pattern.compile("^(?:[0-9a-fA-F]{32}|[0-9a-fA-F]{40}|[0-9a-fA-F]{64})$");

    private final String _id;

    IndicatorKind(String id) {
        _id = id;
    }

    @JsonValue
    public String id() {
        return _id;
    }

    @JsonCreator
    public static IndicatorKind fromId(String id) {
        for (var value : values()) {
            if (value._id.equalsIgnoreCase(id))
                return value;
        }
        throw new IllegalArgumentException("Unknown indicator kind: " + id);
    }

    /**
     * Checks whether a raw indicator value is well-formed for this kind.
     *
     * @param value The raw indicator value.
     * @return True if the value can be an indicator of this kind.
     */
    public boolean accepts(@NotNull String value) {
        return switch (this) {
            case IP -> InetAddresses.isInetAddress(value);
            case DOMAIN -> !InetAddresses.isInetAddress(value) && InternetDomainName.isValid(value);
            case HASH -> HASH_PATTERN.matcher(value).matches();
            case URL -> isAbsoluteUrl(value);
        };
    }

    /**
     * Returns the canonical form of a value of this kind. Domain names and hashes are case-insensitive and
     * are lower-cased; IP addresses and URLs are kept as given.
     *
     * @param value The raw indicator value.
     * @return The value used to key the indicator.
     */
    public @NotNull String canonicalize(@NotNull String value) {
        return switch (this) {
            case DOMAIN, HASH -> value.toLowerCase(Locale.ROOT);
            case IP, URL -> value;
        };
    }

    /**
     * Guesses the kind of a raw indicator value.
     *
     * @param value The raw indicator value.
     * @return The detected kind, or null if the value is not a recognizable indicator.
     */
    public static @Nullable IndicatorKind detect(@NotNull String value) {
        for (var kind : new IndicatorKind[]{IP, HASH, URL, DOMAIN}) {
            if (kind.accepts(value))
                return kind;
        }
        return null;
    }

    private static boolean isAbsoluteUrl(String value) {
        try {
            var uri = new URI(value);
            return uri.getScheme() != null && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return _id;
    }
}
