package cz.vut.fit.iocradar.models.repsystems;

import org.jetbrains.annotations.Nullable;

/**
 * A record that represents a set of data retrieved from the AbuseIPDB reputation system about a specific IP address.
 */
public record AbuseIpDbData(
        int abuseConfidenceScore,
        Boolean isWhitelisted,
        Boolean isTor,
        int totalReports,
        @Nullable String countryCode,
        @Nullable String usageType,
        @Nullable String isp
) {
}
