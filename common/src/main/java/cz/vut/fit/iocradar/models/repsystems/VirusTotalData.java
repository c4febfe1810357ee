package cz.vut.fit.iocradar.models.repsystems;

import org.jetbrains.annotations.Nullable;

/**
 * A record that represents the last analysis statistics retrieved from the VirusTotal reputation system about
 * a specific IP address, domain name or file hash.
 */
public record VirusTotalData(
        int reputation,
        int malicious,
        int suspicious,
        int undetected,
        int harmless,
        @Nullable String country,
        @Nullable String asOwner
) {
    /**
     * Returns the number of engines that produced a verdict.
     */
    public int engines() {
        return malicious + suspicious + undetected + harmless;
    }
}
