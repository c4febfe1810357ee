package cz.vut.fit.iocradar.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The overall threat level derived from the indicators first seen in the last hour.
 */
public enum ThreatLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Derives the threat level from the number of critical and high indicators seen in the last hour.
     * The thresholds are evaluated in order, the first matching one wins.
     *
     * @param criticalLastHour The number of critical indicators first seen in the last hour.
     * @param highLastHour     The number of high indicators first seen in the last hour.
     * @return The threat level.
     */
    public static ThreatLevel derive(long criticalLastHour, long highLastHour) {
        if (criticalLastHour > 5)
            return CRITICAL;
        if (criticalLastHour > 0 || highLastHour > 10)
            return HIGH;
        if (highLastHour > 0)
            return MEDIUM;
        return LOW;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }
}
