package cz.vut.fit.iocradar.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

/**
 * The classification tier derived from a normalized threat score. The constants are declared in the order of
 * increasing severity, so {@link #compareTo(Enum)} can be used to compare tiers.
 */
public enum Classification {
    CLEAN("clean"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    public static final int CRITICAL_THRESHOLD = 80;
    public static final int HIGH_THRESHOLD = 60;
    public static final int MEDIUM_THRESHOLD = 30;

    private final String _id;

    Classification(String id) {
        _id = id;
    }

    /**
     * Classifies a normalized score. Boundary values belong to the upper tier, e.g. exactly 80 is critical
     * and exactly 60 is high.
     *
     * @param score The normalized score in the range [0, 100].
     * @return The classification tier.
     */
    public static @NotNull Classification classify(int score) {
        if (score >= CRITICAL_THRESHOLD)
            return CRITICAL;
        if (score >= HIGH_THRESHOLD)
            return HIGH;
        if (score >= MEDIUM_THRESHOLD)
            return MEDIUM;
        if (score > 0)
            return LOW;
        return CLEAN;
    }

    @JsonValue
    public String id() {
        return _id;
    }

    @JsonCreator
    public static Classification fromId(String id) {
        for (var value : values()) {
            if (value._id.equalsIgnoreCase(id))
                return value;
        }
        throw new IllegalArgumentException("Unknown classification: " + id);
    }

    @Override
    public String toString() {
        return _id;
    }
}
