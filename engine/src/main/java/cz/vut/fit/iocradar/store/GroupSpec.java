package cz.vut.fit.iocradar.store;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Describes a grouped count over the records matching a filter.
 *
 * @param filter The records to include.
 * @param by     The grouping fields; an empty list yields a single group.
 */
public record GroupSpec(@NotNull IndicatorQuery filter, @NotNull List<Field> by) {
    public enum Field {
        CLASSIFICATION,
        /** The UTC calendar day of {@code firstSeen}. */
        FIRST_SEEN_DAY
    }

    public GroupSpec {
        by = List.copyOf(by);
    }

    public static GroupSpec of(IndicatorQuery filter, Field... by) {
        return new GroupSpec(filter, List.of(by));
    }

    public boolean groupsBy(Field field) {
        return by.contains(field);
    }
}
