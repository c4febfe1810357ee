package cz.vut.fit.iocradar.models;

import org.jetbrains.annotations.NotNull;

/**
 * The unique key of a canonical indicator record.
 *
 * @param value The indicator value in its canonical form, see {@link IndicatorKind#canonicalize(String)}.
 * @param kind  The indicator kind.
 */
public record IndicatorKey(@NotNull String value, @NotNull IndicatorKind kind) {
    public IndicatorKey {
        if (value == null || kind == null)
            throw new IllegalArgumentException("Indicator key requires both value and kind");
        value = kind.canonicalize(value);
    }

    @Override
    public String toString() {
        return kind.id() + ":" + value;
    }
}
