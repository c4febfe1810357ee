package cz.vut.fit.iocradar.models.scores;

/**
 * A plain numeric score with no further semantics.
 *
 * @param value The score.
 */
public record NumericScore(double value) implements RawScore {
    @Override
    public double numericValue() {
        return value;
    }
}
