package cz.vut.fit.iocradar.models.scores;

/**
 * A direct confidence percentage (0-100) that the indicator is malicious.
 *
 * @param percentage The confidence.
 */
public record ConfidencePercentage(double percentage) implements RawScore {
    @Override
    public double numericValue() {
        return percentage;
    }
}
