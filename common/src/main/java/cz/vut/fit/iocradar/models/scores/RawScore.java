package cz.vut.fit.iocradar.models.scores;

/**
 * A score in the representation used by the reporting source.
 *
 * @see DetectionRatio
 * @see ConfidencePercentage
 * @see NumericScore
 */
public interface RawScore {
    /**
     * Returns the score as a plain number. Used as the fallback when the source is not recognized.
     *
     * @return The numeric value.
     */
    double numericValue();
}
