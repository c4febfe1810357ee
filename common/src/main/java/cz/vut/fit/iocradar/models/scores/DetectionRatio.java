package cz.vut.fit.iocradar.models.scores;

/**
 * A detection ratio, i.e. the number of engines that flagged the indicator out of the number of engines that
 * analysed it.
 *
 * @param positives The number of positive detections.
 * @param total     The total number of engines.
 */
public record DetectionRatio(int positives, int total) implements RawScore {
    public DetectionRatio {
        if (positives < 0 || total < 0)
            throw new IllegalArgumentException("Detection counts must not be negative");
    }

    @Override
    public double numericValue() {
        return total == 0 ? 0 : (double) positives / total * 100.0;
    }
}
