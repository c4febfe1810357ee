package cz.vut.fit.iocradar.scoring;

import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.scores.ConfidencePercentage;
import cz.vut.fit.iocradar.models.scores.DetectionRatio;
import cz.vut.fit.iocradar.models.scores.RawScore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps source-specific scores onto a common 0-100 scale and a {@link Classification} tier.
 * <p>
 * The score representation determines the transform:
 * <ul>
 *     <li>a {@link DetectionRatio} becomes {@code min(100, round(positives / total * 100))}, or 0 when
 *     {@code total} is 0;</li>
 *     <li>a {@link ConfidencePercentage} becomes {@code min(100, percentage)};</li>
 *     <li>any other score, e.g. one reported by a source that is not recognized, is clamped into [0, 100].</li>
 * </ul>
 * All scores are additionally clamped at 0 from below. The normalization has no side effects.
 */
public final class ScoreNormalizer {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    private ScoreNormalizer() {
    }

    /**
     * Normalizes a raw score.
     *
     * @param source   The identifier of the reporting source. Only informational.
     * @param rawScore The raw score.
     * @return The normalized score and its tier.
     */
    public static @NotNull NormalizedScore normalize(@Nullable String source, @NotNull RawScore rawScore) {
        return NormalizedScore.of(normalizeScore(source, rawScore));
    }

    /**
     * Normalizes a raw score without classifying it.
     *
     * @param source   The identifier of the reporting source. Only informational.
     * @param rawScore The raw score.
     * @return The score in the range [0, 100].
     */
    public static int normalizeScore(@Nullable String source, @NotNull RawScore rawScore) {
        if (rawScore instanceof DetectionRatio ratio) {
            if (ratio.total() == 0)
                return MIN_SCORE;

            return clamp(Math.round((double) ratio.positives() / ratio.total() * 100.0));
        }

        if (rawScore instanceof ConfidencePercentage confidence) {
            return clamp(Math.round(confidence.percentage()));
        }

        return clamp(Math.round(rawScore.numericValue()));
    }

    /**
     * Clamps a value into [0, 100].
     *
     * @param value The value.
     * @return The clamped value.
     */
    public static int clamp(long value) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
