package cz.vut.fit.iocradar.scoring;

import cz.vut.fit.iocradar.models.Classification;
import org.jetbrains.annotations.NotNull;

/**
 * A score on the common 0-100 scale together with its classification tier.
 *
 * @param score The normalized score.
 * @param tier  The classification of the score.
 */
public record NormalizedScore(int score, @NotNull Classification tier) {
    public static NormalizedScore of(int score) {
        return new NormalizedScore(score, Classification.classify(score));
    }
}
