package uk.gegc.yearguess.features.challenge.domain.model;

import java.util.List;

/**
 * Frequency curve of guessed years for one round of a challenge.
 * Only rounds that received at least one guess have an instance.
 */
public record RoundGuessDistribution(
        int roundIndex,
        List<YearCurvePoint> curvePoints,
        long totalGuesses,
        int minGuess,
        int maxGuess,
        double medianGuess
) {

    public RoundGuessDistribution {
        curvePoints = curvePoints == null ? List.of() : List.copyOf(curvePoints);
    }
}
