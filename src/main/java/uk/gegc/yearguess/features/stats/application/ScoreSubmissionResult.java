package uk.gegc.yearguess.features.stats.application;

import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;

public record ScoreSubmissionResult(
        double averageScore,
        long completions,
        ProcessedDistribution processedDistribution
) {
}
