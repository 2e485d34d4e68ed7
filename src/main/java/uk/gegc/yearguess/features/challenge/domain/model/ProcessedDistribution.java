package uk.gegc.yearguess.features.challenge.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Derived view of a challenge's score histogram. Recomputed on every write and never
 * authoritative; the score buckets are.
 *
 * @param percentileRank "top X%" rank of a caller-supplied score, or {@code null} when no score
 *                       was supplied or the score is outside the top half
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessedDistribution(
        Integer percentileRank,
        List<CurvePoint> curvePoints,
        long totalParticipants,
        int minScore,
        int maxScore,
        int medianScore
) {

    public ProcessedDistribution {
        curvePoints = curvePoints == null ? List.of() : List.copyOf(curvePoints);
    }

    public ProcessedDistribution withoutPercentileRank() {
        return new ProcessedDistribution(null, curvePoints, totalParticipants, minScore, maxScore, medianScore);
    }
}
