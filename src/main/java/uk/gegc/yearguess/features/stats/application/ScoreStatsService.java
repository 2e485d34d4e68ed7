package uk.gegc.yearguess.features.stats.application;

import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;

/**
 * Score statistics of the daily challenges.
 * <p>
 * Dates are ISO {@code yyyy-MM-dd} strings; a {@code null} or blank date means today's
 * challenge in the configured challenge time zone.
 * </p>
 */
public interface ScoreStatsService {

    /**
     * Count a finished game and return the refreshed statistics.
     * <p>
     * The histogram and completions counter are updated atomically; the average and curve
     * are then recomputed from a fresh read and written back without locking, so under
     * concurrent submissions the stored curve reflects whichever recompute wrote last.
     * </p>
     *
     * @param date     challenge date
     * @param rawScore total score in [0, 5000]
     * @return average, completions and the distribution ranked against {@code rawScore}
     * @throws uk.gegc.yearguess.shared.exception.ValidationException       invalid score or date
     * @throws uk.gegc.yearguess.shared.exception.ResourceNotFoundException no active challenge
     */
    ScoreSubmissionResult submitScore(String date, Number rawScore);

    /**
     * Compute the distribution of an active challenge on demand.
     *
     * @param date       challenge date
     * @param userScore  optional score to rank
     * @param pointCount optional number of curve points
     */
    ProcessedDistribution getDistribution(String date, Integer userScore, Integer pointCount);

    /**
     * Maintenance rebuild: drop histogram entries outside the score domain and recount
     * completions, average and curve from what remains.
     */
    ScoreSubmissionResult rebuildScoreStats(String date);
}
