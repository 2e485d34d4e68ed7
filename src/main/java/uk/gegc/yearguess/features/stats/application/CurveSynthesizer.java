package uk.gegc.yearguess.features.stats.application;

import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;

import java.util.Map;

/**
 * Turns a score histogram into the display curve and summary statistics of a challenge.
 * <p>
 * Implementations are pure: same histogram, same arguments, same result. Only one curve
 * strategy is wired at a time so that stored curves keep a stable shape.
 * </p>
 */
public interface CurveSynthesizer {

    /**
     * @param histogram  score to participant count; entries with a non-positive count are ignored
     * @param userScore  optional score to rank against the histogram, may be {@code null}
     * @param pointCount target number of curve points, at least 2
     */
    ProcessedDistribution synthesize(Map<Integer, Long> histogram, Integer userScore, int pointCount);
}
