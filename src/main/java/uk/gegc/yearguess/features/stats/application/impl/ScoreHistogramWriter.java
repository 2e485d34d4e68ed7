package uk.gegc.yearguess.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucket;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucketId;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.ScoreBucketRepository;
import uk.gegc.yearguess.features.stats.application.CurveSynthesizer;
import uk.gegc.yearguess.features.stats.application.ScoreSubmissionResult;
import uk.gegc.yearguess.features.stats.domain.model.ScoreDomain;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Transactional steps of the score statistics write path.
 * <p>
 * Kept apart from {@link ScoreStatsServiceImpl} so that every step runs in its own transaction
 * through the Spring proxy.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScoreHistogramWriter {

    private final ChallengeRepository challengeRepository;
    private final ScoreBucketRepository scoreBucketRepository;
    private final CurveSynthesizer curveSynthesizer;

    /**
     * Insert an empty bucket for the score unless one already exists. A concurrent inserter
     * that loses the race hits the primary key; its failure is absorbed once the winner's row
     * is visible.
     */
    public void ensureBucket(UUID challengeId, int score) {
        ScoreBucketId bucketId = new ScoreBucketId(challengeId, score);
        if (scoreBucketRepository.existsById(bucketId)) {
            return;
        }
        try {
            scoreBucketRepository.saveAndFlush(new ScoreBucket(challengeId, score, 0));
            log.debug("Created score bucket {} for challenge {}", score, challengeId);
        } catch (DataIntegrityViolationException ex) {
            if (!scoreBucketRepository.existsById(bucketId)) {
                log.error("Failed to create score bucket {} for challenge {}", score, challengeId, ex);
                throw ex;
            }
            log.debug("Detected concurrent creation of score bucket {} for challenge {}", score, challengeId);
        }
    }

    /**
     * Count one participant in the bucket and in the completions counter. Both increments
     * commit together or not at all.
     */
    @Transactional
    public void recordSubmission(UUID challengeId, int score) {
        int bucketsUpdated = scoreBucketRepository.incrementParticipantCount(challengeId, score);
        if (bucketsUpdated == 0) {
            throw new IllegalStateException(
                    "Score bucket %d of challenge %s disappeared before increment".formatted(score, challengeId));
        }
        int challengesUpdated = challengeRepository.incrementCompletions(challengeId);
        if (challengesUpdated == 0) {
            throw new ResourceNotFoundException("Challenge %s not found".formatted(challengeId));
        }
    }

    /**
     * Recompute average score and the shared distribution from a fresh read and write them
     * back. Only the derived columns are written, so concurrent counter increments survive.
     *
     * @return the fresh stats, with the distribution ranked against {@code userScore}
     */
    @Transactional
    public ScoreSubmissionResult refreshDerivedStats(UUID challengeId, Integer userScore, int pointCount) {
        Map<Integer, Long> histogram = loadHistogram(challengeId);
        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge %s not found".formatted(challengeId)));
        return applyDerivedStats(challenge, histogram, userScore, pointCount);
    }

    /**
     * Drop buckets outside the score domain and recount everything from the rest.
     */
    @Transactional
    public ScoreSubmissionResult rebuild(UUID challengeId, int pointCount) {
        int purged = scoreBucketRepository.deleteOutsideRange(challengeId, ScoreDomain.MIN_SCORE, ScoreDomain.MAX_SCORE);
        if (purged > 0) {
            log.info("Removed {} out-of-range score buckets from challenge {}", purged, challengeId);
        }
        Map<Integer, Long> histogram = loadHistogram(challengeId);
        long recounted = histogram.values().stream().mapToLong(Long::longValue).sum();
        challengeRepository.resetCompletions(challengeId, recounted);

        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge %s not found".formatted(challengeId)));
        return applyDerivedStats(challenge, histogram, null, pointCount);
    }

    @Transactional(readOnly = true)
    public Map<Integer, Long> loadHistogram(UUID challengeId) {
        List<ScoreBucket> buckets = scoreBucketRepository.findByIdChallengeId(challengeId);
        Map<Integer, Long> histogram = new TreeMap<>();
        for (ScoreBucket bucket : buckets) {
            histogram.merge(bucket.getScore(), bucket.getParticipantCount(), Long::sum);
        }
        return histogram;
    }

    private ScoreSubmissionResult applyDerivedStats(Challenge challenge, Map<Integer, Long> histogram,
                                                    Integer userScore, int pointCount) {
        long completions = challenge.getCompletions();
        long scoreSum = 0;
        long scoredParticipants = 0;
        for (Map.Entry<Integer, Long> entry : histogram.entrySet()) {
            scoreSum += (long) entry.getKey() * entry.getValue();
            scoredParticipants += entry.getValue();
        }
        // Average over the histogram it was read from, not the separately read counter
        double averageScore = scoredParticipants > 0 ? (double) scoreSum / scoredParticipants : 0d;

        ProcessedDistribution ranked = curveSynthesizer.synthesize(histogram, userScore, pointCount);
        challenge.setAverageScore(averageScore);
        challenge.setProcessedDistribution(ranked.withoutPercentileRank());
        challengeRepository.save(challenge);

        return new ScoreSubmissionResult(averageScore, completions, ranked);
    }
}
