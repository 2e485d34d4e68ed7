package uk.gegc.yearguess.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.yearguess.features.challenge.config.ChallengeProperties;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.ProcessedDistribution;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.stats.application.CurveSynthesizer;
import uk.gegc.yearguess.features.stats.application.ScoreStatsService;
import uk.gegc.yearguess.features.stats.application.ScoreSubmissionResult;
import uk.gegc.yearguess.features.stats.domain.event.ScoreSubmittedEvent;
import uk.gegc.yearguess.features.stats.domain.model.ScoreDomain;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.ValidationException;

import java.time.LocalDate;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScoreStatsServiceImpl implements ScoreStatsService {

    static final String INVALID_SCORE_MESSAGE =
            "Invalid score value submitted. Score must be a number between 0 and 5000.";
    private static final int MIN_POINT_COUNT = 2;
    private static final int MAX_POINT_COUNT = 200;

    private final ChallengeRepository challengeRepository;
    private final ScoreHistogramWriter histogramWriter;
    private final CurveSynthesizer curveSynthesizer;
    private final ChallengeDateResolver dateResolver;
    private final ChallengeProperties challengeProperties;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public ScoreSubmissionResult submitScore(String date, Number rawScore) {
        int score = validateScore(rawScore);
        Challenge challenge = findActiveChallenge(dateResolver.resolve(date));

        histogramWriter.ensureBucket(challenge.getId(), score);
        histogramWriter.recordSubmission(challenge.getId(), score);
        ScoreSubmissionResult result = histogramWriter.refreshDerivedStats(
                challenge.getId(), score, challengeProperties.getDefaultCurvePoints());

        log.debug("Recorded score {} for challenge {} ({} completions)",
                score, challenge.getChallengeDate(), result.completions());

        eventPublisher.publishEvent(new ScoreSubmittedEvent(this, challenge.getId(), challenge.getChallengeDate(),
                score, result.completions(), challenge.isRoundStatsFinalized()));
        return result;
    }

    @Override
    public ProcessedDistribution getDistribution(String date, Integer userScore, Integer pointCount) {
        LocalDate challengeDate = dateResolver.resolve(date);
        int points = pointCount == null ? challengeProperties.getDefaultCurvePoints() : pointCount;
        if (points < MIN_POINT_COUNT || points > MAX_POINT_COUNT) {
            throw new ValidationException("Point count must be between %d and %d"
                    .formatted(MIN_POINT_COUNT, MAX_POINT_COUNT));
        }
        if (userScore != null && !ScoreDomain.contains(userScore)) {
            throw new ValidationException(INVALID_SCORE_MESSAGE);
        }

        Challenge challenge = findActiveChallenge(challengeDate);
        Map<Integer, Long> histogram = histogramWriter.loadHistogram(challenge.getId());
        return curveSynthesizer.synthesize(histogram, userScore, points);
    }

    @Override
    public ScoreSubmissionResult rebuildScoreStats(String date) {
        LocalDate challengeDate = dateResolver.resolve(date);
        Challenge challenge = challengeRepository.findByChallengeDate(challengeDate)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No challenge found for date %s".formatted(challengeDate)));

        ScoreSubmissionResult result = histogramWriter.rebuild(
                challenge.getId(), challengeProperties.getDefaultCurvePoints());
        log.info("Rebuilt score stats for challenge {}: {} completions, average {}",
                challengeDate, result.completions(), result.averageScore());
        return result;
    }

    private Challenge findActiveChallenge(LocalDate challengeDate) {
        return challengeRepository.findByChallengeDateAndActiveTrue(challengeDate)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No active challenge found for date %s".formatted(challengeDate)));
    }

    static int validateScore(Number rawScore) {
        if (rawScore == null) {
            throw new ValidationException(INVALID_SCORE_MESSAGE);
        }
        double value = rawScore.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)
                || value != Math.rint(value)
                || value < ScoreDomain.MIN_SCORE || value > ScoreDomain.MAX_SCORE) {
            throw new ValidationException(INVALID_SCORE_MESSAGE);
        }
        return (int) value;
    }
}
