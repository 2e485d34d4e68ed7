package uk.gegc.yearguess.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.yearguess.features.challenge.config.ChallengeProperties;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuessDistribution;
import uk.gegc.yearguess.features.challenge.domain.model.YearCurvePoint;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.features.stats.application.RoundGuessAggregator;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.StaleChallengeStateException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoundGuessAggregatorImpl implements RoundGuessAggregator {

    private final ChallengeRepository challengeRepository;
    private final RoundGuessRepository roundGuessRepository;
    private final ChallengeProperties challengeProperties;

    @Override
    public List<RoundGuessDistribution> aggregate(Collection<RoundGuess> guesses) {
        int roundCount = challengeProperties.getRoundCount();
        List<List<Integer>> yearsByRound = new ArrayList<>(roundCount);
        for (int i = 0; i < roundCount; i++) {
            yearsByRound.add(new ArrayList<>());
        }

        for (RoundGuess guess : guesses) {
            int round = guess.getRoundIndex();
            if (round < 0 || round >= roundCount) {
                log.warn("Ignoring guess {} with round index {} outside 0..{}", guess.getId(), round, roundCount - 1);
                continue;
            }
            yearsByRound.get(round).add(guess.getGuessedYear());
        }

        List<RoundGuessDistribution> distributions = new ArrayList<>();
        for (int round = 0; round < roundCount; round++) {
            List<Integer> years = yearsByRound.get(round);
            if (!years.isEmpty()) {
                distributions.add(summarizeRound(round, years));
            }
        }
        return distributions;
    }

    @Override
    @Transactional
    public List<RoundGuessDistribution> recompute(LocalDate challengeDate) {
        Challenge challenge = challengeRepository.findByChallengeDateForUpdate(challengeDate)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No challenge found for date %s".formatted(challengeDate)));

        if (challenge.isRoundStatsFinalized()) {
            log.info("Round stats for {} are finalized; keeping stored distributions", challengeDate);
            return challenge.getRoundGuessDistributions();
        }

        List<RoundGuess> guesses = roundGuessRepository.findByChallengeDateOrderByCreatedAtAsc(challengeDate);
        if (guesses.isEmpty()) {
            log.info("No round guesses found for {}; keeping stored distributions", challengeDate);
            return challenge.getRoundGuessDistributions();
        }

        List<RoundGuessDistribution> distributions = aggregate(guesses);
        challenge.setRoundGuessDistributions(distributions);
        challengeRepository.save(challenge);
        log.info("Recomputed round distributions for {} from {} guesses ({} rounds)",
                challengeDate, guesses.size(), distributions.size());
        return distributions;
    }

    @Override
    @Transactional
    public void storeDistributions(UUID challengeId, List<RoundGuessDistribution> distributions) {
        Challenge challenge = challengeRepository.findByIdForUpdate(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge %s not found".formatted(challengeId)));
        if (challenge.isRoundStatsFinalized()) {
            throw new StaleChallengeStateException(challengeId,
                    "Round stats of challenge %s were finalized; keeping stored distributions"
                            .formatted(challenge.getChallengeDate()));
        }
        challenge.setRoundGuessDistributions(distributions);
        challengeRepository.save(challenge);
    }

    private RoundGuessDistribution summarizeRound(int roundIndex, List<Integer> years) {
        int total = years.size();
        Map<Integer, Integer> countsByYear = new TreeMap<>();
        for (int year : years) {
            countsByYear.merge(year, 1, Integer::sum);
        }

        List<YearCurvePoint> points = new ArrayList<>(countsByYear.size());
        countsByYear.forEach((year, count) -> points.add(new YearCurvePoint(year, (double) count / total)));

        int[] sorted = years.stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(sorted);
        return new RoundGuessDistribution(
                roundIndex,
                points,
                total,
                sorted[0],
                sorted[sorted.length - 1],
                median(sorted)
        );
    }

    static double median(int[] sorted) {
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return sorted[mid];
    }
}
