package uk.gegc.yearguess.features.archive.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.yearguess.features.archive.application.ArchivalService;
import uk.gegc.yearguess.features.archive.application.ArchivalSweepReport;
import uk.gegc.yearguess.features.archive.application.ArchiveOutcome;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.shared.exception.StaleChallengeStateException;
import uk.gegc.yearguess.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArchivalServiceImpl implements ArchivalService {

    private final ChallengeRepository challengeRepository;
    private final RoundStatsFinalizer finalizer;
    private final Clock clock;

    @Override
    public ArchivalSweepReport runArchivalSweep(int ageThresholdDays) {
        if (ageThresholdDays < 0) {
            throw new ValidationException("Age threshold must not be negative");
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(ageThresholdDays);
        List<Challenge> challenges = challengeRepository.findByChallengeDateBeforeOrderByChallengeDateAsc(cutoff);
        log.info("Archival sweep: {} challenges dated before {}", challenges.size(), cutoff);

        int finalized = 0;
        int deltaBatches = 0;
        int skipped = 0;
        int failed = 0;
        for (Challenge challenge : challenges) {
            try {
                ArchiveOutcome outcome = challenge.isRoundStatsFinalized()
                        ? finalizer.archiveLateGuesses(challenge.getId())
                        : finalizer.finalizeRoundStats(challenge.getId());
                switch (outcome) {
                    case FINALIZED, FINALIZED_WITHOUT_GUESSES -> finalized++;
                    case DELTA_ARCHIVED -> deltaBatches++;
                    case NOTHING_TO_ARCHIVE, ARCHIVING_DISABLED -> skipped++;
                }
            } catch (StaleChallengeStateException e) {
                skipped++;
                log.info("Skipping challenge {}: {}", challenge.getChallengeDate(), e.getMessage());
            } catch (Exception e) {
                failed++;
                log.error("Archival of challenge {} failed; it will be retried on the next sweep",
                        challenge.getChallengeDate(), e);
            }
        }

        ArchivalSweepReport report = new ArchivalSweepReport(challenges.size(), finalized, deltaBatches, skipped, failed);
        log.info("Archival sweep finished: {}", report);
        return report;
    }

    @Override
    public void archiveEmergency(LocalDate challengeDate, UUID challengeId) {
        Optional<Challenge> current = challengeRepository.findById(challengeId);
        if (current.isEmpty()) {
            log.warn("Emergency archival requested for unknown challenge {} ({})", challengeId, challengeDate);
            return;
        }
        Challenge challenge = current.get();
        if (!challenge.getChallengeDate().equals(challengeDate)) {
            throw new ValidationException("Challenge %s is dated %s, not %s"
                    .formatted(challengeId, challenge.getChallengeDate(), challengeDate));
        }
        if (challenge.isRoundStatsFinalized()) {
            log.info("Round stats of {} already finalized; emergency archival not needed", challengeDate);
            return;
        }

        log.warn("Starting emergency archival of {} ({} completions)", challengeDate, challenge.getCompletions());
        ArchiveOutcome outcome = finalizer.finalizeRoundStats(challengeId);
        log.info("Emergency archival of {} finished: {}", challengeDate, outcome);
    }
}
