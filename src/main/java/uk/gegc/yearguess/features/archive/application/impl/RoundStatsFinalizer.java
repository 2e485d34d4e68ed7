package uk.gegc.yearguess.features.archive.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.yearguess.features.archive.application.ArchiveOutcome;
import uk.gegc.yearguess.features.archive.config.ArchiveStorageProperties;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuessDistribution;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.features.stats.application.RoundGuessAggregator;
import uk.gegc.yearguess.shared.exception.ArchiveObjectExistsException;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.StaleChallengeStateException;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Archival state machine of one challenge's round guesses.
 * <p>
 * COLLECTING challenges are finalized: the raw guesses are read once and written to the archive.
 * Their round distributions are stored together with the finalized flag and the deletion by id,
 * so a finalizer that lost the race to another one leaves the winner's distributions intact. FINALIZED challenges only get their
 * late guesses archived as delta batches. A guess is never deleted unless the batch holding it
 * was written; any failure before that leaves the challenge as it was for the next attempt.
 * </p>
 * Used by both the scheduled sweep and the emergency trigger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoundStatsFinalizer {

    private final ChallengeRepository challengeRepository;
    private final RoundGuessRepository roundGuessRepository;
    private final RoundGuessAggregator roundGuessAggregator;
    private final ArchiveBatchWriter batchWriter;
    private final ArchivedGuessPurger purger;
    private final ArchiveStorageProperties archiveProperties;

    /**
     * @throws StaleChallengeStateException the challenge is already finalized
     */
    public ArchiveOutcome finalizeRoundStats(UUID challengeId) {
        Challenge challenge = loadChallenge(challengeId);
        if (challenge.isRoundStatsFinalized()) {
            throw new StaleChallengeStateException(challengeId,
                    "Round stats of challenge %s are already finalized".formatted(challenge.getChallengeDate()));
        }
        LocalDate challengeDate = challenge.getChallengeDate();

        List<RoundGuess> snapshot = roundGuessRepository.findByChallengeDateOrderByCreatedAtAsc(challengeDate);
        if (snapshot.isEmpty()) {
            purger.finalizeWithoutGuesses(challengeId);
            log.info("No round guesses for {}; round stats finalized", challengeDate);
            return ArchiveOutcome.FINALIZED_WITHOUT_GUESSES;
        }

        List<RoundGuessDistribution> distributions = roundGuessAggregator.aggregate(snapshot);

        if (!archiveProperties.isArchivingActive()) {
            roundGuessAggregator.storeDistributions(challengeId, distributions);
            log.warn("Archiving is disabled; keeping {} round guesses of {} and leaving round stats open",
                    snapshot.size(), challengeDate);
            return ArchiveOutcome.ARCHIVING_DISABLED;
        }

        String key;
        try {
            key = batchWriter.writeInitialBatch(challengeDate, snapshot);
        } catch (ArchiveObjectExistsException e) {
            log.warn("Initial archive {} already exists; writing {} guesses of {} as a delta batch",
                    e.getKey(), snapshot.size(), challengeDate);
            key = batchWriter.writeDeltaBatch(challengeDate, snapshot);
        }

        purger.purgeAndFinalize(challengeId, ids(snapshot), distributions);
        log.info("Finalized round stats of {}: {} guesses archived to {} and removed", challengeDate, snapshot.size(), key);
        return ArchiveOutcome.FINALIZED;
    }

    /**
     * Archive guesses that arrived after finalization.
     *
     * @throws StaleChallengeStateException the challenge is not finalized yet
     */
    public ArchiveOutcome archiveLateGuesses(UUID challengeId) {
        Challenge challenge = loadChallenge(challengeId);
        if (!challenge.isRoundStatsFinalized()) {
            throw new StaleChallengeStateException(challengeId,
                    "Round stats of challenge %s are not finalized".formatted(challenge.getChallengeDate()));
        }
        LocalDate challengeDate = challenge.getChallengeDate();

        List<RoundGuess> lateGuesses = roundGuessRepository.findByChallengeDateOrderByCreatedAtAsc(challengeDate);
        if (lateGuesses.isEmpty()) {
            log.debug("No late round guesses for {}", challengeDate);
            return ArchiveOutcome.NOTHING_TO_ARCHIVE;
        }
        if (!archiveProperties.isArchivingActive()) {
            log.warn("Archiving is disabled; keeping {} late round guesses of {}", lateGuesses.size(), challengeDate);
            return ArchiveOutcome.ARCHIVING_DISABLED;
        }

        String key = batchWriter.writeDeltaBatch(challengeDate, lateGuesses);
        purger.purge(ids(lateGuesses));
        log.info("Archived {} late round guesses of {} to {}", lateGuesses.size(), challengeDate, key);
        return ArchiveOutcome.DELTA_ARCHIVED;
    }

    private Challenge loadChallenge(UUID challengeId) {
        return challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge %s not found".formatted(challengeId)));
    }

    private static List<UUID> ids(List<RoundGuess> guesses) {
        return guesses.stream().map(RoundGuess::getId).toList();
    }
}
