package uk.gegc.yearguess.features.archive.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuessDistribution;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.StaleChallengeStateException;

import java.util.List;
import java.util.UUID;

/**
 * Database side of archival. Guesses are only ever deleted by id, after their batch was
 * confirmed written.
 */
@Component
@RequiredArgsConstructor
public class ArchivedGuessPurger {

    private final ChallengeRepository challengeRepository;
    private final RoundGuessRepository roundGuessRepository;

    /**
     * Finalize the challenge with the round distributions of the archived snapshot, then delete
     * that snapshot, in one transaction. If another process finalized the challenge first,
     * nothing is written or deleted.
     */
    @Transactional
    public void purgeAndFinalize(UUID challengeId, List<UUID> archivedGuessIds,
                                 List<RoundGuessDistribution> distributions) {
        markFinalized(challengeId);
        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge %s not found".formatted(challengeId)));
        challenge.setRoundGuessDistributions(distributions);
        challengeRepository.save(challenge);
        roundGuessRepository.deleteAllByIdInBatch(archivedGuessIds);
    }

    @Transactional
    public void purge(List<UUID> archivedGuessIds) {
        roundGuessRepository.deleteAllByIdInBatch(archivedGuessIds);
    }

    @Transactional
    public void finalizeWithoutGuesses(UUID challengeId) {
        markFinalized(challengeId);
    }

    private void markFinalized(UUID challengeId) {
        if (challengeRepository.markRoundStatsFinalized(challengeId) == 0) {
            throw new StaleChallengeStateException(challengeId,
                    "Challenge %s was finalized by another process".formatted(challengeId));
        }
    }
}
