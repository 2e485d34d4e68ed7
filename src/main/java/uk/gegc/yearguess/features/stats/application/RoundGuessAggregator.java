package uk.gegc.yearguess.features.stats.application;

import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuessDistribution;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Builds per-round guessed-year curves from raw round guesses.
 */
public interface RoundGuessAggregator {

    /**
     * Pure aggregation. Rounds without guesses are omitted; the result is ordered by round index.
     */
    List<RoundGuessDistribution> aggregate(Collection<RoundGuess> guesses);

    /**
     * Recompute and overwrite the stored round distributions of a challenge from the raw
     * guesses currently in the hot store. Safe to call repeatedly.
     * <p>
     * Nothing is written when no raw guesses exist or when the challenge is already
     * finalized; the stored distributions are returned unchanged in that case.
     * </p>
     */
    List<RoundGuessDistribution> recompute(LocalDate challengeDate);

    /**
     * Overwrite the stored round distributions of a challenge that is still collecting.
     *
     * @throws uk.gegc.yearguess.shared.exception.StaleChallengeStateException the challenge was finalized
     */
    void storeDistributions(UUID challengeId, List<RoundGuessDistribution> distributions);
}
