package uk.gegc.yearguess.features.archive.domain.model;

import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of an archive batch.
 */
public record ArchivedRoundGuess(
        UUID id,
        LocalDate challengeDate,
        int roundIndex,
        int guessedYear,
        Instant createdAt
) {

    public static ArchivedRoundGuess from(RoundGuess guess) {
        return new ArchivedRoundGuess(
                guess.getId(),
                guess.getChallengeDate(),
                guess.getRoundIndex(),
                guess.getGuessedYear(),
                guess.getCreatedAt()
        );
    }
}
