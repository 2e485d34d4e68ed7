package uk.gegc.yearguess.features.stats.application;

import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;

public interface RoundGuessService {

    /**
     * Append one raw guess for a round of a daily challenge.
     *
     * @throws uk.gegc.yearguess.shared.exception.ValidationException       bad date, round or year
     * @throws uk.gegc.yearguess.shared.exception.ResourceNotFoundException no challenge for the date
     */
    RoundGuess recordGuess(String date, int roundIndex, int guessedYear);
}
