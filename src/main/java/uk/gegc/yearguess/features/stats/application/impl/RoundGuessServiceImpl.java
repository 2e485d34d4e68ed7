package uk.gegc.yearguess.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.yearguess.features.challenge.config.ChallengeProperties;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.features.stats.application.RoundGuessService;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.ValidationException;

import java.time.LocalDate;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoundGuessServiceImpl implements RoundGuessService {

    private final ChallengeRepository challengeRepository;
    private final RoundGuessRepository roundGuessRepository;
    private final ChallengeDateResolver dateResolver;
    private final ChallengeProperties challengeProperties;

    @Override
    @Transactional
    public RoundGuess recordGuess(String date, int roundIndex, int guessedYear) {
        LocalDate challengeDate = dateResolver.resolve(date);
        if (roundIndex < 0 || roundIndex >= challengeProperties.getRoundCount()) {
            throw new ValidationException("Round index must be between 0 and %d"
                    .formatted(challengeProperties.getRoundCount() - 1));
        }
        if (guessedYear < challengeProperties.getMinGuessedYear() || guessedYear > challengeProperties.getMaxGuessedYear()) {
            throw new ValidationException("Guessed year must be between %d and %d"
                    .formatted(challengeProperties.getMinGuessedYear(), challengeProperties.getMaxGuessedYear()));
        }
        if (challengeRepository.findByChallengeDate(challengeDate).isEmpty()) {
            throw new ResourceNotFoundException("No challenge found for date %s".formatted(challengeDate));
        }

        RoundGuess saved = roundGuessRepository.save(new RoundGuess(challengeDate, roundIndex, guessedYear));
        log.debug("Recorded guess {} for round {} of {}", guessedYear, roundIndex, challengeDate);
        return saved;
    }
}
