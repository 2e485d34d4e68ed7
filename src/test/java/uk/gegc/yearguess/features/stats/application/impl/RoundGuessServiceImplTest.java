package uk.gegc.yearguess.features.stats.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.yearguess.BaseUnitTest;
import uk.gegc.yearguess.config.TestClockConfig;
import uk.gegc.yearguess.features.challenge.config.ChallengeProperties;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;
import uk.gegc.yearguess.shared.exception.ValidationException;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("RoundGuessServiceImpl Tests")
class RoundGuessServiceImplTest extends BaseUnitTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 1);

    @Mock
    private ChallengeRepository challengeRepository;

    @Mock
    private RoundGuessRepository roundGuessRepository;

    private RoundGuessServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new RoundGuessServiceImpl(challengeRepository, roundGuessRepository,
                new ChallengeDateResolver(TestClockConfig.fixedClock()), new ChallengeProperties());
    }

    @Test
    @DisplayName("recordGuess: when valid then saves a raw guess")
    void recordGuess_whenValid_thenSaves() {
        when(challengeRepository.findByChallengeDate(DATE)).thenReturn(Optional.of(new Challenge(DATE)));
        when(roundGuessRepository.save(any(RoundGuess.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RoundGuess saved = service.recordGuess("2024-01-01", 4, 1969);

        assertThat(saved.getChallengeDate()).isEqualTo(DATE);
        assertThat(saved.getRoundIndex()).isEqualTo(4);
        assertThat(saved.getGuessedYear()).isEqualTo(1969);
    }

    @Test
    @DisplayName("recordGuess: when round index outside the challenge then throws ValidationException")
    void recordGuess_whenRoundOutOfRange_thenThrows() {
        assertThatThrownBy(() -> service.recordGuess("2024-01-01", 5, 1969))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(roundGuessRepository);
    }

    @Test
    @DisplayName("recordGuess: when year outside the accepted range then throws ValidationException")
    void recordGuess_whenYearOutOfRange_thenThrows() {
        assertThatThrownBy(() -> service.recordGuess("2024-01-01", 0, 2500))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(roundGuessRepository);
    }

    @Test
    @DisplayName("recordGuess: when no challenge for the date then throws ResourceNotFoundException")
    void recordGuess_whenUnknownDate_thenThrows() {
        when(challengeRepository.findByChallengeDate(DATE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.recordGuess(null, 0, 1969))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(roundGuessRepository);
    }
}
