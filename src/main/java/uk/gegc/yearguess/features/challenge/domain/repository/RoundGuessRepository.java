package uk.gegc.yearguess.features.challenge.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface RoundGuessRepository extends JpaRepository<RoundGuess, UUID> {

    List<RoundGuess> findByChallengeDateOrderByCreatedAtAsc(LocalDate challengeDate);

    long countByChallengeDate(LocalDate challengeDate);
}
