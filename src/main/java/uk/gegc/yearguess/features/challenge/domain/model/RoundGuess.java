package uk.gegc.yearguess.features.challenge.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Raw, append-only record of a single round guess. Rows live here only until they are copied
 * into the cold archive; deletion is always by id.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "round_guesses", indexes = {
        @Index(name = "idx_round_guesses_challenge_date", columnList = "challenge_date")
})
public class RoundGuess {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "round_guess_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "challenge_date", nullable = false, updatable = false)
    private LocalDate challengeDate;

    @Column(name = "round_index", nullable = false, updatable = false)
    private int roundIndex;

    @Column(name = "guessed_year", nullable = false, updatable = false)
    private int guessedYear;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public RoundGuess(LocalDate challengeDate, int roundIndex, int guessedYear) {
        this.challengeDate = challengeDate;
        this.roundIndex = roundIndex;
        this.guessedYear = guessedYear;
    }
}
