package uk.gegc.yearguess.features.challenge.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate record for one daily challenge.
 * <p>
 * {@code completions} is only ever changed through atomic repository updates. Entity writes
 * are dynamic so that saving the derived fields never overwrites a concurrently incremented
 * counter with a stale value.
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@DynamicUpdate
@Table(name = "daily_challenges")
public class Challenge {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "challenge_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "challenge_date", nullable = false, unique = true, updatable = false)
    private LocalDate challengeDate;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "completions", nullable = false)
    private long completions;

    @Column(name = "average_score", nullable = false)
    private double averageScore;

    @Convert(converter = ProcessedDistributionConverter.class)
    @Column(name = "processed_distribution", columnDefinition = "LONGTEXT")
    private ProcessedDistribution processedDistribution;

    @Convert(converter = RoundGuessDistributionsConverter.class)
    @Column(name = "round_guess_distributions", columnDefinition = "LONGTEXT")
    private List<RoundGuessDistribution> roundGuessDistributions = new ArrayList<>();

    @Column(name = "round_stats_finalized", nullable = false)
    private boolean roundStatsFinalized;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public Challenge(LocalDate challengeDate) {
        this.challengeDate = challengeDate;
    }

    public RoundStatsState getRoundStatsState() {
        return roundStatsFinalized ? RoundStatsState.FINALIZED : RoundStatsState.COLLECTING;
    }
}
