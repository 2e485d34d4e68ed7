package uk.gegc.yearguess.features.challenge.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChallengeRepository extends JpaRepository<Challenge, UUID> {

    Optional<Challenge> findByChallengeDate(LocalDate challengeDate);

    Optional<Challenge> findByChallengeDateAndActiveTrue(LocalDate challengeDate);

    /**
     * Load a challenge with a write lock held until the transaction ends. Writers of the round
     * distributions use it so that a concurrent finalization cannot slip in between the
     * finalized check and the write.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Challenge c WHERE c.id = :challengeId")
    Optional<Challenge> findByIdForUpdate(@Param("challengeId") UUID challengeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Challenge c WHERE c.challengeDate = :challengeDate")
    Optional<Challenge> findByChallengeDateForUpdate(@Param("challengeDate") LocalDate challengeDate);

    /**
     * Challenges strictly older than the cutoff, oldest first. Used by the archival sweep.
     */
    List<Challenge> findByChallengeDateBeforeOrderByChallengeDateAsc(LocalDate cutoff);

    /**
     * Atomically increment the completions counter without loading the entity.
     *
     * @return number of rows updated (0 if the challenge does not exist)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Challenge c SET c.completions = c.completions + 1 WHERE c.id = :challengeId")
    int incrementCompletions(@Param("challengeId") UUID challengeId);

    /**
     * Overwrite completions with a recounted value. Only used by the maintenance rebuild.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Challenge c SET c.completions = :completions WHERE c.id = :challengeId")
    int resetCompletions(@Param("challengeId") UUID challengeId, @Param("completions") long completions);

    /**
     * Flip COLLECTING to FINALIZED. The guard on the current value makes the transition
     * happen at most once across concurrent finalizers.
     *
     * @return 1 if this call performed the transition, 0 if the challenge was already finalized
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE Challenge c
        SET c.roundStatsFinalized = true
        WHERE c.id = :challengeId AND c.roundStatsFinalized = false
    """)
    int markRoundStatsFinalized(@Param("challengeId") UUID challengeId);
}
