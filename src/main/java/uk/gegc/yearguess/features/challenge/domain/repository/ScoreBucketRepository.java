package uk.gegc.yearguess.features.challenge.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucket;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucketId;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScoreBucketRepository extends JpaRepository<ScoreBucket, ScoreBucketId> {

    List<ScoreBucket> findByIdChallengeId(UUID challengeId);

    /**
     * Atomically add one participant to an existing bucket.
     *
     * @return number of rows updated (0 if the bucket row does not exist yet)
     */
    @Modifying(clearAutomatically = true)
    @Query("""
        UPDATE ScoreBucket b
        SET b.participantCount = b.participantCount + 1
        WHERE b.id.challengeId = :challengeId AND b.id.score = :score
    """)
    int incrementParticipantCount(@Param("challengeId") UUID challengeId, @Param("score") int score);

    @Modifying(clearAutomatically = true)
    @Query("""
        DELETE FROM ScoreBucket b
        WHERE b.id.challengeId = :challengeId AND (b.id.score < :minScore OR b.id.score > :maxScore)
    """)
    int deleteOutsideRange(@Param("challengeId") UUID challengeId,
                           @Param("minScore") int minScore,
                           @Param("maxScore") int maxScore);
}
