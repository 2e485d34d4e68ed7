package uk.gegc.yearguess.features.challenge.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.util.UUID;

/**
 * One histogram entry: how many participants of a challenge finished with a given score.
 * <p>
 * The primary key is (challenge, score), so a second insert for the same score fails with a
 * constraint violation instead of creating a duplicate entry.
 * </p>
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "challenge_score_buckets")
public class ScoreBucket implements Persistable<ScoreBucketId> {

    @EmbeddedId
    private ScoreBucketId id;

    @Column(name = "participant_count", nullable = false)
    private long participantCount;

    @Transient
    private boolean isNew = true;

    public ScoreBucket(UUID challengeId, int score, long participantCount) {
        this.id = new ScoreBucketId(challengeId, score);
        this.participantCount = participantCount;
    }

    public int getScore() {
        return id.getScore();
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
