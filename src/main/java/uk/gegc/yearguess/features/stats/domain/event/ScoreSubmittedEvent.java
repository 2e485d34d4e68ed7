package uk.gegc.yearguess.features.stats.domain.event;

import org.springframework.context.ApplicationEvent;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Published after a score submission has been counted and the derived stats written.
 * <p>
 * Delivered synchronously on the submitting thread; listeners that do heavy work must not
 * let their failures escape into the submission.
 * </p>
 */
public class ScoreSubmittedEvent extends ApplicationEvent {

    private final UUID challengeId;
    private final LocalDate challengeDate;
    private final int score;
    private final long completions;
    private final boolean roundStatsFinalized;

    public ScoreSubmittedEvent(Object source, UUID challengeId, LocalDate challengeDate, int score,
                               long completions, boolean roundStatsFinalized) {
        super(source);
        this.challengeId = challengeId;
        this.challengeDate = challengeDate;
        this.score = score;
        this.completions = completions;
        this.roundStatsFinalized = roundStatsFinalized;
    }

    public UUID getChallengeId() {
        return challengeId;
    }

    public LocalDate getChallengeDate() {
        return challengeDate;
    }

    public int getScore() {
        return score;
    }

    public long getCompletions() {
        return completions;
    }

    public boolean isRoundStatsFinalized() {
        return roundStatsFinalized;
    }
}
