package uk.gegc.yearguess.shared.exception;

import java.util.UUID;

/**
 * Thrown when a freshness re-check shows another process already moved the challenge on.
 * Callers abort without side effects.
 */
public class StaleChallengeStateException extends RuntimeException {

    private final UUID challengeId;

    public StaleChallengeStateException(UUID challengeId, String message) {
        super(message);
        this.challengeId = challengeId;
    }

    public UUID getChallengeId() {
        return challengeId;
    }
}
