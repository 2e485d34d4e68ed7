package uk.gegc.yearguess.features.archive.application;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Moves raw round guesses of past challenges from the database into the cold archive and
 * finalizes their round statistics.
 */
public interface ArchivalService {

    /**
     * Process every challenge dated more than {@code ageThresholdDays} days before today.
     * A failure on one challenge is logged and does not stop the others.
     */
    ArchivalSweepReport runArchivalSweep(int ageThresholdDays);

    /**
     * Finalize one challenge immediately, outside the sweep schedule.
     *
     * @throws uk.gegc.yearguess.shared.exception.ValidationException the challenge is not dated {@code challengeDate}
     */
    void archiveEmergency(LocalDate challengeDate, UUID challengeId);
}
