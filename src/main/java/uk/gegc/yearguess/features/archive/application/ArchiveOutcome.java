package uk.gegc.yearguess.features.archive.application;

public enum ArchiveOutcome {
    /** No raw guesses existed; the challenge was finalized directly. */
    FINALIZED_WITHOUT_GUESSES,
    /** Raw guesses were archived, deleted and the challenge finalized. */
    FINALIZED,
    /** Late guesses of a finalized challenge were archived and deleted. */
    DELTA_ARCHIVED,
    /** A finalized challenge had no late guesses. */
    NOTHING_TO_ARCHIVE,
    /** Archiving is switched off; raw guesses were kept and the challenge left collecting. */
    ARCHIVING_DISABLED
}
