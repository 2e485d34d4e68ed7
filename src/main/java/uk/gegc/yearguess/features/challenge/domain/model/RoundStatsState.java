package uk.gegc.yearguess.features.challenge.domain.model;

/**
 * Archival lifecycle of a challenge's round data.
 * A challenge only moves from COLLECTING to FINALIZED once its raw guesses have a confirmed
 * durable copy in the archive; FINALIZED challenges can still receive late guesses.
 */
public enum RoundStatsState {
    COLLECTING,
    FINALIZED
}
