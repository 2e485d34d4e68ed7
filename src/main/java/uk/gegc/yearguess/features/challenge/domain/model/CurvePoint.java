package uk.gegc.yearguess.features.challenge.domain.model;

/**
 * One sample of the score curve: a real score bucket, its participant count and the
 * cumulative percentile of participants at or below it.
 */
public record CurvePoint(int score, long count, int percentile) {
}
