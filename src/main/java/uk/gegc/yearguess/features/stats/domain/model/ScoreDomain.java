package uk.gegc.yearguess.features.stats.domain.model;

/**
 * Bounds of a daily challenge total score (five rounds, at most 1000 points each).
 */
public final class ScoreDomain {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 5000;

    private ScoreDomain() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean contains(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
