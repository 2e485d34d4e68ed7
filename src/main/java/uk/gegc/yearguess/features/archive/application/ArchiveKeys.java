package uk.gegc.yearguess.features.archive.application;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Object key layout of the round-guess archive:
 * {@code <prefix>/<date>/<date>-initial.jsonl} for the batch written at finalization and
 * {@code <prefix>/<date>/delta_<timestamp>.jsonl} for late guesses.
 */
public final class ArchiveKeys {

    private ArchiveKeys() {
    }

    public static String initialKey(String prefix, LocalDate challengeDate) {
        return "%s/%s/%s-initial.jsonl".formatted(normalize(prefix), challengeDate, challengeDate);
    }

    public static String deltaKey(String prefix, LocalDate challengeDate, Instant timestamp) {
        String stamp = timestamp.toString().replace(':', '-').replace('.', '-');
        return "%s/%s/delta_%s.jsonl".formatted(normalize(prefix), challengeDate, stamp);
    }

    private static String normalize(String prefix) {
        String trimmed = prefix == null ? "" : prefix.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
