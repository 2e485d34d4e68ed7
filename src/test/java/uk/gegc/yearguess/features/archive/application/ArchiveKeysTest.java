package uk.gegc.yearguess.features.archive.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArchiveKeys Tests")
class ArchiveKeysTest {

    private static final LocalDate DATE = LocalDate.of(2023, 12, 30);

    @Test
    @DisplayName("initialKey: one initial batch per challenge date")
    void initialKey() {
        assertThat(ArchiveKeys.initialKey("round-guesses-archive", DATE))
                .isEqualTo("round-guesses-archive/2023-12-30/2023-12-30-initial.jsonl");
    }

    @Test
    @DisplayName("deltaKey: timestamp is made file-name friendly")
    void deltaKey() {
        assertThat(ArchiveKeys.deltaKey("round-guesses-archive", DATE, Instant.parse("2024-01-01T04:15:00.123Z")))
                .isEqualTo("round-guesses-archive/2023-12-30/delta_2024-01-01T04-15-00-123Z.jsonl");
    }

    @Test
    @DisplayName("keys: trailing slashes of the prefix are ignored")
    void keys_trailingSlashIgnored() {
        assertThat(ArchiveKeys.initialKey("archive/", DATE)).isEqualTo("archive/2023-12-30/2023-12-30-initial.jsonl");
    }
}
