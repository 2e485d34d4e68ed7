package uk.gegc.yearguess.features.archive.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.yearguess.features.archive.application.ArchiveKeys;
import uk.gegc.yearguess.features.archive.application.ArchiveObjectStore;
import uk.gegc.yearguess.features.archive.config.ArchiveStorageProperties;
import uk.gegc.yearguess.features.archive.domain.model.ArchivedRoundGuess;
import uk.gegc.yearguess.features.challenge.domain.model.RoundGuess;
import uk.gegc.yearguess.shared.exception.ArchiveStorageException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Serializes round guesses as JSON Lines and writes them as one immutable archive object.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArchiveBatchWriter {

    static final String CONTENT_TYPE = "application/jsonl";

    private final ArchiveObjectStore objectStore;
    private final ArchiveStorageProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @return the key written
     * @throws uk.gegc.yearguess.shared.exception.ArchiveObjectExistsException the initial batch was already written
     */
    public String writeInitialBatch(LocalDate challengeDate, List<RoundGuess> guesses) {
        return write(ArchiveKeys.initialKey(properties.getPrefix(), challengeDate), guesses);
    }

    /**
     * @return the key written
     */
    public String writeDeltaBatch(LocalDate challengeDate, List<RoundGuess> guesses) {
        return write(ArchiveKeys.deltaKey(properties.getPrefix(), challengeDate, Instant.now(clock)), guesses);
    }

    private String write(String key, List<RoundGuess> guesses) {
        byte[] body = toJsonLines(guesses);
        objectStore.put(properties.getBucket(), key, body, CONTENT_TYPE);
        log.info("Archived {} round guesses to {}/{}", guesses.size(), properties.getBucket(), key);
        return key;
    }

    byte[] toJsonLines(List<RoundGuess> guesses) {
        StringBuilder body = new StringBuilder();
        for (RoundGuess guess : guesses) {
            try {
                body.append(objectMapper.writeValueAsString(ArchivedRoundGuess.from(guess))).append('\n');
            } catch (JsonProcessingException e) {
                throw new ArchiveStorageException("Failed to serialize round guess " + guess.getId(), e);
            }
        }
        return body.toString().getBytes(StandardCharsets.UTF_8);
    }
}
