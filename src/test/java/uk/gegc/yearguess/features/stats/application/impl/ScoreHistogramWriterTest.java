package uk.gegc.yearguess.features.stats.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.yearguess.BaseUnitTest;
import uk.gegc.yearguess.features.challenge.domain.model.Challenge;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucket;
import uk.gegc.yearguess.features.challenge.domain.model.ScoreBucketId;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.ScoreBucketRepository;
import uk.gegc.yearguess.features.stats.application.ScoreSubmissionResult;
import uk.gegc.yearguess.shared.exception.ResourceNotFoundException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ScoreHistogramWriter Tests")
class ScoreHistogramWriterTest extends BaseUnitTest {

    @Mock
    private ChallengeRepository challengeRepository;

    @Mock
    private ScoreBucketRepository scoreBucketRepository;

    private ScoreHistogramWriter writer;
    private UUID challengeId;

    @BeforeEach
    void setUp() {
        writer = new ScoreHistogramWriter(challengeRepository, scoreBucketRepository, new BucketedCurveSynthesizer());
        challengeId = UUID.randomUUID();
    }

    @Test
    @DisplayName("ensureBucket: when bucket already exists then nothing is inserted")
    void ensureBucket_whenExists_thenNoInsert() {
        when(scoreBucketRepository.existsById(new ScoreBucketId(challengeId, 1200))).thenReturn(true);

        writer.ensureBucket(challengeId, 1200);

        verify(scoreBucketRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("ensureBucket: when missing then inserts an empty bucket")
    void ensureBucket_whenMissing_thenInsertsEmptyBucket() {
        when(scoreBucketRepository.existsById(new ScoreBucketId(challengeId, 1200))).thenReturn(false);

        writer.ensureBucket(challengeId, 1200);

        ArgumentCaptor<ScoreBucket> inserted = ArgumentCaptor.forClass(ScoreBucket.class);
        verify(scoreBucketRepository).saveAndFlush(inserted.capture());
        assertThat(inserted.getValue().getScore()).isEqualTo(1200);
        assertThat(inserted.getValue().getParticipantCount()).isZero();
    }

    @Test
    @DisplayName("ensureBucket: when a concurrent insert wins then the duplicate key is absorbed")
    void ensureBucket_whenConcurrentInsertWins_thenAbsorbed() {
        // Given
        ScoreBucketId bucketId = new ScoreBucketId(challengeId, 1200);
        when(scoreBucketRepository.existsById(bucketId)).thenReturn(false, true);
        when(scoreBucketRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        // When & Then
        assertThatCode(() -> writer.ensureBucket(challengeId, 1200)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("ensureBucket: when insert fails and no bucket exists then the error propagates")
    void ensureBucket_whenInsertFailsWithoutBucket_thenPropagates() {
        when(scoreBucketRepository.existsById(any())).thenReturn(false);
        when(scoreBucketRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("fk"));

        assertThatThrownBy(() -> writer.ensureBucket(challengeId, 1200))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("recordSubmission: increments bucket and completions")
    void recordSubmission_incrementsBoth() {
        when(scoreBucketRepository.incrementParticipantCount(challengeId, 300)).thenReturn(1);
        when(challengeRepository.incrementCompletions(challengeId)).thenReturn(1);

        writer.recordSubmission(challengeId, 300);

        verify(scoreBucketRepository).incrementParticipantCount(challengeId, 300);
        verify(challengeRepository).incrementCompletions(challengeId);
    }

    @Test
    @DisplayName("recordSubmission: when bucket row is missing then fails before touching completions")
    void recordSubmission_whenBucketMissing_thenFails() {
        when(scoreBucketRepository.incrementParticipantCount(challengeId, 300)).thenReturn(0);

        assertThatThrownBy(() -> writer.recordSubmission(challengeId, 300))
                .isInstanceOf(IllegalStateException.class);
        verify(challengeRepository, never()).incrementCompletions(any());
    }

    @Test
    @DisplayName("recordSubmission: when challenge is gone then throws ResourceNotFoundException")
    void recordSubmission_whenChallengeMissing_thenThrows() {
        when(scoreBucketRepository.incrementParticipantCount(challengeId, 300)).thenReturn(1);
        when(challengeRepository.incrementCompletions(challengeId)).thenReturn(0);

        assertThatThrownBy(() -> writer.recordSubmission(challengeId, 300))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("refreshDerivedStats: stores average and unranked curve, returns ranked curve")
    void refreshDerivedStats_storesUnrankedReturnsRanked() {
        // Given
        Challenge challenge = new Challenge(LocalDate.of(2024, 1, 1));
        challenge.setId(challengeId);
        challenge.setCompletions(7);
        when(scoreBucketRepository.findByIdChallengeId(challengeId)).thenReturn(List.of(
                new ScoreBucket(challengeId, 100, 2),
                new ScoreBucket(challengeId, 200, 4),
                new ScoreBucket(challengeId, 300, 1)
        ));
        when(challengeRepository.findById(challengeId)).thenReturn(Optional.of(challenge));

        // When
        ScoreSubmissionResult result = writer.refreshDerivedStats(challengeId, 200, 15);

        // Then - (2*100 + 4*200 + 300) / 7
        assertThat(result.averageScore()).isEqualTo(1300.0 / 7);
        assertThat(result.completions()).isEqualTo(7);
        assertThat(result.processedDistribution().percentileRank()).isEqualTo(43);
        assertThat(challenge.getAverageScore()).isEqualTo(1300.0 / 7);
        assertThat(challenge.getProcessedDistribution().percentileRank()).isNull();
        assertThat(challenge.getProcessedDistribution().curvePoints())
                .isEqualTo(result.processedDistribution().curvePoints());
        verify(challengeRepository).save(challenge);
    }

    @Test
    @DisplayName("refreshDerivedStats: when completions moved on after the histogram was read then the average follows the histogram")
    void refreshDerivedStats_whenCompletionsAhead_thenAverageFromHistogram() {
        // Given - two more submissions were counted between reading the buckets and the challenge
        Challenge challenge = new Challenge(LocalDate.of(2024, 1, 1));
        challenge.setId(challengeId);
        challenge.setCompletions(9);
        when(scoreBucketRepository.findByIdChallengeId(challengeId)).thenReturn(List.of(
                new ScoreBucket(challengeId, 100, 2),
                new ScoreBucket(challengeId, 200, 4),
                new ScoreBucket(challengeId, 300, 1)
        ));
        when(challengeRepository.findById(challengeId)).thenReturn(Optional.of(challenge));

        // When
        ScoreSubmissionResult result = writer.refreshDerivedStats(challengeId, null, 15);

        // Then
        assertThat(result.averageScore()).isEqualTo(1300.0 / 7);
        assertThat(result.completions()).isEqualTo(9);
        assertThat(challenge.getAverageScore()).isEqualTo(1300.0 / 7);
    }

    @Test
    @DisplayName("rebuild: purges out-of-range buckets and recounts completions")
    void rebuild_purgesAndRecounts() {
        // Given
        Challenge challenge = new Challenge(LocalDate.of(2024, 1, 1));
        challenge.setId(challengeId);
        challenge.setCompletions(2);
        when(scoreBucketRepository.deleteOutsideRange(challengeId, 0, 5000)).thenReturn(1);
        when(scoreBucketRepository.findByIdChallengeId(challengeId)).thenReturn(List.of(
                new ScoreBucket(challengeId, 100, 1),
                new ScoreBucket(challengeId, 200, 1)
        ));
        when(challengeRepository.findById(challengeId)).thenReturn(Optional.of(challenge));

        // When
        ScoreSubmissionResult result = writer.rebuild(challengeId, 15);

        // Then
        verify(challengeRepository).resetCompletions(challengeId, 2L);
        assertThat(result.averageScore()).isEqualTo(150.0);
        assertThat(result.processedDistribution().totalParticipants()).isEqualTo(2);
    }
}
