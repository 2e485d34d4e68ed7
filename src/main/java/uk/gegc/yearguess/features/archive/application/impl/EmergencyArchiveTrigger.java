package uk.gegc.yearguess.features.archive.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import uk.gegc.yearguess.features.archive.application.ArchivalService;
import uk.gegc.yearguess.features.archive.config.ArchiveStorageProperties;
import uk.gegc.yearguess.features.stats.domain.event.ScoreSubmittedEvent;
import uk.gegc.yearguess.shared.exception.StaleChallengeStateException;

/**
 * Archives a busy challenge from the submission path instead of waiting for the nightly sweep,
 * so that its raw guesses do not pile up in the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmergencyArchiveTrigger {

    private final ArchivalService archivalService;
    private final ArchiveStorageProperties properties;

    @EventListener
    public void onScoreSubmitted(ScoreSubmittedEvent event) {
        ArchiveStorageProperties.Emergency emergency = properties.getEmergency();
        if (!emergency.isEnabled()
                || !properties.isArchivingActive()
                || event.isRoundStatsFinalized()
                || event.getCompletions() < emergency.getCompletionsThreshold()) {
            return;
        }

        try {
            archivalService.archiveEmergency(event.getChallengeDate(), event.getChallengeId());
        } catch (StaleChallengeStateException e) {
            log.info("Emergency archival of {} skipped: {}", event.getChallengeDate(), e.getMessage());
        } catch (Exception e) {
            // The submission has been counted already; the next sweep retries the archive
            log.error("Emergency archival of {} failed", event.getChallengeDate(), e);
        }
    }
}
