package uk.gegc.yearguess.features.archive.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.yearguess.features.archive.application.ArchivalService;
import uk.gegc.yearguess.features.archive.config.ArchiveStorageProperties;

/**
 * Nightly sweep that finalizes the round stats of past challenges and moves their raw guesses
 * into the archive.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoundGuessArchivalScheduler {

    private final ArchivalService archivalService;
    private final ArchiveStorageProperties properties;

    @Scheduled(cron = "${app.archive.sweep-cron:0 15 4 * * *}", zone = "${app.challenge.timezone:America/New_York}")
    public void sweepOldRoundGuesses() {
        log.debug("Running scheduled round-guess archival sweep");
        try {
            archivalService.runArchivalSweep(properties.getOlderThanDays());
        } catch (Exception e) {
            log.error("Error during scheduled round-guess archival sweep", e);
        }
    }
}
