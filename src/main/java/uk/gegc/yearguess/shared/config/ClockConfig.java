package uk.gegc.yearguess.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.yearguess.features.challenge.config.ChallengeProperties;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for the application.
 * <p>
 * The clock runs in the challenge time zone so that "today" and archival cutoffs
 * follow the calendar the daily challenges are published in. Tests replace it
 * with a fixed clock.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(ChallengeProperties properties) {
        String configuredZone = properties.getTimezone() == null || properties.getTimezone().isBlank()
                ? "UTC"
                : properties.getTimezone().trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
