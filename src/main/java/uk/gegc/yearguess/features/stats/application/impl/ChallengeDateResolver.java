package uk.gegc.yearguess.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.yearguess.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Parses challenge dates supplied by callers. A missing date means today on the challenge
 * calendar, which the injected clock's zone defines.
 */
@Component
@RequiredArgsConstructor
public class ChallengeDateResolver {

    private final Clock clock;

    public LocalDate resolve(String date) {
        if (!StringUtils.hasText(date)) {
            return today();
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid challenge date '%s'. Expected format yyyy-MM-dd.".formatted(date), e);
        }
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
