package uk.gegc.yearguess.features.challenge.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.challenge")
public class ChallengeProperties {

    /**
     * Zone the daily challenge calendar is published in. Used when a submission
     * omits its date and when computing archival cutoffs.
     */
    @NotBlank
    private String timezone = "America/New_York";

    /**
     * Number of rounds (images) per daily challenge.
     */
    @Min(1)
    @Max(20)
    private int roundCount = 5;

    /**
     * Curve point count used when the caller does not ask for one.
     */
    @Min(2)
    @Max(200)
    private int defaultCurvePoints = 15;

    /**
     * Accepted range for a guessed year.
     */
    private int minGuessedYear = 1000;

    private int maxGuessedYear = 2100;
}
