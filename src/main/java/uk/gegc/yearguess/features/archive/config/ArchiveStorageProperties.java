package uk.gegc.yearguess.features.archive.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.archive")
public class ArchiveStorageProperties {

    /**
     * Master switch for writing round guesses to the cold archive. When off, raw guesses are
     * never deleted from the database.
     */
    private boolean enabled = true;

    /**
     * Target bucket. Archival is treated as disabled while this is blank.
     */
    private String bucket;

    @NotBlank
    private String prefix = "round-guesses-archive";

    @NotBlank
    private String region = "us-east-1";

    /**
     * Optional S3-compatible endpoint. Leave unset for AWS.
     */
    private URI endpoint;

    /**
     * Static credentials. When either is blank the default AWS credentials chain is used.
     */
    private String accessKey;

    private String secretKey;

    /**
     * Challenges whose date is more than this many days before today are swept.
     */
    @Min(0)
    private int olderThanDays = 1;

    @NotBlank
    private String sweepCron = "0 15 4 * * *";

    @Valid
    @NotNull
    private Emergency emergency = new Emergency();

    public boolean isArchivingActive() {
        return enabled && StringUtils.hasText(bucket);
    }

    public boolean hasStaticCredentials() {
        return StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey);
    }

    @Data
    public static class Emergency {
        /**
         * Archive a challenge from the submission path once it gets this busy.
         */
        private boolean enabled = true;

        @Min(1)
        private long completionsThreshold = 10_000;
    }
}
