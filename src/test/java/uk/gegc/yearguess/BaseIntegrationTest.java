package uk.gegc.yearguess;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.yearguess.config.TestClockConfig;
import uk.gegc.yearguess.features.archive.application.ArchiveObjectStore;
import uk.gegc.yearguess.features.challenge.domain.repository.ChallengeRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.RoundGuessRepository;
import uk.gegc.yearguess.features.challenge.domain.repository.ScoreBucketRepository;

/**
 * Base class for integration tests against the H2 database.
 * <p>
 * Not transactional: the code under test commits in several separate transactions, so every
 * test starts from empty tables instead of relying on rollback. The archive object store is
 * mocked.
 * </p>
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@TestPropertySource(properties = {
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.flyway.enabled=false"
})
public abstract class BaseIntegrationTest {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected ChallengeRepository challengeRepository;

    @Autowired
    protected ScoreBucketRepository scoreBucketRepository;

    @Autowired
    protected RoundGuessRepository roundGuessRepository;

    @MockBean
    protected ArchiveObjectStore archiveObjectStore;

    @AfterEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM challenge_score_buckets");
        jdbcTemplate.update("DELETE FROM round_guesses");
        jdbcTemplate.update("DELETE FROM daily_challenges");
    }
}
