package com.nosota.mvesting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.mvesting.service.VestingClock;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.Mockito.when;

@SpringBootTest(
        classes = MVestingApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.MOCK
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final String ADMIN = "0x" + "a".repeat(40);
    protected static final String SAFE = "0x" + "5".repeat(40);
    protected static final String ESCROW = "0x" + "e".repeat(40);

    /**
     * Vesting start used by the scenarios; the clock starts 100 seconds earlier.
     */
    protected static final long T = 1_800_000_000L;

    protected final AtomicLong now = new AtomicLong();

    @MockBean
    protected VestingClock vestingClock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @BeforeEach
    void resetState() {
        jdbcTemplate.execute("TRUNCATE recipient, escrow, token_account, vesting_event RESTART IDENTITY");
        now.set(T - 100);
        when(vestingClock.now()).thenAnswer(invocation -> now.get());
    }

    protected void advanceTo(long instant) {
        now.set(instant);
    }
}
