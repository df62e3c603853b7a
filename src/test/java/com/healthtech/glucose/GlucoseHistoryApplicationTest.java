package com.healthtech.glucose;

import com.healthtech.glucose.runner.BackfillRunner;
import com.healthtech.glucose.runner.ScheduledBackfillTrigger;
import com.healthtech.glucose.storage.AggregateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full-context test against a real PostgreSQL with backfill disabled.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@DisplayName("Glucose History Application Tests")
class GlucoseHistoryApplicationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("glucose")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private AggregateStore store;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Should start without a scheduled trigger when backfill is disabled")
    void testContextLoads() {
        assertThat(context.getBeansOfType(ScheduledBackfillTrigger.class)).isEmpty();
        assertThat(context.getBean(BackfillRunner.class).getExitCode()).isZero();
        assertThat(store.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should serve stored averages through the API")
    void testServesStoredAverages() throws Exception {
        LocalDate day = LocalDate.of(2024, 3, 1);
        store.upsertMinuteAverages(day, Map.of(720, 110, 721, 112));

        mockMvc.perform(get("/api/v1/averages").param("date", "2024-03-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.m[0]").value(720))
            .andExpect(jsonPath("$.v[1]").value(112));

        mockMvc.perform(get("/api/v1/backfill/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.zoneId").value("Europe/Berlin"))
            .andExpect(jsonPath("$.healthy").value(true));
    }
}
