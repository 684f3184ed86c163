package com.company.anomaly.repository;

import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.ExecutionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowExecutionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private WorkflowExecutionRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        repository = new WorkflowExecutionRepository(jdbcTemplate);

        insert("e1", "T1", 100, "SUCCESS", NOW.minusSeconds(300));
        insert("e2", "T1", 200, "FAILED", NOW.minusSeconds(200));
        insert("e3", "T1", 300, "TIMEOUT", NOW.minusSeconds(100));
        insert("e4", "T2", 400, "SUCCESS", NOW.minusSeconds(90_000));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private void insert(String id, String template, long duration, String outcome, Instant completedAt) {
        jdbcTemplate.update("INSERT INTO workflow_executions VALUES (?, ?, ?, ?, ?)",
                id, template, duration, outcome, OffsetDateTime.ofInstant(completedAt, ZoneOffset.UTC));
    }

    @Test
    void findRecentByTemplateIsNewestFirstAndLimited() {
        assertThat(repository.findRecentByTemplate("T1", 2))
                .extracting(WorkflowExecution::getExecutionId)
                .containsExactly("e3", "e2");
    }

    @Test
    void findByIdMapsAllColumns() {
        WorkflowExecution execution = repository.findById("e3").orElseThrow();

        assertThat(execution.getTemplateId()).isEqualTo("T1");
        assertThat(execution.getDurationMs()).isEqualTo(300L);
        assertThat(execution.getOutcome()).isEqualTo(ExecutionOutcome.TIMEOUT);
        assertThat(execution.getCompletedAt()).isEqualTo(NOW.minusSeconds(100));
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    void findTemplateIdsCompletedSince() {
        assertThat(repository.findTemplateIdsCompletedSince(NOW.minusSeconds(3600))).containsExactly("T1");
        assertThat(repository.findTemplateIdsCompletedSince(NOW.minusSeconds(100_000))).containsExactly("T1", "T2");
    }
}
