package com.company.anomaly.repository;

import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.AnomalyQuery;
import com.company.anomaly.domain.DailyAnomalyCount;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyRepositoryTest {

    private static final Instant DAY_1 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2024-03-02T12:00:00Z");
    private static final Instant DAY_4 = Instant.parse("2024-03-04T12:00:00Z");

    private EmbeddedDatabase database;
    private AnomalyRepository repository;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        repository = new AnomalyRepository(new JdbcTemplate(database), new ObjectMapper(),
                Clock.fixed(DAY_4, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private Anomaly anomaly(String templateId, AnomalyType type, AnomalySeverity severity, Instant detectedAt) {
        return Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId(templateId)
                .type(type)
                .severity(severity)
                .description("Workflow execution time (135.0s) is significantly above baseline (100.0s ± 10.0s)")
                .metrics(AnomalyMetrics.of(135_000, 100_000, 3.5))
                .affectedEntity("E1")
                .affectedEntity(templateId)
                .investigationStep("Review workflow step completion times")
                .investigationStep("Check for external API delays")
                .detectedAt(detectedAt)
                .build();
    }

    @Test
    void saveThenFindByIdReturnsEqualRecord() {
        Anomaly saved = repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION,
                AnomalySeverity.CRITICAL, DAY_1.plusMillis(123)));

        assertThat(repository.findById(saved.getId())).contains(saved);
    }

    @Test
    void findByIdMissingIsEmpty() {
        assertThat(repository.findById(UUID.randomUUID())).isEmpty();
    }

    @Test
    void findFiltersByRangeTypeSeverityAndTemplate() {
        repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.CRITICAL, DAY_1));
        repository.save(anomaly("T1", AnomalyType.UNUSUAL_EXECUTION_TIME, AnomalySeverity.WARNING, DAY_2));
        repository.save(anomaly("T2", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.WARNING, DAY_2));
        repository.save(anomaly("T2", AnomalyType.SPIKE_IN_FAILURES, AnomalySeverity.CRITICAL, DAY_4));

        AnomalyQuery firstTwoDays = AnomalyQuery.builder()
                .start(DAY_1.minus(Duration.ofHours(1)))
                .end(DAY_2.plus(Duration.ofHours(1)))
                .build();
        assertThat(repository.find(firstTwoDays)).hasSize(3)
                .extracting(Anomaly::getDetectedAt)
                .isSortedAccordingTo((a, b) -> b.compareTo(a));
        assertThat(repository.count(firstTwoDays)).isEqualTo(3);

        AnomalyQuery degradation = firstTwoDays.toBuilder().type(AnomalyType.PERFORMANCE_DEGRADATION).build();
        assertThat(repository.find(degradation)).hasSize(2);

        AnomalyQuery warningDegradation = degradation.toBuilder().severity(AnomalySeverity.WARNING).build();
        assertThat(repository.find(warningDegradation)).singleElement()
                .extracting(Anomaly::getTemplateId).isEqualTo("T2");

        AnomalyQuery t1Only = firstTwoDays.toBuilder().templateId("T1").build();
        assertThat(repository.count(t1Only)).isEqualTo(2);
    }

    @Test
    void findPaginates() {
        for (int i = 0; i < 5; i++) {
            repository.save(anomaly("T1", AnomalyType.UNUSUAL_EXECUTION_TIME, AnomalySeverity.WARNING,
                    DAY_1.plusSeconds(i)));
        }
        AnomalyQuery page = AnomalyQuery.builder().start(DAY_1).end(DAY_2).page(1).size(2).build();

        List<Anomaly> second = repository.find(page);

        assertThat(second).extracting(Anomaly::getDetectedAt)
                .containsExactly(DAY_1.plusSeconds(2), DAY_1.plusSeconds(1));
    }

    @Test
    void convenienceFinders() {
        repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.CRITICAL, DAY_1));
        repository.save(anomaly("T1", AnomalyType.CONSECUTIVE_FAILURES, AnomalySeverity.WARNING, DAY_2));

        assertThat(repository.findByDateRange(DAY_1, DAY_4)).hasSize(2);
        assertThat(repository.findByType(AnomalyType.CONSECUTIVE_FAILURES, DAY_1, DAY_4)).hasSize(1);
        assertThat(repository.findBySeverity(AnomalySeverity.CRITICAL, DAY_2, DAY_4)).isEmpty();
    }

    @Test
    void trendAggregations() {
        repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.CRITICAL, DAY_1));
        repository.save(anomaly("T1", AnomalyType.UNUSUAL_EXECUTION_TIME, AnomalySeverity.CRITICAL, DAY_1));
        repository.save(anomaly("T2", AnomalyType.UNUSUAL_EXECUTION_TIME, AnomalySeverity.WARNING, DAY_4));

        List<DailyAnomalyCount> daily = repository.countByDate(DAY_1.minus(Duration.ofDays(1)), DAY_4);
        assertThat(daily).extracting(DailyAnomalyCount::getCount).containsExactly(2L, 1L);
        assertThat(daily.get(0).getDate()).isBefore(daily.get(1).getDate());

        Map<AnomalySeverity, Long> distribution = repository.severityDistribution(DAY_1, DAY_4);
        assertThat(distribution)
                .containsEntry(AnomalySeverity.CRITICAL, 2L)
                .containsEntry(AnomalySeverity.WARNING, 1L)
                .containsEntry(AnomalySeverity.INFO, 0L);
    }

    @Test
    void countByDateGroupsOnUtcDays() {
        repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.WARNING,
                Instant.parse("2024-03-01T23:30:00Z")));
        repository.save(anomaly("T1", AnomalyType.PERFORMANCE_DEGRADATION, AnomalySeverity.WARNING,
                Instant.parse("2024-03-02T00:30:00Z")));

        List<DailyAnomalyCount> daily = repository.countByDate(DAY_1, DAY_4);

        assertThat(daily).containsExactly(
                new DailyAnomalyCount(LocalDate.of(2024, 3, 1), 1),
                new DailyAnomalyCount(LocalDate.of(2024, 3, 2), 1));
    }
}
