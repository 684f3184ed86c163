package com.company.anomaly.scheduled;

import com.company.anomaly.config.AnomalyDetectionProperties;
import com.company.anomaly.detection.BatchAnomalyDetector;
import com.company.anomaly.domain.Anomaly;
import com.company.anomaly.domain.AnomalyMetrics;
import com.company.anomaly.domain.OutcomeWindow;
import com.company.anomaly.domain.WorkflowExecution;
import com.company.anomaly.domain.enums.AnomalySeverity;
import com.company.anomaly.domain.enums.AnomalyType;
import com.company.anomaly.domain.enums.ExecutionOutcome;
import com.company.anomaly.pipeline.AnomalyPublisher;
import com.company.anomaly.repository.WorkflowExecutionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.company.anomaly.ExecutionFixtures.BASE_TIME;
import static com.company.anomaly.ExecutionFixtures.newestFirst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FailurePatternDetectionJobTest {

    private WorkflowExecutionRepository executionRepository;
    private BatchAnomalyDetector detector;
    private AnomalyPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private FailurePatternDetectionJob job;

    @BeforeEach
    void setUp() {
        executionRepository = mock(WorkflowExecutionRepository.class);
        detector = mock(BatchAnomalyDetector.class);
        publisher = mock(AnomalyPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        job = new FailurePatternDetectionJob(executionRepository, detector, publisher,
                new AnomalyDetectionProperties(), meterRegistry, Clock.fixed(BASE_TIME, ZoneOffset.UTC));

        when(publisher.persist(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static Anomaly streak() {
        return Anomaly.builder()
                .id(UUID.randomUUID())
                .templateId("T1")
                .type(AnomalyType.CONSECUTIVE_FAILURES)
                .severity(AnomalySeverity.WARNING)
                .description("3 consecutive failures")
                .metrics(AnomalyMetrics.of(3, 0, 0))
                .detectedAt(BASE_TIME)
                .build();
    }

    @Test
    void fetchesSpikeWindowPlusBaselineWindow() {
        when(executionRepository.findRecentByTemplate("T1", 40))
                .thenReturn(newestFirst("T1", true, true, true, false));
        when(detector.check(any(OutcomeWindow.class))).thenReturn(List.of(streak()));

        assertThat(job.evaluateTemplate("T1")).isEqualTo(1);
        verify(publisher).dispatch(anyList());
    }

    @Test
    void templateWithoutNewExecutionsIsNotReevaluated() {
        when(executionRepository.findRecentByTemplate(eq("T1"), anyInt()))
                .thenReturn(newestFirst("T1", true, true, true));
        when(detector.check(any(OutcomeWindow.class))).thenReturn(List.of(streak()));

        assertThat(job.evaluateTemplate("T1")).isEqualTo(1);
        assertThat(job.evaluateTemplate("T1")).isEqualTo(-1);

        verify(detector, times(1)).check(any(OutcomeWindow.class));
    }

    @Test
    void newerExecutionTriggersReevaluation() {
        List<WorkflowExecution> first = newestFirst("T1", true, true, true);
        List<WorkflowExecution> second = new ArrayList<>(first);
        second.add(0, WorkflowExecution.builder()
                .executionId("T1-new")
                .templateId("T1")
                .durationMs(1000L)
                .outcome(ExecutionOutcome.FAILED)
                .completedAt(BASE_TIME.plus(Duration.ofMinutes(1)))
                .build());
        when(executionRepository.findRecentByTemplate(eq("T1"), anyInt())).thenReturn(first, second);
        when(detector.check(any(OutcomeWindow.class))).thenReturn(List.of(streak()));

        job.evaluateTemplate("T1");
        assertThat(job.evaluateTemplate("T1")).isEqualTo(1);
        verify(detector, times(2)).check(any(OutcomeWindow.class));
    }

    @Test
    void oneFailingTemplateDoesNotStopTheRun() {
        when(executionRepository.findTemplateIdsCompletedSince(BASE_TIME.minus(Duration.ofHours(24))))
                .thenReturn(List.of("BROKEN", "T1"));
        when(executionRepository.findRecentByTemplate(eq("BROKEN"), anyInt()))
                .thenThrow(new IllegalStateException("bad row"));
        when(executionRepository.findRecentByTemplate(eq("T1"), anyInt()))
                .thenReturn(newestFirst("T1", false, false));
        when(detector.check(any(OutcomeWindow.class))).thenReturn(List.of());

        job.detectFailurePatterns();

        verify(detector, times(1)).check(any(OutcomeWindow.class));
        assertThat(meterRegistry.counter("anomaly.batch.runs").count()).isEqualTo(1.0);
    }

    @Test
    void templateWithNoRowsIsSkipped() {
        when(executionRepository.findRecentByTemplate(eq("T1"), anyInt())).thenReturn(List.of());

        assertThat(job.evaluateTemplate("T1")).isEqualTo(-1);
    }
}
