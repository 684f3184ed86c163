package com.company.anomaly.domain;

/**
 * Rolling per-template baseline: failure rate, execution time and success rate.
 * Rates are fed as 100 or 0 per execution so their means read as percentages.
 */
public class BaselineMetrics {

    private static final double HIT = 100.0;
    private static final double MISS = 0.0;

    private final String templateId;
    private final MovingStatistic failureRate;
    private final MovingStatistic executionTime;
    private final MovingStatistic successRate;

    public BaselineMetrics(String templateId, int windowSize) {
        this.templateId = templateId;
        this.failureRate = new MovingStatistic(windowSize);
        this.executionTime = new MovingStatistic(windowSize);
        this.successRate = new MovingStatistic(windowSize);
    }

    public void observe(WorkflowExecution execution) {
        boolean failed = execution.isFailure();
        failureRate.observe(failed ? HIT : MISS);
        successRate.observe(failed ? MISS : HIT);
        if (execution.getDurationMs() != null) {
            executionTime.observe(execution.getDurationMs());
        }
    }

    public int getSampleCount() {
        return executionTime.getSampleCount();
    }

    public String getTemplateId() {
        return templateId;
    }

    public BaselineSnapshot snapshot() {
        return BaselineSnapshot.builder()
                .templateId(templateId)
                .failureRate(failureRate.snapshot())
                .executionTime(executionTime.snapshot())
                .successRate(successRate.snapshot())
                .historyUnavailable(false)
                .build();
    }
}
