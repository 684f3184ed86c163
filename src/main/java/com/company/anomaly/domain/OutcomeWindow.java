package com.company.anomaly.domain;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Recent executions of one template, newest first.
 */
@Value
public class OutcomeWindow {
    String templateId;
    List<WorkflowExecution> executions;

    public OutcomeWindow(String templateId, List<WorkflowExecution> executions) {
        this.templateId = templateId;
        this.executions = List.copyOf(executions);
    }

    public int size() {
        return executions.size();
    }

    public List<WorkflowExecution> newest(int count) {
        return executions.subList(0, Math.min(count, executions.size()));
    }

    /**
     * Up to {@code max} executions following the first {@code skip} ones.
     */
    public List<WorkflowExecution> after(int skip, int max) {
        if (skip >= executions.size()) {
            return List.of();
        }
        return executions.subList(skip, Math.min(skip + max, executions.size()));
    }

    /**
     * Number of failures in a row counted from the newest execution.
     */
    public int leadingFailureStreak() {
        int streak = 0;
        for (WorkflowExecution execution : executions) {
            if (!execution.isFailure()) {
                break;
            }
            streak++;
        }
        return streak;
    }

    public Instant newestCompletedAt() {
        return executions.isEmpty() ? null : executions.get(0).getCompletedAt();
    }

    /**
     * Percentage of failed executions, 0 for an empty list.
     */
    public static double failureRate(List<WorkflowExecution> executions) {
        if (executions.isEmpty()) {
            return 0.0;
        }
        long failures = executions.stream().filter(WorkflowExecution::isFailure).count();
        return failures * 100.0 / executions.size();
    }

    public static MovingStatistic failureRateStatistic(List<WorkflowExecution> executions, int windowSize) {
        MovingStatistic statistic = new MovingStatistic(windowSize);
        // oldest first, as the tracker would have seen them
        for (int i = executions.size() - 1; i >= 0; i--) {
            statistic.observe(executions.get(i).isFailure() ? 100.0 : 0.0);
        }
        return statistic;
    }
}
