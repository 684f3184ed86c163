package com.company.anomaly.domain;

import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Mean and population standard deviation over a bounded FIFO window of samples.
 * Not thread-safe; callers hold the per-template lock.
 */
public class MovingStatistic {

    public static final int DEFAULT_WINDOW_SIZE = 30;

    /** Standard deviations below this are treated as zero. */
    static final double EPSILON = 1e-9;

    private final int windowSize;
    private final Deque<Double> history;
    private double mean;
    private double stdDev;

    public MovingStatistic() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public MovingStatistic(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.history = new ArrayDeque<>(windowSize);
    }

    private MovingStatistic(MovingStatistic source) {
        this.windowSize = source.windowSize;
        this.history = new ArrayDeque<>(source.history);
        this.mean = source.mean;
        this.stdDev = source.stdDev;
    }

    /**
     * Appends a sample, evicting the oldest one when the window is full, and recomputes.
     */
    public Snapshot observe(double value) {
        if (history.size() == windowSize) {
            history.removeFirst();
        }
        history.addLast(value);
        recompute();
        return snapshot();
    }

    public OptionalDouble zScore(double value) {
        return zScore(value, mean, stdDev, history.size());
    }

    public Snapshot snapshot() {
        return new Snapshot(mean, stdDev, history.size());
    }

    public MovingStatistic copy() {
        return new MovingStatistic(this);
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public int getSampleCount() {
        return history.size();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public List<Double> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    private void recompute() {
        int n = history.size();
        double sum = 0.0;
        for (double v : history) {
            sum += v;
        }
        mean = sum / n;

        double squares = 0.0;
        for (double v : history) {
            double diff = v - mean;
            squares += diff * diff;
        }
        stdDev = Math.sqrt(squares / n);
    }

    /**
     * (value - mean) / stdDev. With a zero standard deviation the score is 0 when the value
     * equals the mean and undefined otherwise; it is also undefined without samples.
     */
    static OptionalDouble zScore(double value, double mean, double stdDev, int sampleCount) {
        if (sampleCount == 0) {
            return OptionalDouble.empty();
        }
        if (stdDev > EPSILON) {
            return OptionalDouble.of((value - mean) / stdDev);
        }
        if (Math.abs(value - mean) <= EPSILON) {
            return OptionalDouble.of(0.0);
        }
        return OptionalDouble.empty();
    }

    @Value
    public static class Snapshot {
        double mean;
        double stdDev;
        int sampleCount;

        public OptionalDouble zScore(double value) {
            return MovingStatistic.zScore(value, mean, stdDev, sampleCount);
        }

        public boolean hasSpread() {
            return stdDev > EPSILON;
        }
    }
}
