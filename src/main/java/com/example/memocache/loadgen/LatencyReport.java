package com.example.memocache.loadgen;

import java.util.Collection;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Summary of one load run. */
public class LatencyReport {

    private final long requests;
    private final long failures;
    private final double durationSeconds;
    private final DescriptiveStatistics stats = new DescriptiveStatistics();

    public LatencyReport(Collection<Double> latenciesMillis, long failures, double durationSeconds) {
        this.requests = latenciesMillis.size();
        this.failures = failures;
        this.durationSeconds = durationSeconds;
        latenciesMillis.forEach(stats::addValue);
    }

    public long getRequests() {
        return requests;
    }

    public long getFailures() {
        return failures;
    }

    public double throughput() {
        return durationSeconds <= 0 ? 0.0 : requests / durationSeconds;
    }

    public double percentile(double p) {
        return requests == 0 ? 0.0 : stats.getPercentile(p);
    }

    public double mean() {
        return requests == 0 ? 0.0 : stats.getMean();
    }

    @Override
    public String toString() {
        return String.format("Requests=%d, Failures=%d, RPS=%.1f, Avg=%.2fms, P95=%.2fms, P99=%.2fms",
            requests, failures, throughput(), mean(), percentile(95), percentile(99));
    }
}
