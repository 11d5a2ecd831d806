package com.wordsonphone.backend.customcategory.task;

import java.util.List;

public record QualityMetrics(
        int total,
        int high,
        int medium,
        int low,
        double averageScore,
        long elapsedMs
) {
    public static QualityMetrics of(List<ScoredCandidate> scored, double highThreshold, double mediumThreshold, long elapsedMs) {
        int high = 0, medium = 0, low = 0;
        double sum = 0;
        for (ScoredCandidate c : scored) {
            double s = c.total();
            sum += s;
            if (s >= highThreshold) high++;
            else if (s >= mediumThreshold) medium++;
            else low++;
        }
        int total = scored.size();
        double avg = (total == 0) ? 0 : sum / total;
        return new QualityMetrics(total, high, medium, low, avg, elapsedMs);
    }

    /** 0..1；空批次算 0 */
    public double highRatio() {
        return (total == 0) ? 0 : (double) high / total;
    }
}
