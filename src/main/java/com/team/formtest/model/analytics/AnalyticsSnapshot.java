package com.team.formtest.model.analytics;

import com.team.formtest.model.run.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the rolling run metrics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsSnapshot {

    private long totalRuns;
    private Map<RunStatus, Long> runsByStatus;
    private double passRate;                        // 0..1, 0 when no runs
    private Map<String, Double> failureRateByFieldType;   // failed steps / attempted steps
    private double meanDurationMs;
    private List<FailureSummary> recentFailures;    // newest first
    private Map<String, Long> failureCategories;    // step statuses and run error kinds
    private List<String> recommendations;
    private LocalDateTime generatedAt;
}
