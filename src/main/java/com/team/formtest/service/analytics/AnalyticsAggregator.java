package com.team.formtest.service.analytics;

import com.team.formtest.config.AnalyticsConfig;
import com.team.formtest.model.analytics.AnalyticsSnapshot;
import com.team.formtest.model.analytics.FailureSummary;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.StepResult;
import com.team.formtest.model.run.StepStatus;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.service.execution.RunCompletionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling metrics over finished runs.
 *
 * Completed runs arrive as messages on the queue of the single-thread
 * {@code analyticsExecutor} and are folded in one run at a time, in constant work per run.
 * Readers take a consistent copy under the same lock.
 */
@Service
@Slf4j
public class AnalyticsAggregator implements RunCompletionListener {

    private static final double LOW_PASS_RATE = 0.9;
    private static final double SLOW_MEAN_DURATION_MS = 60_000;
    private static final double WEAK_FIELD_TYPE_RATE = 0.5;

    private final AnalyticsConfig config;
    private final ThreadPoolTaskExecutor executor;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition applied = lock.newCondition();

    // guarded by lock
    private long received;
    private long processed;
    private long totalRuns;
    private long totalDurationMs;
    private final Map<RunStatus, Long> runsByStatus = new EnumMap<>(RunStatus.class);
    private final Map<String, long[]> stepsByFieldType = new TreeMap<>();   // {attempted, failed}
    private final Map<String, Long> failureCategories = new TreeMap<>();
    private final Deque<FailureSummary> recentFailures = new ArrayDeque<>();

    public AnalyticsAggregator(AnalyticsConfig config,
                               @Qualifier("analyticsExecutor") ThreadPoolTaskExecutor executor) {
        this.config = config;
        this.executor = executor;
    }

    @Override
    public void onRunCompleted(TestRun run) {
        record(run);
    }

    /**
     * Enqueue a finished run. Never blocks; runs that are not terminal are ignored.
     */
    public void record(TestRun run) {
        if (run == null || !run.isTerminal()) {
            return;
        }
        lock.lock();
        try {
            received++;
        } finally {
            lock.unlock();
        }
        try {
            executor.execute(() -> apply(run));
        } catch (TaskRejectedException e) {
            log.warn("[{}] Analytics update dropped, executor is shut down", run.getId());
            markProcessed();
        }
    }

    /**
     * Wait until every run recorded so far has been folded in.
     *
     * @return false on timeout
     */
    public boolean flush(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (processed < received) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                applied.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public AnalyticsSnapshot snapshot() {
        lock.lock();
        try {
            double passRate = totalRuns == 0 ? 0.0 : (double) runsByStatus.getOrDefault(RunStatus.PASSED, 0L) / totalRuns;
            double meanDuration = totalRuns == 0 ? 0.0 : (double) totalDurationMs / totalRuns;

            Map<String, Double> failureRates = new LinkedHashMap<>();
            stepsByFieldType.forEach((type, counts) ->
                    failureRates.put(type, counts[0] == 0 ? 0.0 : (double) counts[1] / counts[0]));

            return AnalyticsSnapshot.builder()
                    .totalRuns(totalRuns)
                    .runsByStatus(new EnumMap<>(runsByStatus))
                    .passRate(passRate)
                    .failureRateByFieldType(failureRates)
                    .meanDurationMs(meanDuration)
                    .recentFailures(new ArrayList<>(recentFailures))
                    .failureCategories(new LinkedHashMap<>(failureCategories))
                    .recommendations(recommendations(passRate, meanDuration, failureRates))
                    .generatedAt(LocalDateTime.now())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void markProcessed() {
        lock.lock();
        try {
            processed++;
            applied.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void apply(TestRun run) {
        lock.lock();
        try {
            totalRuns++;
            totalDurationMs += run.durationMs();
            runsByStatus.merge(run.getStatus(), 1L, Long::sum);

            List<String> failedFields = new ArrayList<>();
            List<StepResult> steps = run.getSteps() != null ? run.getSteps() : List.of();
            for (StepResult step : steps) {
                String fieldType = step.getFieldType() != null ? step.getFieldType() : "unknown";
                long[] counts = stepsByFieldType.computeIfAbsent(fieldType, k -> new long[2]);
                counts[0]++;
                if (step.getStatus() != StepStatus.OK) {
                    counts[1]++;
                    failureCategories.merge(step.getStatus().name(), 1L, Long::sum);
                    failedFields.add(step.getFieldName());
                }
            }
            if (run.getErrorKind() != null) {
                failureCategories.merge(run.getErrorKind().name(), 1L, Long::sum);
            }

            if (run.getStatus() == RunStatus.FAILED || run.getStatus() == RunStatus.ERRORED) {
                recentFailures.addFirst(FailureSummary.builder()
                        .runId(run.getId())
                        .metadataRef(run.getMetadataRef())
                        .scenario(run.getScenario())
                        .status(run.getStatus())
                        .errorKind(run.getErrorKind())
                        .errorSummary(run.getErrorSummary())
                        .failedFields(failedFields)
                        .finishedAt(run.getFinishedAt())
                        .build());
                while (recentFailures.size() > Math.max(config.getRecentFailuresLimit(), 0)) {
                    recentFailures.removeLast();
                }
            }
            processed++;
            applied.signalAll();
        } catch (RuntimeException e) {
            // skip the run, keep consuming
            processed++;
            applied.signalAll();
            log.warn("[{}] Analytics update failed: {}", run.getId(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private List<String> recommendations(double passRate, double meanDurationMs, Map<String, Double> failureRates) {
        List<String> result = new ArrayList<>();
        if (totalRuns == 0) {
            result.add("No test runs recorded yet. Submit runs to start collecting metrics.");
            return result;
        }
        if (passRate < LOW_PASS_RATE) {
            result.add(String.format("Pass rate is %.1f%%. Investigate the most common failure patterns.", passRate * 100));
        }
        if (meanDurationMs > SLOW_MEAN_DURATION_MS) {
            result.add(String.format("Mean run duration is %.1f seconds. Consider tuning timeouts or splitting large forms.",
                    meanDurationMs / 1000));
        }
        failureCategories.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .ifPresent(top -> result.add(String.format(
                        "Most common failure is '%s' (%d occurrences). Focus on addressing it.", top.getKey(), top.getValue())));
        failureRates.forEach((type, rate) -> {
            if (rate > WEAK_FIELD_TYPE_RATE) {
                result.add(String.format("Fields of type '%s' fail in %.0f%% of steps. Check their locators.", type, rate * 100));
            }
        });
        if (result.isEmpty()) {
            result.add("System is performing well. Continue monitoring for emerging patterns.");
        }
        return result;
    }
}
