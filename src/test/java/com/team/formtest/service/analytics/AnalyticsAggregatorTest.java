package com.team.formtest.service.analytics;

import com.team.formtest.config.AnalyticsConfig;
import com.team.formtest.model.analytics.AnalyticsSnapshot;
import com.team.formtest.model.analytics.FailureSummary;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.StepAction;
import com.team.formtest.model.run.StepResult;
import com.team.formtest.model.run.StepStatus;
import com.team.formtest.model.run.TestRun;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnalyticsAggregatorTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 6, 15, 10, 0);

    private ThreadPoolTaskExecutor executor;
    private AnalyticsAggregator aggregator;
    private int sequence;

    @BeforeEach
    void setUp() {
        AnalyticsConfig config = new AnalyticsConfig();
        config.setRecentFailuresLimit(3);
        executor = AnalyticsConfig.buildAnalyticsExecutor();
        executor.initialize();
        aggregator = new AnalyticsAggregator(config, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void emptySnapshotSuggestsSubmittingRuns() {
        AnalyticsSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.getTotalRuns()).isZero();
        assertThat(snapshot.getPassRate()).isZero();
        assertThat(snapshot.getRecentFailures()).isEmpty();
        assertThat(snapshot.getRecommendations()).singleElement().asString().startsWith("No test runs recorded yet");
    }

    @Test
    void countsRunsByStatusAndComputesRates() throws InterruptedException {
        aggregator.record(run(RunStatus.PASSED, null, 1_000, step("email", StepStatus.OK), step("age", StepStatus.OK)));
        aggregator.record(run(RunStatus.PASSED, null, 3_000, step("email", StepStatus.OK)));
        aggregator.record(run(RunStatus.FAILED, ErrorKind.REQUIRED_FIELD_FAILED, 2_000,
                step("email", StepStatus.ELEMENT_NOT_FOUND), step("age", StepStatus.OK)));
        aggregator.record(run(RunStatus.CANCELLED, ErrorKind.CANCELLED_BY_USER, 0));

        assertThat(aggregator.flush(Duration.ofSeconds(5))).isTrue();
        AnalyticsSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.getTotalRuns()).isEqualTo(4);
        assertThat(snapshot.getRunsByStatus())
                .containsEntry(RunStatus.PASSED, 2L)
                .containsEntry(RunStatus.FAILED, 1L)
                .containsEntry(RunStatus.CANCELLED, 1L);
        assertThat(snapshot.getPassRate()).isEqualTo(0.5);
        assertThat(snapshot.getMeanDurationMs()).isEqualTo(1_500.0);
        assertThat(snapshot.getFailureRateByFieldType().get("text")).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(snapshot.getFailureRateByFieldType().get("number")).isZero();
        assertThat(snapshot.getFailureCategories())
                .containsEntry("ELEMENT_NOT_FOUND", 1L)
                .containsEntry("REQUIRED_FIELD_FAILED", 1L)
                .containsEntry("CANCELLED_BY_USER", 1L);
    }

    @Test
    void keepsOnlyTheNewestFailures() throws InterruptedException {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            TestRun failed = run(RunStatus.ERRORED, ErrorKind.SUBMISSION_UNKNOWN, 100);
            ids.add(failed.getId());
            aggregator.record(failed);
        }
        aggregator.record(run(RunStatus.PASSED, null, 100));

        aggregator.flush(Duration.ofSeconds(5));
        List<FailureSummary> recent = aggregator.snapshot().getRecentFailures();

        assertThat(recent).extracting(FailureSummary::getRunId)
                .containsExactly(ids.get(4), ids.get(3), ids.get(2));
        assertThat(recent).allMatch(f -> f.getErrorKind() == ErrorKind.SUBMISSION_UNKNOWN);
    }

    @Test
    void failureSummaryNamesTheFailedFields() throws InterruptedException {
        aggregator.record(run(RunStatus.FAILED, ErrorKind.OUTCOME_MISMATCH, 100,
                step("email", StepStatus.TIMEOUT), step("age", StepStatus.OK)));

        aggregator.flush(Duration.ofSeconds(5));

        assertThat(aggregator.snapshot().getRecentFailures()).singleElement()
                .satisfies(f -> assertThat(f.getFailedFields()).containsExactly("email"));
    }

    @Test
    void ignoresRunsThatHaveNotFinished() throws InterruptedException {
        aggregator.record(TestRun.builder().id("live").status(RunStatus.RUNNING).build());

        aggregator.flush(Duration.ofSeconds(1));

        assertThat(aggregator.snapshot().getTotalRuns()).isZero();
    }

    @Test
    void lowPassRateAndWeakFieldTypeProduceRecommendations() throws InterruptedException {
        aggregator.record(run(RunStatus.FAILED, ErrorKind.OUTCOME_MISMATCH, 100, step("email", StepStatus.TIMEOUT)));
        aggregator.record(run(RunStatus.PASSED, null, 100, step("email", StepStatus.TIMEOUT)));

        aggregator.flush(Duration.ofSeconds(5));
        List<String> recommendations = aggregator.snapshot().getRecommendations();

        assertThat(recommendations).anyMatch(r -> r.startsWith("Pass rate is 50.0%"));
        assertThat(recommendations).anyMatch(r -> r.contains("'TIMEOUT'"));
        assertThat(recommendations).anyMatch(r -> r.startsWith("Fields of type 'text'"));
    }

    @Test
    void healthyRunsGetTheDefaultRecommendation() throws InterruptedException {
        aggregator.record(run(RunStatus.PASSED, null, 100, step("email", StepStatus.OK)));

        aggregator.flush(Duration.ofSeconds(5));

        assertThat(aggregator.snapshot().getRecommendations())
                .containsExactly("System is performing well. Continue monitoring for emerging patterns.");
    }

    @Test
    void concurrentProducersAreAllCounted() throws InterruptedException {
        ExecutorService producers = Executors.newFixedThreadPool(4);
        CountDownLatch ready = new CountDownLatch(1);
        List<TestRun> runs = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            runs.add(run(i % 2 == 0 ? RunStatus.PASSED : RunStatus.FAILED, null, 10, step("email", StepStatus.OK)));
        }
        for (TestRun r : runs) {
            producers.submit(() -> {
                ready.await();
                aggregator.record(r);
                return null;
            });
        }
        ready.countDown();
        producers.shutdown();
        assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(aggregator.flush(Duration.ofSeconds(5))).isTrue();
        AnalyticsSnapshot snapshot = aggregator.snapshot();

        assertThat(snapshot.getTotalRuns()).isEqualTo(200);
        assertThat(snapshot.getRunsByStatus()).containsEntry(RunStatus.PASSED, 100L).containsEntry(RunStatus.FAILED, 100L);
    }

    private TestRun run(RunStatus status, ErrorKind kind, long durationMs, StepResult... steps) {
        String id = "run-" + (++sequence);
        return TestRun.builder()
                .id(id)
                .metadataRef("signup")
                .scenario(Scenario.VALID)
                .status(status)
                .steps(List.of(steps))
                .generatedValues(List.of())
                .screenshots(List.of())
                .createdAt(T0)
                .startedAt(T0)
                .finishedAt(T0.plusNanos(durationMs * 1_000_000))
                .errorKind(kind)
                .errorSummary(kind != null ? kind.name() : null)
                .build();
    }

    private static StepResult step(String field, StepStatus status) {
        return StepResult.builder()
                .fieldName(field)
                .fieldType(field.equals("age") ? "number" : "text")
                .action(StepAction.FILL)
                .status(status)
                .build();
    }
}
