package com.team.formtest.service.persistence;

import com.team.formtest.config.PersistenceConfig;
import com.team.formtest.model.entity.ScreenshotRecord;
import com.team.formtest.model.entity.TestRunRecord;
import com.team.formtest.model.generation.FieldValue;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.Screenshot;
import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.StepAction;
import com.team.formtest.model.run.StepResult;
import com.team.formtest.model.run.StepStatus;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.repository.ScreenshotRecordRepository;
import com.team.formtest.repository.TestRunRecordRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaTestRunSink.class, PersistenceConfig.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class JpaTestRunSinkTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 6, 15, 10, 0);

    @Autowired
    private JpaTestRunSink sink;

    @Autowired
    private PersistenceConfig config;

    @Autowired
    private TestRunRecordRepository runRepo;

    @Autowired
    private ScreenshotRecordRepository screenshotRepo;

    @Test
    void storesRunWithStepsAndScreenshots() {
        sink.store(failedRun("r-1"));

        TestRunRecord record = runRepo.findByRunId("r-1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(record.getErrorKind()).isEqualTo(ErrorKind.OUTCOME_MISMATCH);
        assertThat(record.getScenario()).isEqualTo(Scenario.INVALID);
        assertThat(record.getDurationMs()).isEqualTo(2_500);
        assertThat(record.getStepsJson()).contains("\"fieldName\":\"email\"").contains("TIMEOUT");
        assertThat(record.getGeneratedValuesJson()).contains("not-an-email");

        List<ScreenshotRecord> screenshots = screenshotRepo.findByTestRunRunIdOrderByCapturedAtAsc("r-1");
        assertThat(screenshots).extracting(ScreenshotRecord::getStage)
                .containsExactly(ScreenshotStage.BEFORE, ScreenshotStage.ERROR);
    }

    @Test
    void storingTheSameRunTwiceKeepsOneRecord() {
        sink.onRunCompleted(failedRun("r-2"));
        sink.onRunCompleted(failedRun("r-2"));

        assertThat(runRepo.countByStatus(RunStatus.FAILED)).isEqualTo(1);
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void failedScreenshotWriteLeavesNoRunRecord() {
        TestRun run = failedRun("r-6");
        run.setScreenshots(List.of(
                new Screenshot(ScreenshotStage.BEFORE, "screenshots/before.png", T0.plusSeconds(1)),
                new Screenshot(ScreenshotStage.ERROR, "screenshots/" + "x".repeat(1200) + ".png", T0.plusSeconds(2))));

        sink.onRunCompleted(run);

        assertThat(runRepo.existsByRunId("r-6")).isFalse();
        assertThat(screenshotRepo.findByTestRunRunIdOrderByCapturedAtAsc("r-6")).isEmpty();
    }

    @Test
    void disabledSinkStoresNothing() {
        config.setEnabled(false);
        try {
            sink.store(failedRun("r-3"));
        } finally {
            config.setEnabled(true);
        }

        assertThat(runRepo.existsByRunId("r-3")).isFalse();
    }

    @Test
    void runsAreListedNewestFirstPerForm() {
        TestRun older = failedRun("r-4");
        TestRun newer = failedRun("r-5");
        newer.setFinishedAt(T0.plusMinutes(5));

        sink.store(older);
        sink.store(newer);

        assertThat(runRepo.findByMetadataRefOrderByFinishedAtDesc("signup"))
                .extracting(TestRunRecord::getRunId)
                .containsExactly("r-5", "r-4");
    }

    private static TestRun failedRun(String id) {
        return TestRun.builder()
                .id(id)
                .metadataRef("signup")
                .scenario(Scenario.INVALID)
                .status(RunStatus.FAILED)
                .seed(7L)
                .generatedValues(List.of(
                        GeneratedValue.reject("email", Scenario.INVALID, FieldValue.ofText("not-an-email"), "malformed")))
                .steps(List.of(StepResult.builder()
                        .fieldName("email").fieldType("email").action(StepAction.FILL)
                        .status(StepStatus.TIMEOUT).timestampOffsetMs(120).detail("timed out")
                        .build()))
                .screenshots(List.of(
                        new Screenshot(ScreenshotStage.BEFORE, "screenshots/before.png", T0.plusSeconds(1)),
                        new Screenshot(ScreenshotStage.ERROR, "screenshots/error.png", T0.plusSeconds(2))))
                .createdAt(T0)
                .startedAt(T0)
                .finishedAt(T0.plusNanos(2_500_000_000L))
                .errorKind(ErrorKind.OUTCOME_MISMATCH)
                .errorSummary("Form accepted values expected to be rejected: email")
                .build();
    }
}
