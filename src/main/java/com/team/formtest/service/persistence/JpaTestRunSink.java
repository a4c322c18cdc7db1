package com.team.formtest.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.formtest.config.PersistenceConfig;
import com.team.formtest.model.entity.ScreenshotRecord;
import com.team.formtest.model.entity.TestRunRecord;
import com.team.formtest.model.run.Screenshot;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.repository.ScreenshotRecordRepository;
import com.team.formtest.repository.TestRunRecordRepository;
import com.team.formtest.service.execution.RunCompletionListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes every finished run to the database. Failures are logged and never reach the run.
 *
 * A run and its screenshots are written in one transaction, so a failed write leaves no
 * partial record behind and the run can be stored again later.
 */
@Service
@Slf4j
public class JpaTestRunSink implements TestRunSink, RunCompletionListener {

    private final PersistenceConfig config;
    private final TestRunRecordRepository runRepo;
    private final ScreenshotRecordRepository screenshotRepo;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public JpaTestRunSink(PersistenceConfig config,
                          TestRunRecordRepository runRepo,
                          ScreenshotRecordRepository screenshotRepo,
                          ObjectMapper objectMapper,
                          PlatformTransactionManager transactionManager) {
        this.config = config;
        this.runRepo = runRepo;
        this.screenshotRepo = screenshotRepo;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void onRunCompleted(TestRun run) {
        store(run);
    }

    @Override
    public void store(TestRun run) {
        if (!config.isEnabled()) return;

        try {
            Boolean written = transactionTemplate.execute(status -> write(run));
            if (!Boolean.TRUE.equals(written)) {
                log.debug("[{}] Run already stored", run.getId());
            }
        } catch (Exception e) {
            log.warn("[{}] Storing run failed (run result unaffected): {}", run.getId(), e.getMessage());
        }
    }

    private boolean write(TestRun run) {
        if (runRepo.existsByRunId(run.getId())) {
            return false;
        }
        TestRunRecord record = runRepo.save(TestRunRecord.builder()
                .runId(run.getId())
                .metadataRef(run.getMetadataRef())
                .scenario(run.getScenario())
                .status(run.getStatus())
                .seed(run.getSeed())
                .errorKind(run.getErrorKind())
                .errorSummary(run.getErrorSummary())
                .stepsJson(toJson(run.getSteps()))
                .generatedValuesJson(toJson(run.getGeneratedValues()))
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .durationMs(run.durationMs())
                .build());

        if (run.getScreenshots() != null) {
            for (Screenshot screenshot : run.getScreenshots()) {
                screenshotRepo.save(ScreenshotRecord.builder()
                        .testRun(record)
                        .stage(screenshot.getStage())
                        .reference(screenshot.getReference())
                        .capturedAt(screenshot.getCapturedAt())
                        .build());
            }
        }
        log.info("[{}] Run stored ({} screenshots)", run.getId(),
                run.getScreenshots() != null ? run.getScreenshots().size() : 0);
        return true;
    }

    private String toJson(Object value) {
        try {
            return value != null ? objectMapper.writeValueAsString(value) : "[]";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run data: " + e.getOriginalMessage(), e);
        }
    }
}
