package com.team.formtest.model.run;

import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Point-in-time view of a test run. Instances handed to callers are copies;
 * the live state is owned by the executor running it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestRun {

    private String id;
    private String metadataRef;
    private Scenario scenario;
    private RunStatus status;
    private long seed;

    private List<GeneratedValue> generatedValues;
    private List<StepResult> steps;
    private List<Screenshot> screenshots;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;   // set iff status is terminal

    private ErrorKind errorKind;
    private String errorSummary;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Wall-clock time from start to finish, zero when the run never started.
     */
    public long durationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
