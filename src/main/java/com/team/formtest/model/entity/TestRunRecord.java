package com.team.formtest.model.entity;

import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored copy of a finished test run.
 */
@Entity
@Table(name = "form_test_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String runId;

    private String metadataRef;

    @Enumerated(EnumType.STRING)
    private Scenario scenario;

    @Enumerated(EnumType.STRING)
    private RunStatus status;

    private long seed;

    @Enumerated(EnumType.STRING)
    private ErrorKind errorKind;

    @Column(length = 2000)
    private String errorSummary;

    /** StepResult list as JSON */
    @Lob
    private String stepsJson;

    /** GeneratedValue list as JSON */
    @Lob
    private String generatedValuesJson;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private long durationMs;
}
