package com.team.formtest.model.analytics;

import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Short record of one failed or errored run, kept in the recent-failures list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureSummary {

    private String runId;
    private String metadataRef;
    private Scenario scenario;
    private RunStatus status;
    private ErrorKind errorKind;
    private String errorSummary;
    private List<String> failedFields;
    private LocalDateTime finishedAt;
}
