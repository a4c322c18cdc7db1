package com.team.formtest.model.run;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of applying one generated value to one field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepResult {

    private String fieldName;
    private String fieldType;       // semantic type name, used by analytics
    private StepAction action;
    private StepStatus status;
    private long timestampOffsetMs; // since the run started
    private String detail;          // error message for non-OK steps
}
