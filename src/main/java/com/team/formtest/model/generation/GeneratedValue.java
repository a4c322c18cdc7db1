package com.team.formtest.model.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One synthesized value for one field, tagged with the scenario it was made for and
 * the outcome the form is predicted to produce.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedValue {

    private String fieldName;
    private Scenario scenario;
    private FieldValue value;                 // null when not applicable
    private ExpectedOutcome expectedOutcome;  // null when not applicable
    private String description;               // what the value exercises, e.g. "max length 50"

    @Builder.Default
    private boolean applicable = true;        // false: field skipped for this scenario

    @Builder.Default
    private GenerationMethod method = GenerationMethod.RULE;

    public static GeneratedValue accept(String fieldName, Scenario scenario, FieldValue value, String description) {
        return GeneratedValue.builder()
                .fieldName(fieldName)
                .scenario(scenario)
                .value(value)
                .expectedOutcome(ExpectedOutcome.ACCEPT)
                .description(description)
                .build();
    }

    public static GeneratedValue reject(String fieldName, Scenario scenario, FieldValue value, String description) {
        return GeneratedValue.builder()
                .fieldName(fieldName)
                .scenario(scenario)
                .value(value)
                .expectedOutcome(ExpectedOutcome.REJECT)
                .description(description)
                .build();
    }

    public static GeneratedValue notApplicable(String fieldName, Scenario scenario, String reason) {
        return GeneratedValue.builder()
                .fieldName(fieldName)
                .scenario(scenario)
                .applicable(false)
                .description(reason)
                .build();
    }

    public boolean expectsReject() {
        return applicable && expectedOutcome == ExpectedOutcome.REJECT;
    }
}
