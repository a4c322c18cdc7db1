package com.team.formtest.service.execution;

import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.SubmissionOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides PASSED or FAILED by comparing the page's reaction with the run's values,
 * all-or-nothing: a run expects rejection as soon as one applied value expects it.
 *
 * A value the input itself refused while filling (maxlength truncation, an option that is
 * not offered) already counts as its expected rejection; the page only has to reject the
 * values that got through.
 */
@Component
public class OutcomeJudge {

    public Verdict judge(List<GeneratedValue> values, SubmissionOutcome outcome, List<String> failedRequiredFields) {
        return judge(values, outcome, failedRequiredFields, List.of());
    }

    public Verdict judge(List<GeneratedValue> values, SubmissionOutcome outcome, List<String> failedRequiredFields,
                         List<String> rejectedByUi) {
        if (!failedRequiredFields.isEmpty()) {
            return new Verdict(RunStatus.FAILED, ErrorKind.REQUIRED_FIELD_FAILED,
                    "Required field(s) could not be filled: " + String.join(", ", failedRequiredFields));
        }

        String rejecting = values.stream()
                .filter(GeneratedValue::expectsReject)
                .map(GeneratedValue::getFieldName)
                .filter(name -> !rejectedByUi.contains(name))
                .collect(Collectors.joining(", "));
        boolean expectReject = !rejecting.isEmpty();
        boolean rejectedWhileFilling = !rejectedByUi.isEmpty();

        return switch (outcome) {
            case SUCCESS -> expectReject
                    ? new Verdict(RunStatus.FAILED, ErrorKind.OUTCOME_MISMATCH,
                            "Form accepted values expected to be rejected: " + rejecting)
                    : new Verdict(RunStatus.PASSED, null, null);
            case VALIDATION_ERROR -> expectReject || rejectedWhileFilling
                    ? new Verdict(RunStatus.PASSED, null, null)
                    : new Verdict(RunStatus.FAILED, ErrorKind.OUTCOME_MISMATCH,
                            "Form rejected values expected to be accepted");
            case UNKNOWN -> new Verdict(RunStatus.ERRORED, ErrorKind.SUBMISSION_UNKNOWN,
                    "Submission outcome could not be read");
        };
    }
}
