package com.team.formtest.model.run;

public enum StepStatus {
    OK,
    ELEMENT_NOT_FOUND,
    VALUE_REJECTED_BY_UI,
    TIMEOUT
}
