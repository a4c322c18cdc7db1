package com.team.formtest.model.run;

public enum StepAction {
    FILL,
    SELECT,
    CHECK,
    UPLOAD,
    SKIP,
    SUBMIT
}
